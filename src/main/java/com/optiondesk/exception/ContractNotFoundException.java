package com.optiondesk.exception;

import java.util.Map;

public class ContractNotFoundException extends BaseException {

    public ContractNotFoundException(String contractKey, String reason) {
        super(
                ErrorCode.CONTRACT_NOT_FOUND,
                String.format("Contract not found: %s (%s)", contractKey, reason),
                Map.of("contract", contractKey));
    }
}
