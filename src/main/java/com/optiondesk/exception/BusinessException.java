package com.optiondesk.exception;

import java.util.Map;

public class BusinessException extends BaseException {

    public BusinessException(String message) {
        super(ErrorCode.BAD_REQUEST, message);
    }

    public BusinessException(String message, Map<String, Object> details) {
        super(ErrorCode.BAD_REQUEST, message, details);
    }
}
