package com.optiondesk.domain.enums;

/** Gateway security types used by this service. BAG is a multi-leg combo. */
public enum SecurityType {
    STK,
    OPT,
    BAG
}
