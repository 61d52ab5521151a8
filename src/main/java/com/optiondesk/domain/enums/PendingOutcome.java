package com.optiondesk.domain.enums;

/** How a correlated gateway request left the pending table. */
public enum PendingOutcome {
    COMPLETED,
    TIMED_OUT
}
