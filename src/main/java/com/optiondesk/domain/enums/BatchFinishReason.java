package com.optiondesk.domain.enums;

/** Which completion path finalized a greeks snapshot batch. */
public enum BatchFinishReason {
    /** No tick arrived for the settle delay after the last one. */
    SETTLED,
    /** The absolute ceiling measured from batch start was reached. */
    HARD_TIMEOUT,
    /** Every contract reported snapshot end or an error. */
    ALL_COMPLETED
}
