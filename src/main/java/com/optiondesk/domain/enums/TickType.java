package com.optiondesk.domain.enums;

import java.util.HashMap;
import java.util.Map;

/**
 * Gateway tick type codes this service understands. Live and delayed variants are folded
 * together through the predicate methods so accumulators never look at raw codes.
 */
public enum TickType {
    BID(1),
    ASK(2),
    LAST(4),
    CLOSE(9),
    BID_OPTION_COMPUTATION(10),
    ASK_OPTION_COMPUTATION(11),
    LAST_OPTION_COMPUTATION(12),
    MODEL_OPTION_COMPUTATION(13),
    OPTION_CALL_OPEN_INTEREST(27),
    OPTION_PUT_OPEN_INTEREST(28),
    DELAYED_BID(66),
    DELAYED_ASK(67),
    DELAYED_LAST(68),
    DELAYED_CLOSE(75),
    DELAYED_BID_OPTION_COMPUTATION(80),
    DELAYED_ASK_OPTION_COMPUTATION(81),
    DELAYED_LAST_OPTION_COMPUTATION(82),
    DELAYED_MODEL_OPTION_COMPUTATION(83),
    UNKNOWN(-1);

    private static final Map<Integer, TickType> BY_CODE = new HashMap<>();

    static {
        for (TickType type : values()) {
            BY_CODE.put(type.code, type);
        }
    }

    private final int code;

    TickType(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }

    public static TickType fromCode(int code) {
        return BY_CODE.getOrDefault(code, UNKNOWN);
    }

    public boolean isBid() {
        return this == BID || this == DELAYED_BID;
    }

    public boolean isAsk() {
        return this == ASK || this == DELAYED_ASK;
    }

    public boolean isLast() {
        return this == LAST || this == DELAYED_LAST;
    }

    public boolean isClose() {
        return this == CLOSE || this == DELAYED_CLOSE;
    }

    /** Model computation (13/83) outranks the bid/ask/last computations. */
    public boolean isModelComputation() {
        return this == MODEL_OPTION_COMPUTATION || this == DELAYED_MODEL_OPTION_COMPUTATION;
    }

    public boolean isOptionComputation() {
        return switch (this) {
            case BID_OPTION_COMPUTATION,
                    ASK_OPTION_COMPUTATION,
                    LAST_OPTION_COMPUTATION,
                    MODEL_OPTION_COMPUTATION,
                    DELAYED_BID_OPTION_COMPUTATION,
                    DELAYED_ASK_OPTION_COMPUTATION,
                    DELAYED_LAST_OPTION_COMPUTATION,
                    DELAYED_MODEL_OPTION_COMPUTATION -> true;
            default -> false;
        };
    }

    public boolean isOpenInterest() {
        return this == OPTION_CALL_OPEN_INTEREST || this == OPTION_PUT_OPEN_INTEREST;
    }
}
