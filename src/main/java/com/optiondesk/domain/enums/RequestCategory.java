package com.optiondesk.domain.enums;

/**
 * Request id ranges per request category.
 *
 * <p>Ranges are disjoint, so an id read from a captured gateway log tells you which component
 * issued it. ORDER sits at the top of the int space because order ids are persisted by the
 * gateway and must keep increasing across sessions.
 */
public enum RequestCategory {
    STOCK_QUOTE(100_000_000, 200_000_000),
    OPTION_QUOTE(200_000_000, 300_000_000),
    CHAIN(300_000_000, 400_000_000),
    CONTRACT(400_000_000, 500_000_000),
    GREEKS(500_000_000, 600_000_000),
    ROLL_RESOLUTION(600_000_000, 700_000_000),
    ORDER(1_000_000_000, Integer.MAX_VALUE);

    private final int rangeStart;

    /** Exclusive upper bound. */
    private final int rangeEnd;

    RequestCategory(int rangeStart, int rangeEnd) {
        this.rangeStart = rangeStart;
        this.rangeEnd = rangeEnd;
    }

    public int getRangeStart() {
        return rangeStart;
    }

    public int getRangeEnd() {
        return rangeEnd;
    }

    public boolean contains(int requestId) {
        return requestId >= rangeStart && requestId < rangeEnd;
    }
}
