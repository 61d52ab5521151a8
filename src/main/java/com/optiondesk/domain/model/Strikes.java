package com.optiondesk.domain.model;

import java.math.BigDecimal;

/**
 * Strike normalisation helpers.
 *
 * <p>{@link BigDecimal#equals} is scale-sensitive (590 != 590.0), so every strike used as a map
 * key or cache key goes through {@link #normalize} first.
 */
public final class Strikes {

    private Strikes() {}

    public static BigDecimal normalize(BigDecimal strike) {
        if (strike == null) {
            throw new IllegalArgumentException("strike must not be null");
        }
        BigDecimal stripped = strike.stripTrailingZeros();
        return stripped.scale() < 0 ? stripped.setScale(0) : stripped;
    }

    /** Plain rendering without exponent or trailing zeros: 590, 592.5. */
    public static String format(BigDecimal strike) {
        return normalize(strike).toPlainString();
    }

    /** Standard strikes are whole or half-dollar increments. */
    public static boolean isStandard(BigDecimal strike) {
        return strike.multiply(BigDecimal.valueOf(2)).stripTrailingZeros().scale() <= 0;
    }
}
