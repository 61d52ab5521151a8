package com.optiondesk.domain.enums;

/** Call or put. The gateway encodes these as "C" and "P". */
public enum OptionRight {
    CALL("C"),
    PUT("P");

    private final String code;

    OptionRight(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    /**
     * Parses the gateway's single-letter code (also accepts the full enum name).
     *
     * @throws IllegalArgumentException for anything else
     */
    public static OptionRight fromCode(String code) {
        if (code != null) {
            for (OptionRight right : values()) {
                if (right.code.equalsIgnoreCase(code) || right.name().equalsIgnoreCase(code)) {
                    return right;
                }
            }
        }
        throw new IllegalArgumentException("Unknown option right: " + code);
    }
}
