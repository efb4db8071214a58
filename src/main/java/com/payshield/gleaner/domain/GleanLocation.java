package com.payshield.gleaner.domain;

public enum GleanLocation {
    INVOICE("invoice"),
    VENDOR("vendor");

    private final String code;

    GleanLocation(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public static GleanLocation fromCode(String code) {
        for (GleanLocation value : values()) {
            if (value.code.equals(code)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown GleanLocation code: " + code);
    }
}
