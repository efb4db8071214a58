package com.payshield.gleaner.domain;

public enum GleanType {
    VENDOR_NOT_SEEN_IN_A_WHILE("vendor_not_seen_in_a_while"),
    ACCRUAL_ALERT("accrual_alert"),
    LARGE_MONTH_INCREASE_MTD("large_month_increase_mtd"),
    NO_INVOICE_RECEIVED("no_invoice_received");

    private final String code;

    GleanType(String code) {
        this.code = code;
    }

    /** Value written to the {@code glean_type} column. */
    public String code() {
        return code;
    }

    public static GleanType fromCode(String code) {
        for (GleanType value : values()) {
            if (value.code.equals(code)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown GleanType code: " + code);
    }
}
