package com.payshield.gleaner.domain;

import java.time.LocalDate;
import java.util.Objects;

/**
 * An anomaly alert emitted by a detector, before the output step attaches an identifier.
 *
 * @param emissionDate day the alert refers to
 * @param text         human readable alert message
 * @param type         kind of anomaly
 * @param location     whether the alert is about a single invoice or the vendor as a whole
 * @param invoiceId    invoice that triggered the alert, {@code null} for vendor-level cadence alerts
 * @param vendorId     canonical vendor id
 */
public record Glean(LocalDate emissionDate,
                    String text,
                    GleanType type,
                    GleanLocation location,
                    String invoiceId,
                    String vendorId) {

    public Glean {
        Objects.requireNonNull(emissionDate, "emissionDate");
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(location, "location");
        Objects.requireNonNull(vendorId, "vendorId");
    }

    public static Glean forInvoice(LocalDate emissionDate, String text, GleanType type,
                                   String invoiceId, String vendorId) {
        return new Glean(emissionDate, text, type, GleanLocation.INVOICE, invoiceId, vendorId);
    }

    public static Glean forVendor(LocalDate emissionDate, String text, GleanType type,
                                  String invoiceId, String vendorId) {
        return new Glean(emissionDate, text, type, GleanLocation.VENDOR, invoiceId, vendorId);
    }
}
