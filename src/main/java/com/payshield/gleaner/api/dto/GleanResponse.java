package com.payshield.gleaner.api.dto;

import com.payshield.gleaner.domain.Glean;
import com.payshield.gleaner.domain.GleanRecord;

import java.time.LocalDate;
import java.util.UUID;

public record GleanResponse(
        UUID gleanId,
        LocalDate gleanDate,
        String gleanText,
        String gleanType,
        String gleanLocation,
        String invoiceId,
        String canonicalVendorId
) {
    public static GleanResponse from(GleanRecord record) {
        Glean g = record.glean();
        return new GleanResponse(
                record.gleanId(),
                g.emissionDate(),
                g.text(),
                g.type().code(),
                g.location().code(),
                g.invoiceId(),
                g.vendorId());
    }
}
