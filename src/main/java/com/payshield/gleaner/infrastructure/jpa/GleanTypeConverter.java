package com.payshield.gleaner.infrastructure.jpa;

import com.payshield.gleaner.domain.GleanType;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * Stores {@link GleanType} as its lowercase code, the same value the CSV export writes.
 */
@Converter
public class GleanTypeConverter implements AttributeConverter<GleanType, String> {

    @Override
    public String convertToDatabaseColumn(GleanType type) {
        return type == null ? null : type.code();
    }

    @Override
    public GleanType convertToEntityAttribute(String code) {
        return code == null ? null : GleanType.fromCode(code);
    }
}
