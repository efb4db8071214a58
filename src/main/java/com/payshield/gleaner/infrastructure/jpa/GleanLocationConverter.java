package com.payshield.gleaner.infrastructure.jpa;

import com.payshield.gleaner.domain.GleanLocation;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter
public class GleanLocationConverter implements AttributeConverter<GleanLocation, String> {

    @Override
    public String convertToDatabaseColumn(GleanLocation location) {
        return location == null ? null : location.code();
    }

    @Override
    public GleanLocation convertToEntityAttribute(String code) {
        return code == null ? null : GleanLocation.fromCode(code);
    }
}
