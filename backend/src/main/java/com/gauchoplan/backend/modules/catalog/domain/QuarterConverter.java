package com.gauchoplan.backend.modules.catalog.domain;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * Stores quarters in the title-case form the schema documents ("Winter"). Stored values written
 * by other tools may carry a suffix ("Fall Quarter").
 */
@Converter
public class QuarterConverter implements AttributeConverter<Quarter, String> {

    @Override
    public String convertToDatabaseColumn(Quarter attribute) {
        return attribute == null ? null : attribute.getDisplayName();
    }

    @Override
    public Quarter convertToEntityAttribute(String dbData) {
        return dbData == null ? null : Quarter.fromStoredValue(dbData);
    }
}
