package com.gauchoplan.backend.modules.catalog.domain;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes the canonical level names. Reads are lenient because ingestion tools store the level
 * text they scraped; unrecognised values load as no level.
 */
@Converter
public class CourseLevelConverter implements AttributeConverter<CourseLevel, String> {

    private static final Logger log = LoggerFactory.getLogger(CourseLevelConverter.class);

    @Override
    public String convertToDatabaseColumn(CourseLevel attribute) {
        return attribute == null ? null : attribute.getDisplayName();
    }

    @Override
    public CourseLevel convertToEntityAttribute(String dbData) {
        if (dbData == null || dbData.isBlank()) {
            return null;
        }
        CourseLevel level = CourseLevel.fromStoredValue(dbData).orElse(null);
        if (level == null) {
            log.warn("Ignoring unrecognised course level '{}'", dbData);
        }
        return level;
    }
}
