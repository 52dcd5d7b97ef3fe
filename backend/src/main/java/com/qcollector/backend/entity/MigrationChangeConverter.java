package com.qcollector.backend.entity;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.qcollector.backend.util.JsonColumns;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter
public class MigrationChangeConverter implements AttributeConverter<MigrationChange, String> {

    @Override
    public String convertToDatabaseColumn(MigrationChange attribute) {
        if (attribute == null) {
            return null;
        }
        try {
            // Serialize through the interface so the type discriminator is written.
            return JsonColumns.mapper().writerFor(MigrationChange.class).writeValueAsString(attribute);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize migration payload", e);
        }
    }

    @Override
    public MigrationChange convertToEntityAttribute(String dbData) {
        if (dbData == null || dbData.isBlank()) {
            return null;
        }
        try {
            return JsonColumns.mapper().readValue(dbData, MigrationChange.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unreadable migration payload", e);
        }
    }
}
