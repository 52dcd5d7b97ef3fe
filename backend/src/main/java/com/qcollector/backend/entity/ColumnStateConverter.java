package com.qcollector.backend.entity;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.qcollector.backend.util.JsonColumns;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter
public class ColumnStateConverter implements AttributeConverter<ColumnState, String> {

    @Override
    public String convertToDatabaseColumn(ColumnState attribute) {
        return JsonColumns.write(attribute);
    }

    @Override
    public ColumnState convertToEntityAttribute(String dbData) {
        if (dbData == null || dbData.isBlank()) {
            return null;
        }
        try {
            return JsonColumns.mapper().readValue(dbData, ColumnState.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unreadable column state: " + dbData, e);
        }
    }
}
