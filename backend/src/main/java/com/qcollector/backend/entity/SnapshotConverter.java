package com.qcollector.backend.entity;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.qcollector.backend.util.JsonColumns;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Stores a snapshot as a JSON array of {@code {"rowId": ..., "value": ...}} objects.
 * Anything other than an array on the way back is reported as {@code null}.
 */
@Converter
@Slf4j
public class SnapshotConverter implements AttributeConverter<List<SnapshotEntry>, String> {

    @Override
    public String convertToDatabaseColumn(List<SnapshotEntry> attribute) {
        ArrayNode array = JsonColumns.mapper().createArrayNode();
        if (attribute != null) {
            for (SnapshotEntry entry : attribute) {
                ObjectNode item = array.addObject();
                item.set("rowId", entry.rowId());
                item.set("value", entry.value() == null ? NullNode.getInstance() : entry.value());
            }
        }
        return array.toString();
    }

    @Override
    public List<SnapshotEntry> convertToEntityAttribute(String dbData) {
        JsonNode node = JsonColumns.readTree(dbData);
        if (node == null || !node.isArray()) {
            if (node != null) {
                log.warn("[BACKUP] stored snapshot is not an array (found {})", node.getNodeType());
            }
            return null;
        }
        List<SnapshotEntry> entries = new ArrayList<>(node.size());
        for (JsonNode item : node) {
            entries.add(new SnapshotEntry(item.get("rowId"), item.get("value")));
        }
        return entries;
    }
}
