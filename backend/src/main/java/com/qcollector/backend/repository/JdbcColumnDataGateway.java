package com.qcollector.backend.repository;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.qcollector.backend.config.MigrationProperties;
import com.qcollector.backend.entity.SnapshotEntry;
import com.qcollector.backend.util.JsonColumns;
import com.qcollector.backend.util.SqlIdentifiers;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Date;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Time;
import java.sql.Timestamp;
import java.util.List;
import java.util.UUID;

/**
 * Row-level access to the dynamic form tables. Table and column names are validated
 * identifiers, values always travel as bind parameters.
 */
@Repository
@RequiredArgsConstructor
@Slf4j
public class JdbcColumnDataGateway implements ColumnSnapshotReader, ColumnRestoreWriter {

    private final JdbcTemplate jdbcTemplate;
    private final MigrationProperties properties;

    @Override
    @Transactional(readOnly = true)
    public List<SnapshotEntry> readColumn(String tableName, String columnName) {
        String sql = "SELECT id, " + SqlIdentifiers.quote(columnName)
                + " FROM " + SqlIdentifiers.quote(tableName) + " ORDER BY id";
        List<SnapshotEntry> rows = jdbcTemplate.query(sql, (rs, rowNum) -> toEntry(rs));
        log.debug("[BACKUP] read {} rows from {}.{}", rows.size(), tableName, columnName);
        return rows;
    }

    @Override
    @Transactional
    public int restoreColumn(String tableName, String columnName, List<SnapshotEntry> entries) {
        String sql = "UPDATE " + SqlIdentifiers.quote(tableName)
                + " SET " + SqlIdentifiers.quote(columnName) + " = ? WHERE id = ?";
        int[][] results = jdbcTemplate.batchUpdate(sql, entries, properties.getBackup().getRestoreBatchSize(),
                (ps, entry) -> {
                    ps.setObject(1, toJdbcValue(entry.value()));
                    ps.setObject(2, toJdbcValue(entry.rowId()));
                });
        int updated = 0;
        for (int[] batch : results) {
            for (int count : batch) {
                if (count == Statement.SUCCESS_NO_INFO) {
                    updated++;
                } else if (count > 0) {
                    updated += count;
                }
            }
        }
        return updated;
    }

    private SnapshotEntry toEntry(ResultSet rs) throws SQLException {
        return new SnapshotEntry(toJsonNode(rs.getObject(1)), toJsonNode(rs.getObject(2)));
    }

    static JsonNode toJsonNode(Object value) {
        if (value == null) {
            return NullNode.getInstance();
        }
        Object normalized = value;
        if (value instanceof Timestamp timestamp) {
            normalized = timestamp.toLocalDateTime();
        } else if (value instanceof Date date) {
            normalized = date.toLocalDate();
        } else if (value instanceof Time time) {
            normalized = time.toLocalTime();
        } else if (value instanceof UUID uuid) {
            normalized = uuid.toString();
        } else if (!(value instanceof Number || value instanceof String || value instanceof Boolean)) {
            normalized = value.toString();
        }
        return JsonColumns.mapper().valueToTree(normalized);
    }

    static Object toJdbcValue(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isTextual()) {
            return node.textValue();
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isNumber()) {
            return node.numberValue();
        }
        return node.toString();
    }
}
