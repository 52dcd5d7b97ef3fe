package com.qcollector.backend.entity;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * One row of a column snapshot: the row's primary key and the value the column held.
 * Both are kept as JSON so numbers, strings and nested values survive a round trip untouched.
 */
public record SnapshotEntry(JsonNode rowId, JsonNode value) {
}
