package com.example.revenuesync.model;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.Map;

/**
 * A raw row from the source query. Column values keep their JDBC types.
 */
public record SourceRecord(long key, LocalDateTime changedAt, Map<String, Object> columns) {

    public SourceRecord {
        columns = Collections.unmodifiableMap(columns);
    }

    public Object get(String column) {
        return columns.get(column);
    }

    public Watermark position() {
        return Watermark.of(changedAt, key);
    }
}
