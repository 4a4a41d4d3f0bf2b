package org.quarry.history.repository;

import java.util.Map;
import java.util.TreeMap;

/**
 * One result row. Column lookup ignores case since H2 reports upper-case labels
 * and PostgreSQL lower-case ones.
 */
public final class StorageRow {

    private final Map<String, Object> columns = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);

    private StorageRow(Map<String, ?> columns) {
        this.columns.putAll(columns);
    }

    public static StorageRow of(Map<String, ?> columns) {
        return new StorageRow(columns);
    }

    public Object get(String column) {
        return columns.get(column);
    }

    public String getString(String column) {
        Object value = columns.get(column);
        return value == null ? null : value.toString();
    }

    public Long getLong(String column) {
        Object value = columns.get(column);
        if (value == null) {
            return null;
        }
        if (value instanceof Number number) {
            return number.longValue();
        }
        return Long.valueOf(value.toString());
    }

    public long getLong(String column, long defaultValue) {
        Long value = getLong(column);
        return value == null ? defaultValue : value;
    }

    public Integer getInt(String column) {
        Long value = getLong(column);
        return value == null ? null : value.intValue();
    }

    public boolean getBoolean(String column) {
        Object value = columns.get(column);
        if (value instanceof Boolean bool) {
            return bool;
        }
        if (value instanceof Number number) {
            return number.intValue() != 0;
        }
        return value != null && Boolean.parseBoolean(value.toString());
    }

    @Override
    public String toString() {
        return columns.toString();
    }
}
