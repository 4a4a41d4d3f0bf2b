package org.quarry.history.repository;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Named parameters of a statement. Null values carry their SQL type so drivers can bind them.
 */
public final class StatementParams {

    private final Map<String, Param> values = new LinkedHashMap<>();

    public static StatementParams empty() {
        return new StatementParams();
    }

    public static StatementParams of(String name, Object value) {
        return new StatementParams().bind(name, value);
    }

    public StatementParams bind(String name, Object value) {
        Objects.requireNonNull(value, () -> "Null value for parameter " + name + ", use bindNullable");
        values.put(name, new Param(value, value.getClass()));
        return this;
    }

    public StatementParams bindNullable(String name, Object value, Class<?> type) {
        values.put(name, new Param(value, type));
        return this;
    }

    public Map<String, Param> asMap() {
        return Collections.unmodifiableMap(values);
    }

    @Override
    public String toString() {
        return values.keySet().toString();
    }

    public record Param(Object value, Class<?> type) {

        public boolean isNull() {
            return value == null;
        }
    }
}
