package com.di.retailstar.rowset;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One record of a {@link RowSet}: field name to value, in column order.
 *
 * <p>Values are {@code String}, {@code Long}, {@code Integer}, {@code Double}, {@code Boolean},
 * {@code LocalDateTime} or {@code null} for a missing value. Two rows are equal when
 * they carry the same fields with equal values.
 */
public final class Row {

    private final LinkedHashMap<String, Object> values;

    public Row() {
        this.values = new LinkedHashMap<>();
    }

    public Row(Map<String, ?> values) {
        this.values = new LinkedHashMap<>(values);
    }

    public static Row of(Map<String, ?> values) {
        return new Row(values);
    }

    public Object get(String column) {
        return values.get(column);
    }

    public boolean isMissing(String column) {
        return values.get(column) == null;
    }

    public Row set(String column, Object value) {
        values.put(column, value);
        return this;
    }

    public boolean has(String column) {
        return values.containsKey(column);
    }

    public Map<String, Object> asMap() {
        return Collections.unmodifiableMap(values);
    }

    public Row copy() {
        return new Row(values);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Row)) return false;
        return values.equals(((Row) o).values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(values);
    }

    @Override
    public String toString() {
        return "Row" + values;
    }
}
