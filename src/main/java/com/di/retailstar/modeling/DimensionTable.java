package com.di.retailstar.modeling;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A built dimension: its rows in surrogate-key order plus the natural-key to surrogate-key
 * index the fact builder joins against.
 *
 * @param <K> natural key type
 * @param <R> row type
 */
public final class DimensionTable<K, R> {

    private final String name;
    private final List<R> rows;
    private final Map<K, Long> keyIndex;

    public DimensionTable(String name, List<R> rows, Map<K, Long> keyIndex) {
        this.name = name;
        this.rows = List.copyOf(rows);
        this.keyIndex = Collections.unmodifiableMap(new LinkedHashMap<>(keyIndex));
    }

    public String getName() {
        return name;
    }

    public List<R> getRows() {
        return rows;
    }

    public int size() {
        return rows.size();
    }

    /** Surrogate key for a natural key, empty when the dimension has no such member. */
    public Optional<Long> lookup(K naturalKey) {
        if (naturalKey == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(keyIndex.get(naturalKey));
    }

    public Map<K, Long> getKeyIndex() {
        return keyIndex;
    }
}
