package com.di.retailstar.rowset;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Ordered sequence of {@link Row}s sharing a column schema.
 *
 * <p>Row order is significant: every "first-seen" attribute and every surrogate key is
 * assigned by position in this sequence, so stages must preserve it unless they remove rows.
 *
 * <p>A stage that receives a RowSet owns it and may mutate it in place; callers must not
 * keep a reference to a RowSet they handed to the next stage.
 */
public final class RowSet implements Iterable<Row> {

    private final LinkedHashSet<String> columns;
    private final List<Row> rows;

    public RowSet(Collection<String> columns) {
        this(columns, new ArrayList<>());
    }

    public RowSet(Collection<String> columns, List<Row> rows) {
        this.columns = new LinkedHashSet<>(columns);
        this.rows = new ArrayList<>(rows);
    }

    public List<String> getColumns() {
        return List.copyOf(columns);
    }

    public boolean hasColumn(String column) {
        return columns.contains(column);
    }

    /** Required columns absent from this RowSet, in the order they were requested. */
    public List<String> missingColumns(Collection<String> required) {
        return required.stream()
                .filter(c -> !columns.contains(c))
                .distinct()
                .collect(Collectors.toList());
    }

    /** Registers a derived column; existing rows are not touched. */
    public void addColumn(String column) {
        columns.add(column);
    }

    public void add(Row row) {
        rows.add(row);
    }

    public Row get(int index) {
        return rows.get(index);
    }

    public int size() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public List<Row> getRows() {
        return Collections.unmodifiableList(rows);
    }

    public Stream<Row> stream() {
        return rows.stream();
    }

    /** Removes rows matching the predicate, keeping survivor order. Returns the number removed. */
    public int removeIf(Predicate<Row> filter) {
        int before = rows.size();
        rows.removeIf(filter);
        return before - rows.size();
    }

    /** Replaces the row list, e.g. after de-duplication. */
    public void replaceRows(List<Row> replacement) {
        rows.clear();
        rows.addAll(replacement);
    }

    /** Deep copy: the returned RowSet shares no mutable row with this one. */
    public RowSet copy() {
        List<Row> copied = new ArrayList<>(rows.size());
        for (Row r : rows) {
            copied.add(r.copy());
        }
        return new RowSet(columns, copied);
    }

    @Override
    public Iterator<Row> iterator() {
        return Collections.unmodifiableList(rows).iterator();
    }
}
