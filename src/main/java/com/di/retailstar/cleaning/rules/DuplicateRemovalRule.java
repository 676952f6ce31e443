package com.di.retailstar.cleaning.rules;

import com.di.retailstar.cleaning.CleaningMetrics;
import com.di.retailstar.cleaning.CleaningRule;
import com.di.retailstar.context.QualityIssueType;
import com.di.retailstar.context.RunContext;
import com.di.retailstar.rowset.Columns;
import com.di.retailstar.rowset.Row;
import com.di.retailstar.rowset.RowSet;
import com.di.retailstar.util.TypeConverter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Collapses rows equal across all columns to their first occurrence. Survivors keep
 * their relative order.
 *
 * <p>Rows are compared on the values later rules normalize them to: {@code Quantity} as a
 * whole number, {@code UnitPrice} as a double and {@code Country} trimmed and title-cased.
 * A row set that is already clean has no pair that only a later rule makes equal, so a
 * second cleaning pass removes nothing.
 */
@Slf4j
public class DuplicateRemovalRule implements CleaningRule {

    @Override
    public String getRuleName() {
        return "duplicate-removal";
    }

    @Override
    public List<String> requiredColumns() {
        return List.of();
    }

    @Override
    public RowSet apply(RowSet rows, RunContext ctx) {
        Map<Row, Row> firstByKey = new LinkedHashMap<>();
        for (Row row : rows) {
            firstByKey.putIfAbsent(comparisonKey(row), row);
        }
        List<Row> unique = new ArrayList<>(firstByKey.values());
        long removed = rows.size() - unique.size();
        ctx.recordIssue(QualityIssueType.DATA_QUALITY_ADVISORY, CleaningMetrics.STAGE,
                CleaningMetrics.DUPLICATES_REMOVED, removed, "Duplicate rows removed");
        log.info("[CLEAN] Removed {} duplicate rows", removed);

        rows.replaceRows(unique);
        return rows;
    }

    static Row comparisonKey(Row row) {
        Row key = row.copy();
        if (row.has(Columns.QUANTITY)) {
            Object quantity = row.get(Columns.QUANTITY);
            Long whole = TypeConverter.tryLong(quantity, Columns.QUANTITY);
            key.set(Columns.QUANTITY, whole != null ? whole : quantity);
        }
        if (row.has(Columns.UNIT_PRICE)) {
            Object price = row.get(Columns.UNIT_PRICE);
            Double numeric = TypeConverter.tryDouble(price, Columns.UNIT_PRICE);
            key.set(Columns.UNIT_PRICE, numeric != null ? numeric : price);
        }
        if (row.has(Columns.COUNTRY)) {
            String country = TypeConverter.toText(row.get(Columns.COUNTRY));
            key.set(Columns.COUNTRY, country == null ? null : CountryNormalizationRule.titleCase(country.trim()));
        }
        return key;
    }
}
