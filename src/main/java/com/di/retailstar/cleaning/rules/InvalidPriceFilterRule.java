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

import java.util.List;

/**
 * Drops rows whose {@code UnitPrice} is not a positive number and coerces the survivors'
 * price to Double. The only rule after duplicate removal that removes rows.
 */
@Slf4j
public class InvalidPriceFilterRule implements CleaningRule {

    @Override
    public String getRuleName() {
        return "invalid-price-filter";
    }

    @Override
    public List<String> requiredColumns() {
        return List.of(Columns.UNIT_PRICE);
    }

    @Override
    public RowSet apply(RowSet rows, RunContext ctx) {
        long invalid = rows.stream().filter(r -> !hasValidPrice(r)).count();
        ctx.recordIssue(QualityIssueType.DATA_QUALITY_ADVISORY, CleaningMetrics.STAGE,
                CleaningMetrics.INVALID_PRICE_EXCLUSIONS, invalid, "UnitPrice <= 0 or not numeric, row excluded");
        log.info("[CLEAN] Excluded {} records with invalid prices", invalid);

        rows.removeIf(r -> !hasValidPrice(r));
        for (Row row : rows) {
            row.set(Columns.UNIT_PRICE, TypeConverter.tryDouble(row.get(Columns.UNIT_PRICE), Columns.UNIT_PRICE));
        }
        return rows;
    }

    private static boolean hasValidPrice(Row row) {
        Double price = TypeConverter.tryDouble(row.get(Columns.UNIT_PRICE), Columns.UNIT_PRICE);
        return price != null && price > 0;
    }
}
