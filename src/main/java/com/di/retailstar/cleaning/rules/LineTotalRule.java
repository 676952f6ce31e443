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
 * {@code LineTotal = Quantity * UnitPrice}. Runs after the price filter, so every row
 * here has a positive price. A whole-number Quantity is coerced to Long; any other value
 * is kept as read and leaves the line total missing.
 */
@Slf4j
public class LineTotalRule implements CleaningRule {

    @Override
    public String getRuleName() {
        return "line-total";
    }

    @Override
    public List<String> requiredColumns() {
        return List.of(Columns.QUANTITY, Columns.UNIT_PRICE);
    }

    @Override
    public RowSet apply(RowSet rows, RunContext ctx) {
        long unparsable = rows.stream()
                .filter(r -> TypeConverter.tryLong(r.get(Columns.QUANTITY), Columns.QUANTITY) == null)
                .count();
        if (unparsable > 0) {
            ctx.recordIssue(QualityIssueType.PARSE_WARNING, CleaningMetrics.STAGE,
                    CleaningMetrics.UNPARSABLE_QUANTITIES, unparsable, "Quantity missing or not a whole number");
            log.warn("[CLEAN] {} rows have no parsable Quantity", unparsable);
        }

        rows.addColumn(Columns.LINE_TOTAL);
        for (Row row : rows) {
            Long quantity = TypeConverter.tryLong(row.get(Columns.QUANTITY), Columns.QUANTITY);
            Double price = TypeConverter.tryDouble(row.get(Columns.UNIT_PRICE), Columns.UNIT_PRICE);
            if (quantity != null) {
                row.set(Columns.QUANTITY, quantity);
            }
            row.set(Columns.LINE_TOTAL, quantity == null || price == null ? null : quantity * price);
        }
        return rows;
    }
}
