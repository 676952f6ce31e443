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
 * Flags {@code abs(Quantity) > threshold} for review. Advisory: never removes a row.
 */
@Slf4j
public class HighQuantityFlagRule implements CleaningRule {

    private final long threshold;

    public HighQuantityFlagRule(long threshold) {
        this.threshold = threshold;
    }

    @Override
    public String getRuleName() {
        return "high-quantity-flag";
    }

    @Override
    public List<String> requiredColumns() {
        return List.of(Columns.QUANTITY);
    }

    @Override
    public RowSet apply(RowSet rows, RunContext ctx) {
        long flagged = rows.stream().filter(this::isHighQuantity).count();
        ctx.recordIssue(QualityIssueType.DATA_QUALITY_ADVISORY, CleaningMetrics.STAGE,
                CleaningMetrics.HIGH_QUANTITY_RECORDS, flagged, "abs(Quantity) > " + threshold);
        log.info("[CLEAN] Flagged {} high-quantity records for review", flagged);

        rows.addColumn(Columns.HIGH_QUANTITY_FLAG);
        for (Row row : rows) {
            row.set(Columns.HIGH_QUANTITY_FLAG, isHighQuantity(row));
        }
        return rows;
    }

    private boolean isHighQuantity(Row row) {
        Long quantity = TypeConverter.tryLong(row.get(Columns.QUANTITY), Columns.QUANTITY);
        return quantity != null && Math.abs(quantity) > threshold;
    }
}
