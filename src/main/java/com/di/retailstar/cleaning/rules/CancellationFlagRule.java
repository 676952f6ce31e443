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
 * Flags cancellations: invoice numbers that, as text, start with {@code C}.
 */
@Slf4j
public class CancellationFlagRule implements CleaningRule {

    static final String CANCELLATION_PREFIX = "C";

    @Override
    public String getRuleName() {
        return "cancellation-flag";
    }

    @Override
    public List<String> requiredColumns() {
        return List.of(Columns.INVOICE_NO);
    }

    @Override
    public RowSet apply(RowSet rows, RunContext ctx) {
        long cancelled = rows.stream().filter(CancellationFlagRule::isCancelled).count();
        ctx.recordIssue(QualityIssueType.DATA_QUALITY_ADVISORY, CleaningMetrics.STAGE,
                CleaningMetrics.CANCELLED_TRANSACTIONS, cancelled, "Invoice number starts with 'C'");
        log.info("[CLEAN] Found {} cancelled transactions", cancelled);

        rows.addColumn(Columns.IS_CANCELLED);
        for (Row row : rows) {
            row.set(Columns.IS_CANCELLED, isCancelled(row));
        }
        return rows;
    }

    static boolean isCancelled(Row row) {
        String invoiceNo = TypeConverter.toText(row.get(Columns.INVOICE_NO));
        return invoiceNo != null && invoiceNo.startsWith(CANCELLATION_PREFIX);
    }
}
