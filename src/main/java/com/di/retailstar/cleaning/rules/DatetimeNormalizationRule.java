package com.di.retailstar.cleaning.rules;

import com.di.retailstar.cleaning.CleaningMetrics;
import com.di.retailstar.cleaning.CleaningRule;
import com.di.retailstar.context.QualityIssueType;
import com.di.retailstar.context.RunContext;
import com.di.retailstar.rowset.Columns;
import com.di.retailstar.rowset.Row;
import com.di.retailstar.rowset.RowSet;
import com.di.retailstar.util.DateFormatUtils;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Parses {@code InvoiceDate} into a {@link LocalDateTime}. Unparsable values become missing;
 * the number of rows left without a timestamp is counted.
 */
@Slf4j
public class DatetimeNormalizationRule implements CleaningRule {

    @Override
    public String getRuleName() {
        return "datetime-normalization";
    }

    @Override
    public List<String> requiredColumns() {
        return List.of(Columns.INVOICE_DATE);
    }

    @Override
    public RowSet apply(RowSet rows, RunContext ctx) {
        List<LocalDateTime> parsed = new ArrayList<>(rows.size());
        long missing = 0;
        for (Row row : rows) {
            LocalDateTime ts = DateFormatUtils.parseTimestamp(row.get(Columns.INVOICE_DATE));
            if (ts == null) {
                missing++;
            }
            parsed.add(ts);
        }
        ctx.recordIssue(QualityIssueType.PARSE_WARNING, CleaningMetrics.STAGE,
                CleaningMetrics.INVALID_INVOICE_DATES, missing, "InvoiceDate missing or unparsable");
        if (missing > 0) {
            log.warn("[CLEAN] {} rows have no parsable InvoiceDate", missing);
        }

        for (int i = 0; i < rows.size(); i++) {
            rows.get(i).set(Columns.INVOICE_DATE, parsed.get(i));
        }
        return rows;
    }
}
