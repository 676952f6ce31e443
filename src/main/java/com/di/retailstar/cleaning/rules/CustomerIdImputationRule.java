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
import java.util.List;

/**
 * Coerces {@code CustomerID} to Long and assigns the unknown-customer sentinel {@code 0}
 * where it is missing or not a whole number.
 */
@Slf4j
public class CustomerIdImputationRule implements CleaningRule {

    public static final long UNKNOWN_CUSTOMER_ID = 0L;

    @Override
    public String getRuleName() {
        return "customer-id-imputation";
    }

    @Override
    public List<String> requiredColumns() {
        return List.of(Columns.CUSTOMER_ID);
    }

    @Override
    public RowSet apply(RowSet rows, RunContext ctx) {
        List<Long> ids = new ArrayList<>(rows.size());
        long missing = 0;
        for (Row row : rows) {
            Long id = TypeConverter.tryLong(row.get(Columns.CUSTOMER_ID), Columns.CUSTOMER_ID);
            if (id == null) {
                missing++;
            }
            ids.add(id);
        }
        ctx.recordIssue(QualityIssueType.DATA_QUALITY_ADVISORY, CleaningMetrics.STAGE,
                CleaningMetrics.MISSING_CUSTOMER_IDS, missing, "CustomerID imputed with sentinel 0");
        log.info("[CLEAN] Found {} records with missing CustomerID", missing);

        for (int i = 0; i < rows.size(); i++) {
            Long id = ids.get(i);
            rows.get(i).set(Columns.CUSTOMER_ID, id == null ? UNKNOWN_CUSTOMER_ID : id);
        }
        return rows;
    }
}
