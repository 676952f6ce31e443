package com.di.retailstar.cleaning.rules;

import com.di.retailstar.cleaning.CleaningMetrics;
import com.di.retailstar.cleaning.CleaningRule;
import com.di.retailstar.context.QualityIssueType;
import com.di.retailstar.context.RunContext;
import com.di.retailstar.rowset.Columns;
import com.di.retailstar.rowset.Row;
import com.di.retailstar.rowset.RowSet;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Replaces missing product descriptions with a placeholder. The count is only recorded
 * when at least one row is affected.
 */
@Slf4j
public class DescriptionImputationRule implements CleaningRule {

    private final String placeholder;

    public DescriptionImputationRule(String placeholder) {
        this.placeholder = placeholder;
    }

    @Override
    public String getRuleName() {
        return "description-imputation";
    }

    @Override
    public List<String> requiredColumns() {
        return List.of(Columns.DESCRIPTION);
    }

    @Override
    public RowSet apply(RowSet rows, RunContext ctx) {
        long missing = rows.stream().filter(r -> r.isMissing(Columns.DESCRIPTION)).count();
        if (missing == 0) {
            return rows;
        }
        ctx.recordIssue(QualityIssueType.DATA_QUALITY_ADVISORY, CleaningMetrics.STAGE,
                CleaningMetrics.MISSING_DESCRIPTIONS, missing, "Description set to '" + placeholder + "'");
        log.info("[CLEAN] Found {} missing descriptions", missing);

        for (Row row : rows) {
            if (row.isMissing(Columns.DESCRIPTION)) {
                row.set(Columns.DESCRIPTION, placeholder);
            }
        }
        return rows;
    }
}
