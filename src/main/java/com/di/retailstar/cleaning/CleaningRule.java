package com.di.retailstar.cleaning;

import com.di.retailstar.context.RunContext;
import com.di.retailstar.rowset.RowSet;

import java.util.List;

/**
 * One step of the cleaning pipeline.
 *
 * <p>A rule owns the RowSet it receives and may mutate it in place. It records its
 * counts in the {@link RunContext} before applying its effect, and applying it to its
 * own output must change nothing.
 */
public interface CleaningRule {

    /** Stable name used in logs. */
    String getRuleName();

    /** Columns the rule cannot run without; checked once before the pipeline starts. */
    List<String> requiredColumns();

    RowSet apply(RowSet rows, RunContext ctx);
}
