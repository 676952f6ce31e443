package com.di.retailstar.modeling;

import com.di.retailstar.context.RunContext;
import com.di.retailstar.rowset.RowSet;

/**
 * Derives one dimension from the cleaned rows. Builders read the RowSet without
 * modifying it, so the three of them may run concurrently.
 *
 * <p>Precondition: the RowSet is in stable input order. Surrogate keys and first-seen
 * attributes follow that order.
 */
public interface DimensionBuilder<K, R> {

    String tableName();

    DimensionTable<K, R> build(RowSet cleaned, RunContext ctx);
}
