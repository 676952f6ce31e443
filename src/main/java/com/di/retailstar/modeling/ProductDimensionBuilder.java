package com.di.retailstar.modeling;

import com.di.retailstar.context.RunContext;
import com.di.retailstar.rowset.Columns;
import com.di.retailstar.rowset.Row;
import com.di.retailstar.rowset.RowSet;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One row per distinct stock code, keyed 1..N in first-seen order. Rows without a stock
 * code belong to no product.
 */
@Slf4j
public class ProductDimensionBuilder implements DimensionBuilder<String, DimProduct> {

    public static final String TABLE = "dim_product";

    @Override
    public String tableName() {
        return TABLE;
    }

    @Override
    public DimensionTable<String, DimProduct> build(RowSet cleaned, RunContext ctx) {
        log.info("[MODEL] Creating {}...", TABLE);
        Map<String, Group> groups = new LinkedHashMap<>();
        for (Row row : cleaned) {
            String code = RowValues.stockCode(row);
            if (code == null) {
                continue;
            }
            groups.computeIfAbsent(code, k -> new Group()).accept(row);
        }

        List<DimProduct> rows = new ArrayList<>(groups.size());
        Map<String, Long> index = new LinkedHashMap<>();
        long key = 1;
        for (Map.Entry<String, Group> e : groups.entrySet()) {
            Group g = e.getValue();
            rows.add(DimProduct.builder()
                    .productKey(key)
                    .stockCode(e.getKey())
                    .description(g.description)
                    .firstSeenDate(g.first)
                    .lastSeenDate(g.last)
                    .isActive(true)
                    .build());
            index.put(e.getKey(), key);
            key++;
        }
        log.info("[MODEL]   Created {} product records", rows.size());
        return new DimensionTable<>(TABLE, rows, index);
    }

    private static final class Group {
        String description;
        LocalDateTime first;
        LocalDateTime last;

        void accept(Row row) {
            if (description == null) {
                description = RowValues.text(row, Columns.DESCRIPTION);
            }
            LocalDateTime ts = RowValues.invoiceTimestamp(row);
            first = RowValues.min(first, ts);
            last = RowValues.max(last, ts);
        }
    }
}
