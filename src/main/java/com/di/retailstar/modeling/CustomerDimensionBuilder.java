package com.di.retailstar.modeling;

import com.di.retailstar.cleaning.rules.CustomerIdImputationRule;
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
 * One row per distinct customer id, keyed 1..N in first-seen order. The imputed id 0
 * forms its own group, flagged as the unknown customer.
 */
@Slf4j
public class CustomerDimensionBuilder implements DimensionBuilder<Long, DimCustomer> {

    public static final String TABLE = "dim_customer";

    @Override
    public String tableName() {
        return TABLE;
    }

    @Override
    public DimensionTable<Long, DimCustomer> build(RowSet cleaned, RunContext ctx) {
        log.info("[MODEL] Creating {}...", TABLE);
        Map<Long, Group> groups = new LinkedHashMap<>();
        for (Row row : cleaned) {
            Long id = RowValues.customerId(row);
            if (id == null) {
                continue;
            }
            groups.computeIfAbsent(id, k -> new Group()).accept(row);
        }

        List<DimCustomer> rows = new ArrayList<>(groups.size());
        Map<Long, Long> index = new LinkedHashMap<>();
        long key = 1;
        for (Map.Entry<Long, Group> e : groups.entrySet()) {
            Group g = e.getValue();
            rows.add(DimCustomer.builder()
                    .customerKey(key)
                    .customerId(e.getKey())
                    .country(g.country)
                    .firstPurchaseDate(g.first)
                    .lastPurchaseDate(g.last)
                    .isUnknownCustomer(e.getKey() == CustomerIdImputationRule.UNKNOWN_CUSTOMER_ID)
                    .build());
            index.put(e.getKey(), key);
            key++;
        }
        log.info("[MODEL]   Created {} customer records", rows.size());
        return new DimensionTable<>(TABLE, rows, index);
    }

    private static final class Group {
        String country;
        LocalDateTime first;
        LocalDateTime last;

        void accept(Row row) {
            if (country == null) {
                country = RowValues.text(row, Columns.COUNTRY);
            }
            LocalDateTime ts = RowValues.invoiceTimestamp(row);
            first = RowValues.min(first, ts);
            last = RowValues.max(last, ts);
        }
    }
}
