package com.di.retailstar.modeling;

import com.di.retailstar.context.QualityIssueType;
import com.di.retailstar.context.RunContext;
import com.di.retailstar.rowset.Columns;
import com.di.retailstar.rowset.Row;
import com.di.retailstar.rowset.RowSet;
import com.di.retailstar.util.TypeConverter;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Joins cleaned rows against the three dimensions. A row whose natural key has no
 * dimension member keeps a null foreign key and is counted, never dropped.
 */
@Slf4j
public class FactBuilder {

    public static final String TABLE = "fact_sales";
    public static final String STAGE = "modeling";

    public static final String UNMAPPED_DATES = "unmapped_dates";
    public static final String UNMAPPED_PRODUCTS = "unmapped_products";
    public static final String UNMAPPED_CUSTOMERS = "unmapped_customers";

    public FactBuildResult build(RowSet cleaned,
                                 DimensionTable<Integer, DimDate> dimDate,
                                 DimensionTable<String, DimProduct> dimProduct,
                                 DimensionTable<Long, DimCustomer> dimCustomer,
                                 RunContext ctx) {
        log.info("[MODEL] Creating {}...", TABLE);
        Instant buildTimestamp = ctx.getClock().instant();

        List<FactSales> facts = new ArrayList<>(cleaned.size());
        long unmappedDates = 0;
        long unmappedProducts = 0;
        long unmappedCustomers = 0;
        long transactionKey = 1;

        for (Row row : cleaned) {
            Integer dateKey = RowValues.dateKey(row);
            if (dateKey != null && dimDate.lookup(dateKey).isEmpty()) {
                dateKey = null;
            }
            Long productKey = dimProduct.lookup(RowValues.stockCode(row)).orElse(null);
            Long customerKey = dimCustomer.lookup(RowValues.customerId(row)).orElse(null);

            if (dateKey == null) unmappedDates++;
            if (productKey == null) unmappedProducts++;
            if (customerKey == null) unmappedCustomers++;

            facts.add(FactSales.builder()
                    .transactionKey(transactionKey++)
                    .dateKey(dateKey)
                    .productKey(productKey)
                    .customerKey(customerKey)
                    .quantity(TypeConverter.tryLong(row.get(Columns.QUANTITY), Columns.QUANTITY))
                    .unitPrice(TypeConverter.tryDouble(row.get(Columns.UNIT_PRICE), Columns.UNIT_PRICE))
                    .lineTotal(TypeConverter.tryDouble(row.get(Columns.LINE_TOTAL), Columns.LINE_TOTAL))
                    .isCancelled(flag(row, Columns.IS_CANCELLED))
                    .highQuantityFlag(flag(row, Columns.HIGH_QUANTITY_FLAG))
                    .invoiceNo(RowValues.text(row, Columns.INVOICE_NO))
                    .timestamp(buildTimestamp)
                    .build());
        }

        record(ctx, UNMAPPED_DATES, unmappedDates, "fact rows without a date_key");
        record(ctx, UNMAPPED_PRODUCTS, unmappedProducts, "fact rows without a product_key");
        record(ctx, UNMAPPED_CUSTOMERS, unmappedCustomers, "fact rows without a customer_key");

        log.info("[MODEL]   Created {} fact records", facts.size());
        return new FactBuildResult(facts, unmappedDates, unmappedProducts, unmappedCustomers, buildTimestamp);
    }

    private static Boolean flag(Row row, String column) {
        Object value = row.get(column);
        if (value == null) {
            return null;
        }
        try {
            return TypeConverter.convertToBoolean(value, column);
        } catch (IllegalArgumentException e) {
            log.debug("[MODEL] Unreadable flag {}='{}', left unset", column, value);
            return null;
        }
    }

    private static void record(RunContext ctx, String metric, long count, String detail) {
        ctx.recordIssue(QualityIssueType.INTEGRITY_WARNING, STAGE, metric, count, detail);
        if (count > 0) {
            log.warn("[MODEL] {} {}", count, detail);
        }
    }
}
