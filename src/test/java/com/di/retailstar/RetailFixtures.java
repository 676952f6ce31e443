package com.di.retailstar;

import com.di.retailstar.rowset.Columns;
import com.di.retailstar.rowset.Row;
import com.di.retailstar.rowset.RowSet;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Raw extract rows for tests.
 */
public final class RetailFixtures {

    private RetailFixtures() {
    }

    public static Row raw(Object invoiceNo, Object stockCode, Object description, Object quantity,
                          Object invoiceDate, Object unitPrice, Object customerId, Object country) {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put(Columns.INVOICE_NO, invoiceNo);
        values.put(Columns.STOCK_CODE, stockCode);
        values.put(Columns.DESCRIPTION, description);
        values.put(Columns.QUANTITY, quantity);
        values.put(Columns.INVOICE_DATE, invoiceDate);
        values.put(Columns.UNIT_PRICE, unitPrice);
        values.put(Columns.CUSTOMER_ID, customerId);
        values.put(Columns.COUNTRY, country);
        return Row.of(values);
    }

    public static RowSet rowSet(Row... rows) {
        RowSet rowSet = new RowSet(Columns.RAW);
        for (Row row : rows) {
            rowSet.add(row);
        }
        return rowSet;
    }

    /**
     * The two-line example: a sale and its cancellation by an anonymous customer.
     */
    public static RowSet saleAndCancellation() {
        return rowSet(
                raw("536365", "A1", "LAMP", 6L, "2010-12-01 08:26", 2.55, 17850L, " uk "),
                raw("C536366", "A1", null, -6L, "2010-12-01 08:28", 2.55, null, "UK"));
    }

    /** Three days of sales by two customers, one of them unknown, across three products. */
    public static RowSet threeDays() {
        return rowSet(
                raw("540001", "85123A", "WHITE HANGING HEART", 6L, "2011-01-01 09:00", 2.55, 17850L, "United Kingdom"),
                raw("540002", "71053", "WHITE METAL LANTERN", 2L, "2011-01-01 10:15", 3.39, 13047L, "France"),
                raw("540003", "84406B", "CREAM CUPID HEARTS", 8L, "2011-01-03 11:00", 2.75, null, "Germany"),
                raw("540004", "85123A", "HEART T-LIGHT HOLDER", 12L, "2011-01-03 12:30", 2.55, 17850L, "United Kingdom"));
    }
}
