package com.di.retailstar.modeling;

import com.di.retailstar.rowset.Columns;
import com.di.retailstar.rowset.Row;
import com.di.retailstar.util.DateFormatUtils;
import com.di.retailstar.util.TypeConverter;

import java.time.LocalDateTime;

/**
 * Natural-key extraction shared by the dimension builders and the fact builder, so both
 * sides of every join use the same rule.
 */
final class RowValues {

    private RowValues() {
    }

    static LocalDateTime invoiceTimestamp(Row row) {
        return DateFormatUtils.parseTimestamp(row.get(Columns.INVOICE_DATE));
    }

    /** {@code yyyyMMdd} of the invoice timestamp, null when the row has none. */
    static Integer dateKey(Row row) {
        LocalDateTime ts = invoiceTimestamp(row);
        return ts == null ? null : DateFormatUtils.toDateKey(ts.toLocalDate());
    }

    /** Stock codes are compared as case-sensitive text. */
    static String stockCode(Row row) {
        return TypeConverter.toText(row.get(Columns.STOCK_CODE));
    }

    static Long customerId(Row row) {
        return TypeConverter.tryLong(row.get(Columns.CUSTOMER_ID), Columns.CUSTOMER_ID);
    }

    static String text(Row row, String column) {
        return TypeConverter.toText(row.get(column));
    }

    static LocalDateTime min(LocalDateTime current, LocalDateTime candidate) {
        if (candidate == null) return current;
        return current == null || candidate.isBefore(current) ? candidate : current;
    }

    static LocalDateTime max(LocalDateTime current, LocalDateTime candidate) {
        if (candidate == null) return current;
        return current == null || candidate.isAfter(current) ? candidate : current;
    }
}
