package com.di.retailstar.cleaning.rules;

import com.di.retailstar.cleaning.CleaningRule;
import com.di.retailstar.context.RunContext;
import com.di.retailstar.rowset.Columns;
import com.di.retailstar.rowset.Row;
import com.di.retailstar.rowset.RowSet;
import com.di.retailstar.util.DateFormatUtils;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Derives year, month, day, day of week (Monday = 0) and quarter from the normalized
 * invoice timestamp. Rows without a timestamp get missing components.
 */
public class DateComponentRule implements CleaningRule {

    private static final List<String> DERIVED = List.of(
            Columns.INVOICE_YEAR, Columns.INVOICE_MONTH, Columns.INVOICE_DAY,
            Columns.INVOICE_DAY_OF_WEEK, Columns.INVOICE_QUARTER);

    @Override
    public String getRuleName() {
        return "date-components";
    }

    @Override
    public List<String> requiredColumns() {
        return List.of(Columns.INVOICE_DATE);
    }

    @Override
    public RowSet apply(RowSet rows, RunContext ctx) {
        DERIVED.forEach(rows::addColumn);
        for (Row row : rows) {
            Object value = row.get(Columns.INVOICE_DATE);
            LocalDate date = value instanceof LocalDateTime ? ((LocalDateTime) value).toLocalDate() : null;
            row.set(Columns.INVOICE_YEAR, date == null ? null : date.getYear());
            row.set(Columns.INVOICE_MONTH, date == null ? null : date.getMonthValue());
            row.set(Columns.INVOICE_DAY, date == null ? null : date.getDayOfMonth());
            row.set(Columns.INVOICE_DAY_OF_WEEK, date == null ? null : DateFormatUtils.dayOfWeekIndex(date));
            row.set(Columns.INVOICE_QUARTER, date == null ? null : DateFormatUtils.quarter(date));
        }
        return rows;
    }
}
