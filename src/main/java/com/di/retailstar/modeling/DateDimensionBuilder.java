package com.di.retailstar.modeling;

import com.di.retailstar.context.RunContext;
import com.di.retailstar.exception.SchemaValidationException;
import com.di.retailstar.rowset.Columns;
import com.di.retailstar.rowset.Row;
import com.di.retailstar.rowset.RowSet;
import com.di.retailstar.util.DateFormatUtils;
import lombok.extern.slf4j.Slf4j;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds the date spine: one row per calendar day from the earliest to the latest invoice
 * date, inclusive, whether or not a transaction happened that day.
 */
@Slf4j
public class DateDimensionBuilder implements DimensionBuilder<Integer, DimDate> {

    public static final String TABLE = "dim_date";

    private final Set<DayOfWeek> weekendDays;

    public DateDimensionBuilder(Set<DayOfWeek> weekendDays) {
        this.weekendDays = weekendDays == null || weekendDays.isEmpty()
                ? EnumSet.noneOf(DayOfWeek.class)
                : EnumSet.copyOf(weekendDays);
    }

    @Override
    public String tableName() {
        return TABLE;
    }

    @Override
    public DimensionTable<Integer, DimDate> build(RowSet cleaned, RunContext ctx) {
        log.info("[MODEL] Creating {}...", TABLE);
        LocalDateTime min = null;
        LocalDateTime max = null;
        for (Row row : cleaned) {
            LocalDateTime ts = RowValues.invoiceTimestamp(row);
            min = RowValues.min(min, ts);
            max = RowValues.max(max, ts);
        }
        if (min == null) {
            throw new SchemaValidationException(TABLE, "NO_DATED_ROWS", List.of(Columns.INVOICE_DATE),
                    "no row carries a parsable InvoiceDate, the date range is undefined");
        }
        return spine(min.toLocalDate(), max.toLocalDate());
    }

    /** Every day of {@code [start, end]}. */
    public DimensionTable<Integer, DimDate> spine(LocalDate start, LocalDate end) {
        List<DimDate> rows = new ArrayList<>();
        Map<Integer, Long> index = new LinkedHashMap<>();
        for (LocalDate d = start; !d.isAfter(end); d = d.plusDays(1)) {
            DimDate day = DimDate.builder()
                    .dateKey(DateFormatUtils.toDateKey(d))
                    .fullDate(d)
                    .year(d.getYear())
                    .quarter(DateFormatUtils.quarter(d))
                    .month(d.getMonthValue())
                    .monthName(DateFormatUtils.monthName(d))
                    .day(d.getDayOfMonth())
                    .dayOfWeek(DateFormatUtils.dayOfWeekIndex(d))
                    .dayName(DateFormatUtils.dayName(d))
                    .isWeekend(weekendDays.contains(d.getDayOfWeek()))
                    .build();
            rows.add(day);
            index.put(day.getDateKey(), (long) day.getDateKey());
        }
        log.info("[MODEL]   Created {} date records ({} to {})", rows.size(), start, end);
        return new DimensionTable<>(TABLE, rows, index);
    }
}
