package com.di.retailstar.modeling;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/** One calendar day of the date spine. {@code dateKey} is yyyyMMdd as an integer. */
@Value
@Builder(toBuilder = true)
public class DimDate {
    int dateKey;
    LocalDate fullDate;
    int year;
    int quarter;
    int month;
    String monthName;
    int day;
    /** Monday = 0 through Sunday = 6. */
    int dayOfWeek;
    String dayName;
    Boolean isWeekend;
}
