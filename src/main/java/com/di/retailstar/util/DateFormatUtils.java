package com.di.retailstar.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.format.TextStyle;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

public class DateFormatUtils {
    private static final Logger logger = LoggerFactory.getLogger(DateFormatUtils.class);

    /**
     * Invoice timestamp layouts seen in retail extracts, tried in order.
     */
    private static final List<String> KNOWN_DATE_TIME_PATTERNS = Arrays.asList(
            "uuuu-MM-dd HH:mm:ss",      // ISO with seconds
            "uuuu-MM-dd HH:mm",         // ISO
            "uuuu-MM-dd'T'HH:mm:ss",    // ISO-8601
            "uuuu-MM-dd'T'HH:mm",
            "M/d/uuuu H:mm:ss",         // US spreadsheet export
            "M/d/uuuu H:mm",
            "uuuu/MM/dd HH:mm:ss",      // Logs
            "uuuu/MM/dd HH:mm"
    );

    private static final List<String> KNOWN_DATE_PATTERNS = Arrays.asList(
            "uuuu-MM-dd",   // ISO standard
            "M/d/uuuu",     // US
            "uuuu/MM/dd",   // Logs
            "uuuuMMdd"
    );

    // STRICT rejects impossible calendar dates (2011-02-30) instead of clamping them
    private static final List<DateTimeFormatter> DATE_TIME_FORMATTERS = KNOWN_DATE_TIME_PATTERNS.stream()
            .map(DateFormatUtils::strict)
            .collect(Collectors.toList());

    private static final List<DateTimeFormatter> DATE_FORMATTERS = KNOWN_DATE_PATTERNS.stream()
            .map(DateFormatUtils::strict)
            .collect(Collectors.toList());

    private static DateTimeFormatter strict(String pattern) {
        return DateTimeFormatter.ofPattern(pattern).withResolverStyle(ResolverStyle.STRICT);
    }

    /**
     * Parses an invoice timestamp. Bare dates resolve to midnight.
     *
     * @param value a LocalDateTime, LocalDate or String
     * @return the timestamp, or null when the value is missing or matches no known layout
     */
    public static LocalDateTime parseTimestamp(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof LocalDateTime) {
            return (LocalDateTime) value;
        }
        if (value instanceof LocalDate) {
            return ((LocalDate) value).atStartOfDay();
        }
        String input = value.toString().trim();
        if (input.isEmpty()) {
            return null;
        }
        for (DateTimeFormatter formatter : DATE_TIME_FORMATTERS) {
            try {
                return LocalDateTime.parse(input, formatter);
            } catch (DateTimeParseException ignored) {
                // next layout
            }
        }
        for (DateTimeFormatter formatter : DATE_FORMATTERS) {
            try {
                return LocalDate.parse(input, formatter).atStartOfDay();
            } catch (DateTimeParseException ignored) {
                // next layout
            }
        }
        logger.debug("Unrecognized timestamp format: {}. Supported patterns are: {}, {}",
                input, String.join(", ", KNOWN_DATE_TIME_PATTERNS), String.join(", ", KNOWN_DATE_PATTERNS));
        return null;
    }

    /**
     * Converts a calendar date to its numeric yyyyMMdd key.
     *
     * @param date the date (e.g. 2011-03-03)
     * @return the key (e.g. 20110303)
     */
    public static int toDateKey(LocalDate date) {
        return Integer.parseInt(date.format(DateTimeFormatter.BASIC_ISO_DATE));
    }

    /** Day of week with Monday = 0 through Sunday = 6. */
    public static int dayOfWeekIndex(LocalDate date) {
        return date.getDayOfWeek().getValue() - 1;
    }

    public static int quarter(LocalDate date) {
        return (date.getMonthValue() - 1) / 3 + 1;
    }

    public static String dayName(LocalDate date) {
        return date.getDayOfWeek().getDisplayName(TextStyle.FULL, Locale.ENGLISH);
    }

    public static String monthName(LocalDate date) {
        return date.getMonth().getDisplayName(TextStyle.FULL, Locale.ENGLISH);
    }
}
