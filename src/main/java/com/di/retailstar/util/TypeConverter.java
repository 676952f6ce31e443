package com.di.retailstar.util;

import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;

/**
 * Converts raw extract values (strings from a CSV source, or boxed numbers from an
 * in-memory dataset) to the types the pipeline works with.
 *
 * <p>Supported targets:
 * <ul>
 *   <li>{@code Long}: integral numbers and numeric strings whose value is whole ("17850", "17850.0")</li>
 *   <li>{@code Double}: any number or numeric string</li>
 *   <li>{@code Boolean}: booleans and "true"/"false" strings</li>
 *   <li>text: natural keys compared as strings, whole numbers rendered without a fraction</li>
 * </ul>
 *
 * <p>{@code null} always converts to {@code null}. The {@code convert*} methods throw
 * {@link IllegalArgumentException} on values they cannot represent; the {@code try*}
 * variants return {@code null} instead so rules can count and recover.
 */
@Slf4j
public final class TypeConverter {

    private TypeConverter() {
        // Utility class - prevent instantiation
    }

    /**
     * Converts a value to Long.
     *
     * @param value     the value (Number or String)
     * @param fieldName the field name for error messages
     * @return Long value, or null for a null/blank input
     */
    public static Long convertToLong(Object value, String fieldName) {
        if (value == null) {
            return null;
        }

        if (value instanceof Long) {
            return (Long) value;
        }

        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }

        if (value instanceof Number) {
            return wholeNumber(new BigDecimal(value.toString()), value, fieldName);
        }

        if (value instanceof String) {
            String s = ((String) value).trim();
            if (s.isEmpty()) {
                return null;
            }
            try {
                return Long.parseLong(s);
            } catch (NumberFormatException ignored) {
                // may still be "17850.0"
            }
            try {
                return wholeNumber(new BigDecimal(s), value, fieldName);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(
                        String.format("Cannot convert '%s' to Long for field '%s' (not numeric)", s, fieldName), e);
            }
        }

        throw new IllegalArgumentException(
                String.format("Cannot convert %s to Long for field '%s' (not a numeric type)",
                        value.getClass().getName(), fieldName));
    }

    /**
     * Converts a value to Double.
     *
     * @param value     the value (Number or String)
     * @param fieldName the field name for error messages
     * @return Double value, or null for a null/blank input
     */
    public static Double convertToDouble(Object value, String fieldName) {
        if (value == null) {
            return null;
        }

        if (value instanceof Double) {
            return (Double) value;
        }

        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }

        if (value instanceof String) {
            String s = ((String) value).trim();
            if (s.isEmpty()) {
                return null;
            }
            try {
                return Double.parseDouble(s);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(
                        String.format("Cannot convert '%s' to Double for field '%s' (not numeric)", s, fieldName), e);
            }
        }

        throw new IllegalArgumentException(
                String.format("Cannot convert %s to Double for field '%s' (not a numeric type)",
                        value.getClass().getName(), fieldName));
    }

    /**
     * Converts a value to Boolean. Accepts Boolean and the strings "true"/"false" (any case).
     */
    public static Boolean convertToBoolean(Object value, String fieldName) {
        if (value == null) {
            return null;
        }

        if (value instanceof Boolean) {
            return (Boolean) value;
        }

        if (value instanceof String) {
            String s = ((String) value).trim();
            if (s.isEmpty()) {
                return null;
            }
            if ("true".equalsIgnoreCase(s)) {
                return Boolean.TRUE;
            }
            if ("false".equalsIgnoreCase(s)) {
                return Boolean.FALSE;
            }
        }

        throw new IllegalArgumentException(
                String.format("Cannot convert '%s' to Boolean for field '%s'", value, fieldName));
    }

    /**
     * Renders a value as text for natural-key comparison. Whole floating-point numbers lose
     * their fraction so that 22423.0 and "22423" compare equal.
     */
    public static String toText(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (!Double.isInfinite(d) && d == Math.rint(d)) {
                return Long.toString((long) d);
            }
        }
        return value.toString();
    }

    /** {@link #convertToLong} returning null instead of throwing. */
    public static Long tryLong(Object value, String fieldName) {
        try {
            return convertToLong(value, fieldName);
        } catch (IllegalArgumentException e) {
            log.debug("Unparsable Long for field '{}': {}", fieldName, e.getMessage());
            return null;
        }
    }

    /** {@link #convertToDouble} returning null instead of throwing. */
    public static Double tryDouble(Object value, String fieldName) {
        try {
            return convertToDouble(value, fieldName);
        } catch (IllegalArgumentException e) {
            log.debug("Unparsable Double for field '{}': {}", fieldName, e.getMessage());
            return null;
        }
    }

    private static Long wholeNumber(BigDecimal decimal, Object original, String fieldName) {
        try {
            return decimal.stripTrailingZeros().longValueExact();
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException(
                    String.format("Cannot convert %s to Long for field '%s' (fractional or out of range)",
                            original, fieldName), e);
        }
    }
}
