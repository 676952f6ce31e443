package com.di.retailstar.exception;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Categories for fatal run failures, used by the runner when logging and reporting a failed run.
 * <p>Usage: {@code ErrorCategory category = ErrorCategory.categorize(exception);}
 * <p>To add a new category: add the enum constant (before UNKNOWN) and a matcher in {@link #MATCHERS}.
 */
public enum ErrorCategory {

    SCHEMA_VALIDATION("Schema validation error", "Required column missing or dataset empty"),
    SCHEMA_INTEGRITY("Schema integrity error", "Built table violates a surrogate or foreign key invariant"),
    SOURCE_ERROR("Source error", "Raw extract could not be read"),
    SERIALIZATION_ERROR("Serialization error", "Report or table could not be written"),
    CONFIGURATION_ERROR("Configuration error", "Application configuration issue"),
    APPLICATION_ERROR("Application error", "General application error"),
    UNKNOWN("Unknown error", "Unclassified or unknown error type");

    private final String name;
    private final String description;

    ErrorCategory(String name, String description) {
        this.name = name;
        this.description = description;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    /** Order matters: first match wins. */
    private static final Map<Predicate<Throwable>, ErrorCategory> MATCHERS = new LinkedHashMap<>();

    static {
        MATCHERS.put(t -> t instanceof SchemaValidationException, SCHEMA_VALIDATION);
        MATCHERS.put(t -> t instanceof SchemaIntegrityException, SCHEMA_INTEGRITY);
        MATCHERS.put(t -> t instanceof RawDatasetException, SOURCE_ERROR);
        MATCHERS.put(ErrorCategory::isSerializationError, SERIALIZATION_ERROR);
        MATCHERS.put(ErrorCategory::isConfigurationError, CONFIGURATION_ERROR);
    }

    public static ErrorCategory categorize(Throwable exception) {
        if (exception == null) {
            return UNKNOWN;
        }
        for (Map.Entry<Predicate<Throwable>, ErrorCategory> e : MATCHERS.entrySet()) {
            if (e.getKey().test(exception)) {
                return e.getValue();
            }
        }
        return APPLICATION_ERROR;
    }

    // --- Matcher helpers ---

    private static boolean isSerializationError(Throwable t) {
        return t instanceof com.fasterxml.jackson.core.JsonProcessingException
                || t instanceof java.io.UncheckedIOException
                || t instanceof java.io.IOException;
    }

    private static boolean isConfigurationError(Throwable t) {
        String className = t.getClass().getName();
        return className.contains("BindException")
                || className.contains("BeanCreationException")
                || t instanceof jakarta.validation.ValidationException;
    }
}
