package com.di.retailstar.exception;

import java.util.List;

/**
 * Fatal input problem detected before or at the start of a stage: required columns
 * missing, an empty dataset handed to a stage that divides by row count, or no dated
 * rows to span a calendar. The run stops; the message names the stage and the condition.
 */
public class SchemaValidationException extends RuntimeException {

    private final String stage;
    private final String condition;
    private final List<String> columns;

    public SchemaValidationException(String stage, String condition, List<String> columns, String message) {
        super(String.format("[%s] %s: %s", stage, condition, message));
        this.stage = stage;
        this.condition = condition;
        this.columns = columns == null ? List.of() : List.copyOf(columns);
    }

    public static SchemaValidationException missingColumns(String stage, List<String> missing) {
        return new SchemaValidationException(stage, "MISSING_COLUMNS", missing,
                "required columns missing " + missing);
    }

    public static SchemaValidationException emptyDataset(String stage) {
        return new SchemaValidationException(stage, "EMPTY_DATASET", List.of(),
                "dataset has zero rows");
    }

    public String getStage() {
        return stage;
    }

    public String getCondition() {
        return condition;
    }

    public List<String> getColumns() {
        return columns;
    }
}
