package com.di.retailstar.util;

import com.di.retailstar.exception.SchemaValidationException;
import com.di.retailstar.rowset.RowSet;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Input validation for stage inputs and run parameters.
 */
@Slf4j
public final class InputValidator {

    private InputValidator() {}

    // ============================================================================
    // Patterns and bounds
    // ============================================================================

    /**
     * Job ids end up as directory names under the output root:
     * letters, digits, underscores and dashes only.
     */
    private static final Pattern VALID_JOB_ID_PATTERN = Pattern.compile("^[A-Za-z0-9_-]+$");

    private static final int MAX_JOB_ID_LENGTH = 64;

    private static final long MIN_HIGH_QUANTITY_THRESHOLD = 0;

    // ============================================================================
    // RowSet validation
    // ============================================================================

    /**
     * Checks that every required column is present, reporting all missing columns at once.
     *
     * @param rowSet   the input of the stage
     * @param required columns the stage needs
     * @param stage    stage name for the error message
     * @throws SchemaValidationException listing every missing column
     */
    public static void requireColumns(RowSet rowSet, Collection<String> required, String stage) {
        if (rowSet == null) {
            throw new IllegalArgumentException(String.format("%s input cannot be null", stage));
        }
        List<String> missing = rowSet.missingColumns(required);
        if (!missing.isEmpty()) {
            log.error("[{}] schema contract failed, missing columns {}", stage, missing);
            throw SchemaValidationException.missingColumns(stage, missing);
        }
    }

    /**
     * Rejects an empty dataset for stages that divide by the row count or need at least one row.
     *
     * @throws SchemaValidationException when the RowSet has no rows
     */
    public static void requireRows(RowSet rowSet, String stage) {
        if (rowSet == null) {
            throw new IllegalArgumentException(String.format("%s input cannot be null", stage));
        }
        if (rowSet.isEmpty()) {
            log.error("[{}] dataset has zero rows", stage);
            throw SchemaValidationException.emptyDataset(stage);
        }
    }

    // ============================================================================
    // Run parameters
    // ============================================================================

    /**
     * Validates a job id.
     *
     * @return the trimmed job id
     * @throws IllegalArgumentException if it is blank, too long or contains unsafe characters
     */
    public static String validateJobId(String jobId) {
        if (jobId == null) {
            throw new IllegalArgumentException("job id cannot be null");
        }
        String trimmed = jobId.trim();
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("job id cannot be empty");
        }
        if (trimmed.length() > MAX_JOB_ID_LENGTH) {
            throw new IllegalArgumentException(
                    String.format("job id exceeds maximum length of %d characters: %s", MAX_JOB_ID_LENGTH, trimmed));
        }
        if (!VALID_JOB_ID_PATTERN.matcher(trimmed).matches()) {
            throw new IllegalArgumentException(
                    String.format("Invalid job id '%s': only letters, digits, '_' and '-' are allowed", trimmed));
        }
        return trimmed;
    }

    public static long validateHighQuantityThreshold(long threshold) {
        if (threshold < MIN_HIGH_QUANTITY_THRESHOLD) {
            throw new IllegalArgumentException(
                    String.format("high quantity threshold must be >= %d, got %d", MIN_HIGH_QUANTITY_THRESHOLD, threshold));
        }
        return threshold;
    }
}
