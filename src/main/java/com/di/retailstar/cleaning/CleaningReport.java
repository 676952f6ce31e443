package com.di.retailstar.cleaning;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Outcome of one cleaning run.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class CleaningReport {

    private long    initialRows;
    private long    finalRows;

    /** {@code initialRows - finalRows}; only duplicate removal and the price filter remove rows. */
    private long    rowsRemoved;

    /** {@code finalRows / initialRows × 100}. */
    private double  dataQualityPassRate;

    /** Per-rule counts in rule order. */
    private Map<String, Number> cleaningMetrics;
}
