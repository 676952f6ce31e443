package com.di.retailstar.profiling;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Descriptive profile of a raw extract, taken before cleaning.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class QualitySummary {

    private DatasetOverview datasetOverview;
    private Completeness completeness;
    private DataQualityIssues dataQualityIssues;
    private List<BusinessConstraint> businessLogicConstraints;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class DatasetOverview {
        private long rowCount;
        private int columnCount;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class Completeness {
        private Map<String, Long> missingValues;
        /** Rounded to two decimals. */
        private Map<String, Double> missingPercentage;
        /** Share of non-missing cells over all cells, rounded to two decimals. */
        private double completenessScore;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class DataQualityIssues {
        private long duplicateRows;
        private long negativeQuantities;
        private long zeroQuantities;
        /** Prices at or below zero. */
        private long invalidPrices;
        private long zeroPrices;
        private long missingCustomerIds;
        private long missingDescriptions;
    }
}
