package com.di.retailstar.modeling;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Map;

/**
 * Outcome of one modeling run: table sizes, what the schema covers and how many fact rows
 * could not be joined.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ModelingReport {

    /** Row count per table, in build order. */
    private Map<String, Integer> tablesCreated;

    private SchemaSummary schemaSummary;

    private Integrity integrity;

    private Instant buildTimestamp;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class SchemaSummary {
        private DateRange dateRange;
        private long uniqueProducts;
        private long uniqueCustomers;
        /** Rows of {@code dim_customer} flagged as the unknown customer (0 or 1). */
        private long unknownCustomers;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class DateRange {
        private LocalDate start;
        private LocalDate end;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class Integrity {
        private long unmappedDates;
        private long unmappedProducts;
        private long unmappedCustomers;
    }
}
