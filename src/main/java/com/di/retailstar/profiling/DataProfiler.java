package com.di.retailstar.profiling;

import com.di.retailstar.config.RetailStarProperties;
import com.di.retailstar.context.RunContext;
import com.di.retailstar.rowset.Columns;
import com.di.retailstar.rowset.Row;
import com.di.retailstar.rowset.RowSet;
import com.di.retailstar.util.TypeConverter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.DoublePredicate;

/**
 * Profiles a raw extract before cleaning. Profiling is descriptive only: it never modifies
 * the rows, never fails on an absent column (counts it as zero) and keeps its numbers out of
 * the run's cleaning metrics.
 */
@Slf4j
@Service
public class DataProfiler {

    static final String CANCELLATIONS = "Cancellation transactions";
    static final String MISSING_CUSTOMER_IDS = "Missing CustomerIDs";
    static final String NEGATIVE_QUANTITIES = "Negative Quantities";
    static final String INVALID_PRICES = "Invalid Prices (≤ 0)";
    static final String EXTREME_QUANTITIES = "Extreme Quantities";
    static final String MISSING_DESCRIPTIONS = "Missing Product Descriptions";

    private final long highQuantityThreshold;
    private final String unknownProductPlaceholder;

    @Autowired
    public DataProfiler(RetailStarProperties properties) {
        this(properties.getHighQuantityThreshold(), properties.getUnknownProductPlaceholder());
    }

    public DataProfiler(long highQuantityThreshold, String unknownProductPlaceholder) {
        this.highQuantityThreshold = highQuantityThreshold;
        this.unknownProductPlaceholder = unknownProductPlaceholder;
    }

    public QualitySummary profile(RowSet raw, RunContext ctx) {
        log.info("[PROFILE] Generating data quality summary for job {}...", ctx.getJobId());
        long rows = raw.size();
        List<String> columns = new ArrayList<>(raw.getColumns());

        QualitySummary summary = QualitySummary.builder()
                .datasetOverview(new QualitySummary.DatasetOverview(rows, columns.size()))
                .completeness(completeness(raw, columns))
                .dataQualityIssues(issues(raw))
                .businessLogicConstraints(constraints(raw))
                .build();

        logSummary(summary);
        return summary;
    }

    // ============================================================================
    // Sections
    // ============================================================================

    private static QualitySummary.Completeness completeness(RowSet raw, List<String> columns) {
        Map<String, Long> missing = new LinkedHashMap<>();
        Map<String, Double> missingPct = new LinkedHashMap<>();
        long totalMissing = 0;
        for (String column : columns) {
            long count = raw.stream().filter(r -> r.isMissing(column)).count();
            missing.put(column, count);
            missingPct.put(column, percentage(count, raw.size()));
            totalMissing += count;
        }
        long cells = (long) raw.size() * columns.size();
        double score = cells == 0 ? 100.0 : round2((1.0 - (double) totalMissing / cells) * 100.0);
        return QualitySummary.Completeness.builder()
                .missingValues(missing)
                .missingPercentage(missingPct)
                .completenessScore(score)
                .build();
    }

    private static QualitySummary.DataQualityIssues issues(RowSet raw) {
        return QualitySummary.DataQualityIssues.builder()
                .duplicateRows(duplicateRows(raw))
                .negativeQuantities(countNumeric(raw, Columns.QUANTITY, q -> q < 0))
                .zeroQuantities(countNumeric(raw, Columns.QUANTITY, q -> q == 0))
                .invalidPrices(countNumeric(raw, Columns.UNIT_PRICE, p -> p <= 0))
                .zeroPrices(countNumeric(raw, Columns.UNIT_PRICE, p -> p == 0))
                .missingCustomerIds(countMissing(raw, Columns.CUSTOMER_ID))
                .missingDescriptions(countMissing(raw, Columns.DESCRIPTION))
                .build();
    }

    private List<BusinessConstraint> constraints(RowSet raw) {
        List<BusinessConstraint> constraints = new ArrayList<>();
        if (raw.hasColumn(Columns.INVOICE_NO)) {
            long cancellations = raw.stream()
                    .map(r -> TypeConverter.toText(r.get(Columns.INVOICE_NO)))
                    .filter(s -> s != null && s.startsWith("C"))
                    .count();
            constraints.add(constraint(CANCELLATIONS, cancellations, null,
                    "Flag as cancellations but keep for refund analysis"));
        }
        if (raw.hasColumn(Columns.CUSTOMER_ID)) {
            long missing = countMissing(raw, Columns.CUSTOMER_ID);
            constraints.add(constraint(MISSING_CUSTOMER_IDS, missing, percentage(missing, raw.size()),
                    "Assign surrogate key (0) for unknown customers"));
        }
        if (raw.hasColumn(Columns.QUANTITY)) {
            constraints.add(constraint(NEGATIVE_QUANTITIES, countNumeric(raw, Columns.QUANTITY, q -> q < 0), null,
                    "Validate against cancellation flag; keep legitimate returns"));
        }
        if (raw.hasColumn(Columns.UNIT_PRICE)) {
            constraints.add(constraint(INVALID_PRICES, countNumeric(raw, Columns.UNIT_PRICE, p -> p <= 0), null,
                    "Exclude from fact table as they represent data errors"));
        }
        if (raw.hasColumn(Columns.QUANTITY)) {
            constraints.add(constraint(EXTREME_QUANTITIES,
                    countNumeric(raw, Columns.QUANTITY, q -> Math.abs(q) > highQuantityThreshold), null,
                    "Flag for business review but keep for wholesale analysis"));
        }
        if (raw.hasColumn(Columns.DESCRIPTION)) {
            long missing = countMissing(raw, Columns.DESCRIPTION);
            if (missing > 0) {
                constraints.add(constraint(MISSING_DESCRIPTIONS, missing, null,
                        "Fill with \"" + unknownProductPlaceholder + "\" placeholder"));
            }
        }
        return constraints;
    }

    // ============================================================================
    // Counting helpers
    // ============================================================================

    /** Rows equal to an earlier row; the first occurrence is not counted. */
    static long duplicateRows(RowSet raw) {
        Set<Row> seen = new HashSet<>();
        long duplicates = 0;
        for (Row row : raw) {
            if (!seen.add(row)) {
                duplicates++;
            }
        }
        return duplicates;
    }

    /** Non-numeric and missing values never match. */
    private static long countNumeric(RowSet raw, String column, DoublePredicate test) {
        if (!raw.hasColumn(column)) {
            return 0;
        }
        return raw.stream()
                .map(r -> TypeConverter.tryDouble(r.get(column), column))
                .filter(v -> v != null && test.test(v))
                .count();
    }

    private static long countMissing(RowSet raw, String column) {
        if (!raw.hasColumn(column)) {
            return 0;
        }
        return raw.stream().filter(r -> r.isMissing(column)).count();
    }

    private static BusinessConstraint constraint(String name, long count, Double pct, String action) {
        return BusinessConstraint.builder()
                .constraint(name)
                .count(count)
                .percentage(pct)
                .actionNeeded(action)
                .build();
    }

    private static double percentage(long count, long total) {
        return total == 0 ? 0.0 : round2(count * 100.0 / total);
    }

    private static double round2(double value) {
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }

    private static void logSummary(QualitySummary summary) {
        QualitySummary.DataQualityIssues issues = summary.getDataQualityIssues();
        log.info("[PROFILE] Rows={} Columns={} Completeness={}%",
                summary.getDatasetOverview().getRowCount(),
                summary.getDatasetOverview().getColumnCount(),
                summary.getCompleteness().getCompletenessScore());
        log.info("[PROFILE] Missing CustomerIDs={} Duplicate rows={} Invalid prices={}",
                issues.getMissingCustomerIds(), issues.getDuplicateRows(), issues.getInvalidPrices());
        log.info("[PROFILE] Business constraints identified: {}", summary.getBusinessLogicConstraints().size());
    }
}
