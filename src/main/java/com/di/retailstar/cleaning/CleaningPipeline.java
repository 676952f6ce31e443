package com.di.retailstar.cleaning;

import com.di.retailstar.cleaning.rules.CancellationFlagRule;
import com.di.retailstar.cleaning.rules.CountryNormalizationRule;
import com.di.retailstar.cleaning.rules.CustomerIdImputationRule;
import com.di.retailstar.cleaning.rules.DateComponentRule;
import com.di.retailstar.cleaning.rules.DatetimeNormalizationRule;
import com.di.retailstar.cleaning.rules.DescriptionImputationRule;
import com.di.retailstar.cleaning.rules.DuplicateRemovalRule;
import com.di.retailstar.cleaning.rules.HighQuantityFlagRule;
import com.di.retailstar.cleaning.rules.InvalidPriceFilterRule;
import com.di.retailstar.cleaning.rules.LineTotalRule;
import com.di.retailstar.config.RetailStarProperties;
import com.di.retailstar.context.RunContext;
import com.di.retailstar.rowset.RowSet;
import com.di.retailstar.util.InputValidator;
import com.di.retailstar.util.PipelineMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Cleans a raw extract by applying the rules below in this exact order.
 *
 * <pre>
 *  1. datetime normalization      6. invalid-price filter   (drops rows)
 *  2. cancellation flag           7. line total
 *  3. customer-id imputation      8. high-quantity flag
 *  4. description imputation      9. date components
 *  5. duplicate removal (drops)  10. country normalization
 * </pre>
 *
 * <p>Later rules read columns written by earlier ones, and duplicates are removed before
 * the price filter, so reordering changes the output. The union of all required columns is
 * checked once before the first rule; an empty input is rejected because the pass rate
 * divides by the input row count.
 */
@Slf4j
@Service
public class CleaningPipeline {

    private final List<CleaningRule> rules;
    private final PipelineMetrics metrics;

    @Autowired
    public CleaningPipeline(RetailStarProperties properties, PipelineMetrics metrics) {
        this(List.of(
                new DatetimeNormalizationRule(),
                new CancellationFlagRule(),
                new CustomerIdImputationRule(),
                new DescriptionImputationRule(properties.getUnknownProductPlaceholder()),
                new DuplicateRemovalRule(),
                new InvalidPriceFilterRule(),
                new LineTotalRule(),
                new HighQuantityFlagRule(
                        InputValidator.validateHighQuantityThreshold(properties.getHighQuantityThreshold())),
                new DateComponentRule(),
                new CountryNormalizationRule()), metrics);
    }

    CleaningPipeline(List<CleaningRule> rules, PipelineMetrics metrics) {
        this.rules = List.copyOf(rules);
        this.metrics = metrics;
    }

    public static CleaningPipeline withDefaults() {
        return new CleaningPipeline(new RetailStarProperties(), PipelineMetrics.noop());
    }

    /** Columns the raw extract must carry for every rule to run. */
    public Set<String> requiredColumns() {
        Set<String> required = new LinkedHashSet<>();
        rules.forEach(r -> required.addAll(r.requiredColumns()));
        return required;
    }

    public List<CleaningRule> getRules() {
        return rules;
    }

    /**
     * Cleans {@code raw} in place and reports what each rule did.
     *
     * @param raw the raw extract; ownership passes to the pipeline
     * @param ctx the run whose quality stats receive the per-rule counts
     * @throws com.di.retailstar.exception.SchemaValidationException when columns are missing
     *         or the input has no rows
     */
    public CleaningResult clean(RowSet raw, RunContext ctx) {
        long started = System.currentTimeMillis();
        log.info("[CLEAN] Starting data cleaning: {} rows, {} rules", raw == null ? 0 : raw.size(), rules.size());

        InputValidator.requireColumns(raw, requiredColumns(), CleaningMetrics.STAGE);
        InputValidator.requireRows(raw, CleaningMetrics.STAGE);

        long initialRows = raw.size();
        ctx.getQualityStats().record(CleaningMetrics.INITIAL_ROWS, initialRows);

        RowSet working = raw;
        for (CleaningRule rule : rules) {
            log.debug("[CLEAN] Applying rule {}", rule.getRuleName());
            working = rule.apply(working, ctx);
        }

        CleaningReport report = buildReport(initialRows, working.size(), ctx);
        metrics.recordCleaning(initialRows, working.size(), System.currentTimeMillis() - started);

        log.info("[CLEAN] Data cleaning completed: initial={} final={} passRate={}%",
                report.getInitialRows(), report.getFinalRows(),
                String.format("%.2f", report.getDataQualityPassRate()));
        return new CleaningResult(working, report);
    }

    private CleaningReport buildReport(long initialRows, long finalRows, RunContext ctx) {
        Map<String, Number> cleaningMetrics = ctx.getQualityStats().snapshot();
        return CleaningReport.builder()
                .initialRows(initialRows)
                .finalRows(finalRows)
                .rowsRemoved(initialRows - finalRows)
                .dataQualityPassRate(finalRows * 100.0 / initialRows)
                .cleaningMetrics(cleaningMetrics)
                .build();
    }
}
