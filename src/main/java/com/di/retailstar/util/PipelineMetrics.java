package com.di.retailstar.util;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Micrometer meters for pipeline runs: row flow through cleaning, unmapped fact rows,
 * stage durations and run outcomes.
 */
@Slf4j
@Component
public class PipelineMetrics {

    private final MeterRegistry meterRegistry;

    // Cleaning
    private final Counter rowsInCounter;
    private final Counter rowsOutCounter;
    private final Counter rowsRemovedCounter;

    // Modeling
    private final Counter unmappedFactRowsCounter;
    private final Counter factRowsCounter;

    // Runs
    private final Counter runSuccessCounter;
    private final Counter runFailureCounter;

    @Autowired
    public PipelineMetrics(ObjectProvider<MeterRegistry> registryProvider) {
        this(registryProvider.getIfAvailable(SimpleMeterRegistry::new));
    }

    public PipelineMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.rowsInCounter = Counter.builder("retailstar.cleaning.rows")
                .description("Rows entering the cleaning pipeline")
                .tag("direction", "in")
                .register(meterRegistry);

        this.rowsOutCounter = Counter.builder("retailstar.cleaning.rows")
                .description("Rows leaving the cleaning pipeline")
                .tag("direction", "out")
                .register(meterRegistry);

        this.rowsRemovedCounter = Counter.builder("retailstar.cleaning.rows.removed")
                .description("Rows removed by duplicate removal and the invalid-price filter")
                .register(meterRegistry);

        this.factRowsCounter = Counter.builder("retailstar.modeling.fact.rows")
                .description("Fact rows built")
                .register(meterRegistry);

        this.unmappedFactRowsCounter = Counter.builder("retailstar.modeling.fact.unmapped")
                .description("Fact rows with at least one unresolved dimension reference")
                .register(meterRegistry);

        this.runSuccessCounter = Counter.builder("retailstar.run.total")
                .description("Completed pipeline runs")
                .tag("status", "success")
                .register(meterRegistry);

        this.runFailureCounter = Counter.builder("retailstar.run.total")
                .description("Failed pipeline runs")
                .tag("status", "error")
                .register(meterRegistry);
    }

    /** Registry-less instance for tests and standalone use. */
    public static PipelineMetrics noop() {
        return new PipelineMetrics(new SimpleMeterRegistry());
    }

    // ============================================================================
    // Cleaning
    // ============================================================================

    public void recordCleaning(long initialRows, long finalRows, long durationMs) {
        rowsInCounter.increment(initialRows);
        rowsOutCounter.increment(finalRows);
        rowsRemovedCounter.increment(initialRows - finalRows);
        recordStage("cleaning", durationMs);
        log.debug("Recorded cleaning: in={}, out={}, durationMs={}", initialRows, finalRows, durationMs);
    }

    // ============================================================================
    // Modeling
    // ============================================================================

    public void recordModeling(long factRows, long unmappedRows, long durationMs) {
        factRowsCounter.increment(factRows);
        unmappedFactRowsCounter.increment(unmappedRows);
        recordStage("modeling", durationMs);
        log.debug("Recorded modeling: facts={}, unmapped={}, durationMs={}", factRows, unmappedRows, durationMs);
    }

    // ============================================================================
    // Stages and runs
    // ============================================================================

    public void recordStage(String stage, long durationMs) {
        Timer.builder("retailstar.stage.duration")
                .description("Time taken by a pipeline stage")
                .tag("stage", stage)
                .register(meterRegistry)
                .record(durationMs, TimeUnit.MILLISECONDS);
    }

    public void recordRunSuccess() {
        runSuccessCounter.increment();
    }

    public void recordRunFailure(String category) {
        runFailureCounter.increment();
        Counter.builder("retailstar.run.failures")
                .description("Failed runs by error category")
                .tag("category", category)
                .register(meterRegistry)
                .increment();
    }

    public MeterRegistry getMeterRegistry() {
        return meterRegistry;
    }
}
