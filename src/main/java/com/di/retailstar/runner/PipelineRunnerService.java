package com.di.retailstar.runner;

import com.di.retailstar.cleaning.CleaningPipeline;
import com.di.retailstar.cleaning.CleaningResult;
import com.di.retailstar.config.RetailStarProperties;
import com.di.retailstar.context.RunContext;
import com.di.retailstar.exception.ErrorCategory;
import com.di.retailstar.export.ModelExportService;
import com.di.retailstar.modeling.ModelingResult;
import com.di.retailstar.modeling.StarSchemaService;
import com.di.retailstar.profiling.DataProfiler;
import com.di.retailstar.profiling.QualitySummary;
import com.di.retailstar.rowset.RowSet;
import com.di.retailstar.source.RawDatasetSource;
import com.di.retailstar.util.InputValidator;
import com.di.retailstar.util.PipelineMetrics;
import jakarta.validation.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Runs one job end to end: load, profile, clean, model, export. A fatal failure in any stage
 * ends the run and is returned as a failed {@link PipelineRunResult}, never thrown.
 */
@Slf4j
@Service
public class PipelineRunnerService {

    private final RetailStarProperties properties;
    private final RawDatasetSource source;
    private final DataProfiler profiler;
    private final CleaningPipeline cleaningPipeline;
    private final StarSchemaService starSchemaService;
    private final ModelExportService exportService;
    private final PipelineMetrics metrics;
    private final Clock clock;

    @Autowired
    public PipelineRunnerService(RetailStarProperties properties,
                                 RawDatasetSource source,
                                 DataProfiler profiler,
                                 CleaningPipeline cleaningPipeline,
                                 StarSchemaService starSchemaService,
                                 ModelExportService exportService,
                                 PipelineMetrics metrics) {
        this(properties, source, profiler, cleaningPipeline, starSchemaService, exportService, metrics,
                Clock.systemDefaultZone());
    }

    PipelineRunnerService(RetailStarProperties properties,
                          RawDatasetSource source,
                          DataProfiler profiler,
                          CleaningPipeline cleaningPipeline,
                          StarSchemaService starSchemaService,
                          ModelExportService exportService,
                          PipelineMetrics metrics,
                          Clock clock) {
        this.properties = properties;
        this.source = source;
        this.profiler = profiler;
        this.cleaningPipeline = cleaningPipeline;
        this.starSchemaService = starSchemaService;
        this.exportService = exportService;
        this.metrics = metrics;
        this.clock = clock;
    }

    /* ==================================================================== */
    /* Entry points                                                          */
    /* ==================================================================== */

    /** Runs on the configured {@code retailstar.pipeline.input-file}. */
    public PipelineRunResult run(String jobId) {
        if (!properties.hasInputFile()) {
            return failed(jobId == null || jobId.isBlank() ? RunContext.newJobId() : jobId, "load",
                    new ValidationException("retailstar.pipeline.input-file is not set"), 0);
        }
        return run(Paths.get(properties.getInputFile()), jobId);
    }

    /** Loads the extract at {@code input} through the configured source, then runs on it. */
    public PipelineRunResult run(Path input, String jobId) {
        return execute(jobId, () -> source.read(input));
    }

    /**
     * Runs on an already loaded extract.
     *
     * @param jobId job identifier; a new one is generated when null or blank
     */
    public PipelineRunResult run(RowSet raw, String jobId) {
        return execute(jobId, () -> raw);
    }

    /* ==================================================================== */
    /* Internal pipeline                                                     */
    /* ==================================================================== */

    private PipelineRunResult execute(String requestedJobId, Supplier<RowSet> loader) {
        long started = clock.millis();
        if (requestedJobId != null && !requestedJobId.isBlank()) {
            try {
                InputValidator.validateJobId(requestedJobId);
            } catch (IllegalArgumentException e) {
                return failed(requestedJobId, "start", e, 0);
            }
        }

        RunContext ctx = new RunContext(requestedJobId, clock);
        String jobId = ctx.getJobId();
        PipelineRunResult.PipelineRunResultBuilder result = PipelineRunResult.builder()
                .jobId(jobId)
                .outputs(Collections.emptyMap());
        String stage = "load";

        try (RunContext.MdcScope ignored = ctx.bindMdc()) {
            log.info("[RUN] Starting retail pipeline job {}", jobId);
            try {
                RowSet raw = timed(stage, loader);

                stage = "profiling";
                QualitySummary profile = timed(stage, () -> profiler.profile(raw, ctx));
                result.profile(profile);

                stage = "cleaning";
                CleaningResult cleaning = cleaningPipeline.clean(raw, ctx);
                result.cleaningReport(cleaning.getReport());

                stage = "modeling";
                ModelingResult modeling = starSchemaService.build(cleaning.getRowSet(), ctx);
                result.modelingReport(modeling.getReport()).schema(modeling.getSchema());

                if (properties.isExportEnabled()) {
                    stage = "export";
                    Map<String, Path> outputs = timed(stage,
                            () -> exportService.export(jobId, cleaning, modeling, profile));
                    result.outputs(outputs);
                } else {
                    log.info("[RUN] Export disabled, nothing written");
                }
            } catch (RuntimeException e) {
                ErrorCategory category = ErrorCategory.categorize(e);
                log.error("[RUN] Job {} FAILED in stage {} [{}]: {}", jobId, stage, category.getName(), e.getMessage(), e);
                metrics.recordRunFailure(category.name());
                return result
                        .success(false)
                        .failedStage(stage)
                        .errorCategory(category)
                        .errorMessage(e.getMessage())
                        .issues(new ArrayList<>(ctx.getIssues()))
                        .durationMs(clock.millis() - started)
                        .build();
            }

            metrics.recordRunSuccess();
            long duration = clock.millis() - started;
            log.info("[RUN] Job {} completed in {} ms, {} quality issue(s) recorded",
                    jobId, duration, ctx.getIssues().size());
            return result
                    .success(true)
                    .issues(new ArrayList<>(ctx.getIssues()))
                    .durationMs(duration)
                    .build();
        }
    }

    private <T> T timed(String stage, Supplier<T> work) {
        long started = clock.millis();
        T value = work.get();
        metrics.recordStage(stage, clock.millis() - started);
        return value;
    }

    private PipelineRunResult failed(String jobId, String stage, RuntimeException e, long durationMs) {
        ErrorCategory category = ErrorCategory.categorize(e);
        log.error("[RUN] Job {} rejected before start [{}]: {}", jobId, category.getName(), e.getMessage());
        metrics.recordRunFailure(category.name());
        return PipelineRunResult.builder()
                .jobId(jobId)
                .success(false)
                .failedStage(stage)
                .errorCategory(category)
                .errorMessage(e.getMessage())
                .outputs(Collections.emptyMap())
                .issues(Collections.emptyList())
                .durationMs(durationMs)
                .build();
    }
}
