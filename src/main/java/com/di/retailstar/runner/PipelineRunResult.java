package com.di.retailstar.runner;

import com.di.retailstar.cleaning.CleaningReport;
import com.di.retailstar.context.QualityIssue;
import com.di.retailstar.exception.ErrorCategory;
import com.di.retailstar.modeling.ModelingReport;
import com.di.retailstar.modeling.StarSchema;
import com.di.retailstar.profiling.QualitySummary;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one pipeline run. A failed run carries the error category and message and
 * whatever reports were produced before the failing stage.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PipelineRunResult {

    private String jobId;

    private boolean success;

    /** Stage that was running when the run failed, null on success. */
    private String failedStage;

    private QualitySummary profile;
    private CleaningReport cleaningReport;
    private ModelingReport modelingReport;

    /** The assembled tables; null unless modeling completed. */
    private StarSchema schema;

    /** Artifact file name to path; empty when export is disabled or did not run. */
    private Map<String, Path> outputs;

    /** Counted warnings and advisories raised during the run. */
    private List<QualityIssue> issues;

    private ErrorCategory errorCategory;
    private String errorMessage;

    private long durationMs;
}
