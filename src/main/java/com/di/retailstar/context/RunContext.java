package com.di.retailstar.context;

import lombok.Getter;
import org.slf4j.MDC;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Explicit per-run state handed to every stage: job identifier, clock and the
 * accumulating quality metrics. Nothing about a run lives in static state, so two
 * runs in one JVM never share counters.
 */
@Getter
public class RunContext {

    /** MDC key carrying the job id for the duration of a run. */
    public static final String MDC_JOB_ID = "jobId";

    private final String jobId;
    private final Clock clock;
    private final Instant startedAt;
    private final QualityStats qualityStats = new QualityStats();
    private final List<QualityIssue> issues = Collections.synchronizedList(new ArrayList<>());

    public RunContext(String jobId, Clock clock) {
        this.jobId = (jobId == null || jobId.isBlank()) ? newJobId() : jobId.trim();
        this.clock = clock == null ? Clock.systemDefaultZone() : clock;
        this.startedAt = this.clock.instant();
    }

    public static RunContext create(String jobId) {
        return new RunContext(jobId, Clock.systemDefaultZone());
    }

    /** Short job id: first 8 hex characters of a random UUID. */
    public static String newJobId() {
        return UUID.randomUUID().toString().replace("-", "").substring(0, 8);
    }

    /**
     * Records {@code count} under {@code metric} and, when non-zero, raises an issue of the
     * given type so it reaches the reports.
     */
    public void recordIssue(QualityIssueType type, String stage, String metric, long count, String detail) {
        qualityStats.record(metric, count);
        if (count > 0) {
            issues.add(QualityIssue.builder()
                    .type(type)
                    .stage(stage)
                    .metric(metric)
                    .count(count)
                    .detail(detail)
                    .build());
        }
    }

    public List<QualityIssue> issuesOf(QualityIssueType type) {
        synchronized (issues) {
            return issues.stream().filter(i -> i.getType() == type).collect(Collectors.toList());
        }
    }

    /**
     * Puts the job id into the SLF4J MDC until the returned scope is closed.
     * <pre>{@code try (RunContext.MdcScope ignored = ctx.bindMdc()) { ... } }</pre>
     */
    public MdcScope bindMdc() {
        String previous = MDC.get(MDC_JOB_ID);
        MDC.put(MDC_JOB_ID, jobId);
        return () -> {
            if (previous == null) {
                MDC.remove(MDC_JOB_ID);
            } else {
                MDC.put(MDC_JOB_ID, previous);
            }
        };
    }

    @FunctionalInterface
    public interface MdcScope extends AutoCloseable {
        @Override
        void close();
    }
}
