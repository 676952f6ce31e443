package com.di.retailstar.context;

import lombok.Builder;
import lombok.Value;

/** One counted condition raised by a stage of a run. */
@Value
@Builder
public class QualityIssue {
    QualityIssueType type;
    String stage;
    String metric;
    long count;
    String detail;
}
