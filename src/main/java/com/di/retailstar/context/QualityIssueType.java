package com.di.retailstar.context;

/**
 * Classes of counted, recoverable conditions. None of them stops a run; they surface
 * through the cleaning and modeling reports.
 */
public enum QualityIssueType {

    PARSE_WARNING("Parse warning", "Value could not be parsed and was replaced by a missing marker"),
    INTEGRITY_WARNING("Integrity warning", "Fact row kept with an unresolved dimension reference"),
    DATA_QUALITY_ADVISORY("Data quality advisory", "Business-meaningful condition, informational only");

    private final String name;
    private final String description;

    QualityIssueType(String name, String description) {
        this.name = name;
        this.description = description;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }
}
