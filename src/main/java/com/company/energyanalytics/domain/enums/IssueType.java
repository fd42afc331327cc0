package com.company.energyanalytics.domain.enums;

public enum IssueType {
    GAP("Missing data gap"),
    STALE("No recent data"),
    FLATLINE("Sensor stuck at a constant value"),
    LOW_COMPLETENESS("Data completeness below threshold"),
    NO_DATA("No readings in the report window");

    private final String description;

    IssueType(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
