package com.company.energyanalytics.domain.enums;

public enum Severity {
    LOW(1, "Low severity - informational"),
    MEDIUM(2, "Medium severity - requires attention"),
    HIGH(3, "High severity - data cannot be trusted"),
    CRITICAL(4, "Critical severity - no usable data");

    private final int level;
    private final String description;

    Severity(int level, String description) {
        this.level = level;
        this.description = description;
    }

    public int getLevel() {
        return level;
    }

    public String getDescription() {
        return description;
    }

    public boolean isAtLeast(Severity other) {
        return this.level >= other.level;
    }
}
