package com.company.energyanalytics.domain.enums;

public enum QuickWinType {
    AFTER_HOURS_WASTE,
    SENSOR_HEALTH,
    ANOMALY,
    SPIKE,
    SUMMARY
}
