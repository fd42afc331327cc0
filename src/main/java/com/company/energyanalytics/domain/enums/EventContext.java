package com.company.energyanalytics.domain.enums;

/**
 * Whether a grouped event happened mostly inside or outside business hours.
 */
public enum EventContext {
    BUSINESS_HOURS,
    AFTER_HOURS
}
