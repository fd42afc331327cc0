package com.company.energyanalytics.domain.enums;

/**
 * Which readings feed the after-hours idle baseline.
 */
public enum BaselineSource {
    // After-hours readings of the report window itself
    REPORT_WINDOW,
    // After-hours readings of the historical baseline window, report window if that is empty
    BASELINE_WINDOW
}
