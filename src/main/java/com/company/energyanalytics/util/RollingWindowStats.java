package com.company.energyanalytics.util;

import lombok.Value;

/**
 * Statistics of one sliding window, tagged with the index of the window's last element.
 */
@Value
public class RollingWindowStats {
    int index;
    double mean;
    double stdDev;
    double min;
    double max;

    public double getVariance() {
        return stdDev * stdDev;
    }
}
