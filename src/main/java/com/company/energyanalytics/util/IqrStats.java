package com.company.energyanalytics.util;

import lombok.Value;

@Value
public class IqrStats {
    double q1;
    double q3;
    double iqr;

    public double upperFence(double multiplier) {
        return q3 + multiplier * iqr;
    }

    // Lower bound of the general-purpose outlier fence
    public double lowerFence(double multiplier) {
        return q1 - multiplier * iqr;
    }
}
