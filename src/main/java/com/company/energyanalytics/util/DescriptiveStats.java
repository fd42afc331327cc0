package com.company.energyanalytics.util;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class DescriptiveStats {
    int count;
    double sum;
    double mean;
    double min;
    double max;
    double median;
    double stdDev;

    public static DescriptiveStats empty() {
        return DescriptiveStats.builder().build();
    }
}
