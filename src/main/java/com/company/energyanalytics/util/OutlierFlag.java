package com.company.energyanalytics.util;

import lombok.Value;

@Value
public class OutlierFlag {
    int index;
    double value;
    boolean outlier;
    double lowerBound;
    double upperBound;
}
