package com.company.energyanalytics.util;

import lombok.Value;

import java.time.Instant;

@Value
public class TimeGap {
    Instant start;
    Instant end;
    long actualIntervalSeconds;
    long expectedIntervals;
    long missingIntervals;
}
