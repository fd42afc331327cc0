package com.company.energyanalytics.util;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * A single reading that crossed a detector threshold.
 */
@Value
@Builder
public class FlaggedInterval {
    Instant timestamp;
    double powerKw;

    // Bucket reference level the excess is measured against (median or P95)
    double referenceKw;
    double thresholdKw;
    double excessKwh;
    double zScore;
    boolean businessHours;
}
