package com.company.energyanalytics.domain;

import lombok.Builder;
import lombok.Value;

import java.io.Serializable;
import java.time.Instant;

/**
 * One interval sample for one channel. Timestamps are expected to be resolved
 * already; the engine only converts them into the configured analysis zone.
 */
@Value
@Builder
public class Reading implements Serializable {
    private static final long serialVersionUID = 1L;

    Instant timestamp;
    Double powerKw;
    Double energyKwh;

    // Pass-through fields, not used by the analytics
    Double voltage;
    Double current;
    Double powerFactor;
    Double temperature;

    public boolean hasPower() {
        return powerKw != null && !powerKw.isNaN();
    }

    public boolean hasAnyValue() {
        return hasPower() || (energyKwh != null && !energyKwh.isNaN());
    }

    public static Reading of(Instant timestamp, Double powerKw) {
        return Reading.builder().timestamp(timestamp).powerKw(powerKw).build();
    }
}
