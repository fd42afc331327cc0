package com.company.energyanalytics.domain;

import lombok.Value;

import java.io.Serializable;
import java.time.Duration;
import java.time.Instant;

/**
 * Half-open time range [start, end) used for report and baseline periods.
 */
@Value(staticConstructor = "of")
public class AnalysisWindow implements Serializable {
    private static final long serialVersionUID = 1L;

    Instant start;
    Instant end;

    public Duration getDuration() {
        return Duration.between(start, end);
    }

    public long getSeconds() {
        return getDuration().getSeconds();
    }

    public boolean contains(Instant instant) {
        return !instant.isBefore(start) && instant.isBefore(end);
    }
}
