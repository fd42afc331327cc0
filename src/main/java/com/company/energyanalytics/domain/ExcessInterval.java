package com.company.energyanalytics.domain;

import lombok.Builder;
import lombok.Value;

import java.io.Serializable;
import java.time.Instant;

@Value
@Builder
public class ExcessInterval implements Serializable {
    private static final long serialVersionUID = 1L;

    Instant timestamp;
    double powerKw;
    double baselineKw;
    double excessKw;
    double excessKwh;
}
