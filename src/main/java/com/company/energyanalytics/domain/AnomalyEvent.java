package com.company.energyanalytics.domain;

import com.company.energyanalytics.domain.enums.EventContext;
import lombok.Builder;
import lombok.Value;

import java.io.Serializable;
import java.time.Instant;

@Value
@Builder
public class AnomalyEvent implements Serializable {
    private static final long serialVersionUID = 1L;

    String channelId;
    String channelName;
    Instant start;
    Instant end;
    int intervals;
    double peakPowerKw;
    double excessKwh;
    double maxZScore;
    EventContext context;
}
