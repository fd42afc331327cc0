package com.company.energyanalytics.domain;

import com.company.energyanalytics.domain.enums.EventContext;
import lombok.Builder;
import lombok.Value;

import java.io.Serializable;
import java.time.Duration;
import java.time.Instant;

@Value
@Builder
public class SpikeEvent implements Serializable {
    private static final long serialVersionUID = 1L;

    String channelId;
    String channelName;
    Instant start;
    Instant end;
    Duration duration;
    int intervals;
    double peakPowerKw;
    double thresholdKw;
    double totalExcessKwh;
    EventContext context;
}
