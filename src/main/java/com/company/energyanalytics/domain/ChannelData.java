package com.company.energyanalytics.domain;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Everything the analyzers need for one channel: report-window readings,
 * baseline-window readings and the nominal sampling resolution.
 */
@Value
@Builder
public class ChannelData {
    Channel channel;
    long resolutionSeconds;

    @Singular
    List<Reading> readings;

    @Singular
    List<Reading> baselineReadings;
}
