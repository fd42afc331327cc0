package com.company.energyanalytics.domain;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Input of one report run: the windows, an optional live reference instant for
 * stale-data checks and the per-channel readings.
 */
@Value
@Builder
public class SiteAnalysisRequest {
    String organizationId;
    String organizationName;
    AnalysisWindow reportWindow;
    AnalysisWindow baselineWindow;

    // Null means "now" is the end of the report window
    Instant referenceTime;

    @Singular
    List<ChannelData> channels;
}
