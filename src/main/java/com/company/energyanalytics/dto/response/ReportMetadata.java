package com.company.energyanalytics.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReportMetadata {
    private String organizationId;
    private String organizationName;
    private Instant reportStart;
    private Instant reportEnd;
    private Instant baselineStart;
    private Instant baselineEnd;
    private String timezone;
    private int channelCount;
    private Instant generatedAt;
    private Long durationMs;
}
