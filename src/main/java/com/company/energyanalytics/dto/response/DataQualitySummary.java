package com.company.energyanalytics.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DataQualitySummary {
    private int channelsAnalyzed;
    private int channelsWithIssues;
    private int channelsWithoutBaseline;
    private double avgCompletenessPct;
}
