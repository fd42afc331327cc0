package com.company.energyanalytics.dto.response;

import com.company.energyanalytics.domain.HealthIssue;
import com.company.energyanalytics.domain.IssueSummary;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SensorHealthSection {
    private int totalIssues;
    private int highSeverity;
    private int mediumSeverity;
    private int lowSeverity;
    private List<IssueSummary> summary;
    private List<HealthIssue> issues;
}
