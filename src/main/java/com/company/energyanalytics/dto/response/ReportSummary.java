package com.company.energyanalytics.dto.response;

import com.company.energyanalytics.domain.QuickWinImpact;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Executive summary shown at the top of a report.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReportSummary {
    private List<String> headlines;
    private List<String> topRisks;
    private List<String> topOpportunities;

    // After-hours and anomaly excess, normalized to a week
    private QuickWinImpact totalPotentialSavings;
}
