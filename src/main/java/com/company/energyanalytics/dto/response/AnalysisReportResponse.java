package com.company.energyanalytics.dto.response;

import com.company.energyanalytics.domain.AnomalyEvent;
import com.company.energyanalytics.domain.QuickWin;
import com.company.energyanalytics.domain.SpikeEvent;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Complete weekly analytics report for one site.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnalysisReportResponse {
    private ReportMetadata metadata;
    private ReportSummary summary;
    private SensorHealthSection sensorHealth;
    private AfterHoursSection afterHoursWaste;

    // Chronological across channels
    private List<AnomalyEvent> anomalyTimeline;

    // Largest peak first
    private List<SpikeEvent> spikes;

    private List<QuickWin> quickWins;
    private DataQualitySummary dataQuality;
}
