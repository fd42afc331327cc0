package com.company.energyanalytics.service;

import com.company.energyanalytics.config.AnalyticsConfigValidator;
import com.company.energyanalytics.config.AnalyticsProperties;
import com.company.energyanalytics.domain.*;
import com.company.energyanalytics.domain.enums.Priority;
import com.company.energyanalytics.domain.enums.Severity;
import com.company.energyanalytics.dto.response.*;
import com.company.energyanalytics.util.ReadingSeries;
import com.company.energyanalytics.util.StatsUtils;
import com.company.energyanalytics.util.TimeUtils;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.Builder;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.*;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;

/**
 * Runs every analyzer over every channel of a site and assembles the weekly report.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ReportAssemblyService {

    private static final int TOP_RISKS = 5;
    private static final int TOP_OPPORTUNITIES = 3;

    private final AnalyticsProperties properties;
    private final AnalyticsConfigValidator validator;
    private final SensorHealthAnalyzer sensorHealthAnalyzer;
    private final AfterHoursWasteAnalyzer afterHoursWasteAnalyzer;
    private final AnomalyDetector anomalyDetector;
    private final SpikeDetector spikeDetector;
    private final QuickWinsGenerator quickWinsGenerator;
    @Qualifier("analyticsExecutor")
    private final Executor analyticsExecutor;
    private final MeterRegistry meterRegistry;

    /**
     * Generate the report for one site.
     *
     * @throws com.company.energyanalytics.exception.InvalidConfigurationException before any analysis
     *         when options, windows or channel definitions are invalid
     */
    public AnalysisReportResponse generateReport(SiteAnalysisRequest request) {
        Timer.Sample sample = Timer.start(meterRegistry);

        // Options first: window resolution needs a valid timezone
        validator.validateProperties();
        SiteAnalysisRequest resolved = resolveWindows(request);
        validator.validate(resolved);

        log.info("Generating report for organization {} over {} channel(s), window {} to {}",
                resolved.getOrganizationId(), resolved.getChannels().size(),
                resolved.getReportWindow().getStart(), resolved.getReportWindow().getEnd());

        List<ChannelResult> results = analyzeChannels(resolved);
        AnalysisReportResponse report = assemble(resolved, results, sample);

        meterRegistry.counter("analytics.reports.generated").increment();
        meterRegistry.counter("analytics.channels.analyzed").increment(results.size());
        meterRegistry.counter("analytics.findings", "type", "health_issue")
                .increment(report.getSensorHealth().getTotalIssues());
        meterRegistry.counter("analytics.findings", "type", "anomaly")
                .increment(report.getAnomalyTimeline().size());
        meterRegistry.counter("analytics.findings", "type", "spike")
                .increment(report.getSpikes().size());

        log.info("Report for organization {} completed in {}ms: {} issue(s), {} waste window(s), "
                        + "{} anomaly event(s), {} spike(s), {} quick win(s)",
                resolved.getOrganizationId(), report.getMetadata().getDurationMs(),
                report.getSensorHealth().getTotalIssues(), report.getAfterHoursWaste().getTopMeters().size(),
                report.getAnomalyTimeline().size(), report.getSpikes().size(), report.getQuickWins().size());
        return report;
    }

    /**
     * Fill in a missing report window (last complete week) and a missing baseline window
     * ({@code baseline.weeksCount} report lengths immediately before the report).
     */
    SiteAnalysisRequest resolveWindows(SiteAnalysisRequest request) {
        AnalysisWindow report = request.getReportWindow();
        if (report == null) {
            Instant reference = request.getReferenceTime() != null ? request.getReferenceTime() : Instant.now();
            report = TimeUtils.lastCompleteWeek(properties.zoneId(), reference);
            log.debug("No report window given, using last complete week {} to {}", report.getStart(), report.getEnd());
        }

        AnalysisWindow baseline = request.getBaselineWindow();
        if (baseline == null && report.getStart() != null && report.getEnd() != null
                && report.getEnd().isAfter(report.getStart())) {
            baseline = TimeUtils.baselineWindow(report, properties.getBaseline().getWeeksCount());
        }

        return SiteAnalysisRequest.builder()
                .organizationId(request.getOrganizationId())
                .organizationName(request.getOrganizationName())
                .reportWindow(report)
                .baselineWindow(baseline)
                .referenceTime(request.getReferenceTime())
                .channels(request.getChannels())
                .build();
    }

    private List<ChannelResult> analyzeChannels(SiteAnalysisRequest request) {
        List<CompletableFuture<ChannelResult>> futures = request.getChannels().stream()
                .map(channelData -> CompletableFuture.supplyAsync(
                        () -> analyzeChannel(channelData, request), analyticsExecutor))
                .collect(Collectors.toList());

        // Joined in input order so the report does not depend on completion order
        List<ChannelResult> results = new ArrayList<>();
        for (CompletableFuture<ChannelResult> future : futures) {
            try {
                results.add(future.join());
            } catch (CompletionException e) {
                if (e.getCause() instanceof RuntimeException) {
                    throw (RuntimeException) e.getCause();
                }
                throw e;
            }
        }
        return results;
    }

    private ChannelResult analyzeChannel(ChannelData channelData, SiteAnalysisRequest request) {
        Channel channel = channelData.getChannel();
        AnalysisWindow window = request.getReportWindow();
        long resolution = channelData.getResolutionSeconds();

        List<HealthIssue> issues = sensorHealthAnalyzer.analyze(
                channel, channelData.getReadings(), window, resolution, request.getReferenceTime());

        Optional<WasteWindow> waste = afterHoursWasteAnalyzer.analyze(
                channel, channelData.getReadings(), channelData.getBaselineReadings(), window, resolution);

        List<AnomalyEvent> anomalies = List.of();
        List<SpikeEvent> spikes = List.of();
        boolean hasBaseline = !channelData.getBaselineReadings().isEmpty();

        if (hasBaseline) {
            anomalies = anomalyDetector.detect(
                    channel, channelData.getReadings(), channelData.getBaselineReadings(), resolution);
            spikes = spikeDetector.detect(
                    channel, channelData.getReadings(), channelData.getBaselineReadings(), resolution);
        } else {
            log.warn("Channel {} has no baseline readings, skipping anomaly and spike detection",
                    channel.getChannelId());
        }

        long expected = TimeUtils.expectedSampleCount(window, resolution);
        long actual = ReadingSeries.normalize(channelData.getReadings()).stream()
                .filter(r -> r.hasAnyValue() && window.contains(r.getTimestamp()))
                .count();

        return ChannelResult.builder()
                .channel(channel)
                .issues(issues)
                .waste(waste.orElse(null))
                .anomalies(anomalies)
                .spikes(spikes)
                .completenessPct(StatsUtils.completenessPct(actual, expected))
                .hasBaseline(hasBaseline)
                .build();
    }

    private AnalysisReportResponse assemble(SiteAnalysisRequest request, List<ChannelResult> results,
                                            Timer.Sample sample) {
        AnalysisWindow window = request.getReportWindow();

        List<HealthIssue> issues = SensorHealthAnalyzer.sortBySeverity(results.stream()
                .flatMap(r -> r.getIssues().stream())
                .collect(Collectors.toList()));

        List<WasteWindow> wasteWindows = AfterHoursWasteAnalyzer.rank(results.stream()
                .map(ChannelResult::getWaste)
                .filter(Objects::nonNull)
                .collect(Collectors.toList()));

        List<AnomalyEvent> timeline = results.stream()
                .flatMap(r -> r.getAnomalies().stream())
                .sorted(Comparator.comparing(AnomalyEvent::getStart))
                .collect(Collectors.toList());

        List<SpikeEvent> spikes = SpikeDetector.rankByPeak(results.stream()
                .flatMap(r -> r.getSpikes().stream())
                .collect(Collectors.toList()));

        List<QuickWin> quickWins = quickWinsGenerator.generate(wasteWindows, issues, timeline, spikes, window)
                .stream()
                .limit(properties.getQuickWins().getMaxCount())
                .collect(Collectors.toList());

        SensorHealthSection sensorHealth = sensorHealthSection(issues);
        AfterHoursSection afterHours = afterHoursSection(wasteWindows);
        DataQualitySummary dataQuality = dataQuality(results);
        ReportSummary summary = summary(results, sensorHealth, afterHours, timeline, spikes, quickWins, window);

        long durationNanos = sample.stop(meterRegistry.timer("analytics.reports.duration"));

        return AnalysisReportResponse.builder()
                .metadata(ReportMetadata.builder()
                        .organizationId(request.getOrganizationId())
                        .organizationName(request.getOrganizationName())
                        .reportStart(window.getStart())
                        .reportEnd(window.getEnd())
                        .baselineStart(request.getBaselineWindow() != null ? request.getBaselineWindow().getStart() : null)
                        .baselineEnd(request.getBaselineWindow() != null ? request.getBaselineWindow().getEnd() : null)
                        .timezone(properties.getTimezone())
                        .channelCount(results.size())
                        .generatedAt(Instant.now())
                        .durationMs(durationNanos / 1_000_000)
                        .build())
                .summary(summary)
                .sensorHealth(sensorHealth)
                .afterHoursWaste(afterHours)
                .anomalyTimeline(timeline)
                .spikes(spikes)
                .quickWins(quickWins)
                .dataQuality(dataQuality)
                .build();
    }

    private SensorHealthSection sensorHealthSection(List<HealthIssue> issues) {
        Map<Severity, Long> bySeverity = issues.stream()
                .collect(Collectors.groupingBy(HealthIssue::getSeverity, Collectors.counting()));

        // CRITICAL counts with HIGH
        int high = (int) (bySeverity.getOrDefault(Severity.HIGH, 0L) + bySeverity.getOrDefault(Severity.CRITICAL, 0L));

        return SensorHealthSection.builder()
                .totalIssues(issues.size())
                .highSeverity(high)
                .mediumSeverity(bySeverity.getOrDefault(Severity.MEDIUM, 0L).intValue())
                .lowSeverity(bySeverity.getOrDefault(Severity.LOW, 0L).intValue())
                .summary(SensorHealthAnalyzer.summarize(issues))
                .issues(issues)
                .build();
    }

    private AfterHoursSection afterHoursSection(List<WasteWindow> wasteWindows) {
        return AfterHoursSection.builder()
                .totalExcessKwh(wasteWindows.stream().mapToDouble(WasteWindow::getExcessKwh).sum())
                .totalExcessCost(wasteWindows.stream().mapToDouble(WasteWindow::getExcessCost).sum())
                .estimatedAnnualCost(wasteWindows.stream().mapToDouble(WasteWindow::getAnnualizedCost).sum())
                .topMeters(wasteWindows)
                .build();
    }

    private DataQualitySummary dataQuality(List<ChannelResult> results) {
        return DataQualitySummary.builder()
                .channelsAnalyzed(results.size())
                .channelsWithIssues((int) results.stream().filter(r -> !r.getIssues().isEmpty()).count())
                .channelsWithoutBaseline((int) results.stream().filter(r -> !r.isHasBaseline()).count())
                .avgCompletenessPct(StatsUtils.mean(results.stream()
                        .map(ChannelResult::getCompletenessPct)
                        .collect(Collectors.toList())))
                .build();
    }

    private ReportSummary summary(List<ChannelResult> results, SensorHealthSection sensorHealth,
                                  AfterHoursSection afterHours, List<AnomalyEvent> timeline,
                                  List<SpikeEvent> spikes, List<QuickWin> quickWins, AnalysisWindow window) {
        double weeklyFactor = TimeUtils.weeklyFactor(window);
        double anomalyExcess = timeline.stream().mapToDouble(AnomalyEvent::getExcessKwh).sum();
        double weeklySavingsKwh = (afterHours.getTotalExcessKwh() + anomalyExcess) * weeklyFactor;

        List<String> headlines = new ArrayList<>();
        headlines.add(String.format("%d channel(s) analyzed, %d sensor health issue(s) (%d high severity)",
                results.size(), sensorHealth.getTotalIssues(), sensorHealth.getHighSeverity()));
        if (afterHours.getTotalExcessKwh() > 0) {
            headlines.add(String.format("After-hours excess of %.0f kWh ($%.2f) across %d meter(s)",
                    afterHours.getTotalExcessKwh(), afterHours.getTotalExcessCost(),
                    afterHours.getTopMeters().size()));
        }
        if (!timeline.isEmpty()) {
            headlines.add(String.format("%d anomaly event(s) totalling %.1f kWh above normal",
                    timeline.size(), anomalyExcess));
        }
        if (!spikes.isEmpty()) {
            headlines.add(String.format("%d demand spike(s), highest %.1f kW on %s",
                    spikes.size(), spikes.get(0).getPeakPowerKw(), displayName(spikes.get(0))));
        }

        List<String> topRisks = new ArrayList<>();
        sensorHealth.getIssues().stream()
                .filter(i -> i.getSeverity().isAtLeast(Severity.HIGH))
                .limit(TOP_RISKS)
                .forEach(i -> topRisks.add(String.format("%s: %s",
                        i.getChannelName() != null ? i.getChannelName() : i.getChannelId(), i.getDescription())));
        spikes.stream()
                .limit(Math.max(0, TOP_RISKS - topRisks.size()))
                .forEach(s -> topRisks.add(String.format("%s: spike to %.1f kW at %s",
                        displayName(s), s.getPeakPowerKw(), s.getStart())));

        List<String> topOpportunities = quickWins.stream()
                .filter(w -> w.getPriority() != Priority.LOW)
                .limit(TOP_OPPORTUNITIES)
                .map(QuickWin::getTitle)
                .collect(Collectors.toList());

        return ReportSummary.builder()
                .headlines(headlines)
                .topRisks(topRisks)
                .topOpportunities(topOpportunities)
                .totalPotentialSavings(QuickWinImpact.ofWeekly(weeklySavingsKwh, properties.getCostPerKwh(),
                        "After-hours and anomaly excess"))
                .build();
    }

    private static String displayName(SpikeEvent spike) {
        return spike.getChannelName() != null ? spike.getChannelName() : spike.getChannelId();
    }

    @Value
    @Builder
    private static class ChannelResult {
        Channel channel;
        List<HealthIssue> issues;
        WasteWindow waste;
        List<AnomalyEvent> anomalies;
        List<SpikeEvent> spikes;
        double completenessPct;
        boolean hasBaseline;
    }
}
