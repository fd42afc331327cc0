package com.company.energyanalytics.service;

import com.company.energyanalytics.config.AnalyticsConfigValidator;
import com.company.energyanalytics.config.AnalyticsExecutorConfig;
import com.company.energyanalytics.config.AnalyticsProperties;
import com.company.energyanalytics.domain.*;
import com.company.energyanalytics.domain.enums.EventContext;
import com.company.energyanalytics.domain.enums.IssueType;
import com.company.energyanalytics.domain.enums.QuickWinType;
import com.company.energyanalytics.dto.response.AnalysisReportResponse;
import com.company.energyanalytics.exception.InvalidConfigurationException;
import com.company.energyanalytics.util.TimeUtils;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static com.company.energyanalytics.ReadingFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;

class ReportAssemblyServiceTest {

    private static final AnalysisWindow WEEK = AnalysisWindow.of(REPORT_START, REPORT_START.plus(Duration.ofDays(7)));
    private static final BusinessHoursCalendar CALENDAR = BusinessHoursCalendar.weekdays(7, 18);

    // Wednesday 20:00 to 23:00, 12 samples
    private static final int SPIKE_FIRST = (2 * 24 + 20) * 4;
    private static final int SPIKE_LAST = SPIKE_FIRST + 11;

    private AnalyticsProperties properties;
    private SimpleMeterRegistry meterRegistry;

    @BeforeEach
    void setUp() {
        properties = utcProperties();
        meterRegistry = new SimpleMeterRegistry();
    }

    private ReportAssemblyService service(Executor executor) {
        return new ReportAssemblyService(properties,
                new AnalyticsConfigValidator(properties),
                new SensorHealthAnalyzer(properties),
                new AfterHoursWasteAnalyzer(properties),
                new AnomalyDetector(properties),
                new SpikeDetector(properties),
                new QuickWinsGenerator(properties),
                executor,
                meterRegistry);
    }

    /**
     * 2.0 kW in business hours and 1.8 kW after hours, +/- 0.02 kW alternating by sample so
     * that no six-hour stretch is perfectly flat.
     */
    private static double officeLoad(Instant start, int index) {
        Instant timestamp = start.plusSeconds(index * FIFTEEN_MINUTES);
        double level = TimeUtils.isBusinessHours(timestamp, CALENDAR, ZoneOffset.UTC) ? 2.0 : 1.8;
        return alternating(index, level, 0.02);
    }

    private static ChannelData officeChannel() {
        Instant baselineStart = REPORT_START.minus(Duration.ofDays(28));

        return ChannelData.builder()
                .channel(submeter("hvac"))
                .resolutionSeconds(FIFTEEN_MINUTES)
                .readings(series(REPORT_START, FIFTEEN_MINUTES, 672,
                        i -> i >= SPIKE_FIRST && i <= SPIKE_LAST ? 6.0 : officeLoad(REPORT_START, i)))
                .baselineReadings(series(baselineStart, FIFTEEN_MINUTES, 4 * 672, i -> officeLoad(baselineStart, i)))
                .build();
    }

    private static SiteAnalysisRequest officeRequest() {
        return SiteAnalysisRequest.builder()
                .organizationId("org-1")
                .organizationName("Office")
                .reportWindow(WEEK)
                .channel(officeChannel())
                .build();
    }

    @Test
    void eveningSpikeIsCaughtByBothDetectors() {
        AnalysisReportResponse report = service(Runnable::run).generateReport(officeRequest());

        Instant spikeStart = REPORT_START.plusSeconds(SPIKE_FIRST * FIFTEEN_MINUTES);

        assertThat(report.getSensorHealth().getTotalIssues()).isZero();

        // Spike threshold is the 5 kW submeter floor
        assertThat(report.getSpikes()).hasSize(1);
        SpikeEvent spike = report.getSpikes().get(0);
        assertThat(spike.getStart()).isEqualTo(spikeStart);
        assertThat(spike.getIntervals()).isEqualTo(12);
        assertThat(spike.getDuration()).isEqualTo(Duration.ofMinutes(165));
        assertThat(spike.getThresholdKw()).isEqualTo(5.0);
        assertThat(spike.getContext()).isEqualTo(EventContext.AFTER_HOURS);
        assertThat(spike.getTotalExcessKwh()).isCloseTo(12 * (6.0 - 1.82) * 0.25, within(1e-6));

        // Anomaly threshold is q3 + 3 * iqr, about 1.94 kW after hours
        assertThat(report.getAnomalyTimeline()).hasSize(1);
        AnomalyEvent anomaly = report.getAnomalyTimeline().get(0);
        assertThat(anomaly.getStart()).isEqualTo(spikeStart);
        assertThat(anomaly.getIntervals()).isEqualTo(12);
        assertThat(anomaly.getExcessKwh()).isCloseTo(12 * (6.0 - 1.8) * 0.25, within(1e-6));

        assertThat(report.getAfterHoursWaste().getTopMeters()).hasSize(1);
        WasteWindow waste = report.getAfterHoursWaste().getTopMeters().get(0);
        assertThat(waste.getBaselineKw()).isCloseTo(1.78, within(1e-9));
        // 220 jittered samples at +0.04 kW plus the spike itself
        assertThat(waste.getExcessKwh()).isCloseTo(220 * 0.04 * 0.25 + 12 * (6.0 - 1.78) * 0.25, within(1e-6));
        assertThat(waste.getAnnualizedCost()).isCloseTo(waste.getExcessCost() * 52, within(1e-9));

        assertThat(report.getQuickWins()).extracting(QuickWin::getType).containsExactly(
                QuickWinType.SUMMARY, QuickWinType.AFTER_HOURS_WASTE, QuickWinType.ANOMALY, QuickWinType.SPIKE);

        assertThat(report.getDataQuality().getChannelsAnalyzed()).isEqualTo(1);
        assertThat(report.getDataQuality().getAvgCompletenessPct()).isCloseTo(100.0, within(1e-9));
        assertThat(report.getSummary().getTotalPotentialSavings().getWeeklyKwh())
                .isCloseTo(waste.getExcessKwh() + anomaly.getExcessKwh(), within(1e-9));
        assertThat(report.getSummary().getTopOpportunities()).hasSize(3);

        assertThat(report.getMetadata().getBaselineStart()).isEqualTo(REPORT_START.minus(Duration.ofDays(28)));
        assertThat(report.getMetadata().getBaselineEnd()).isEqualTo(REPORT_START);
        assertThat(meterRegistry.counter("analytics.reports.generated").count()).isEqualTo(1.0);
        assertThat(meterRegistry.counter("analytics.findings", "type", "spike").count()).isEqualTo(1.0);
    }

    @Test
    void repeatedRunsProduceIdenticalFindings() {
        ReportAssemblyService service = service(Runnable::run);

        AnalysisReportResponse first = service.generateReport(officeRequest());
        AnalysisReportResponse second = service.generateReport(officeRequest());

        assertThat(second.getSensorHealth()).isEqualTo(first.getSensorHealth());
        assertThat(second.getAfterHoursWaste()).isEqualTo(first.getAfterHoursWaste());
        assertThat(second.getAnomalyTimeline()).isEqualTo(first.getAnomalyTimeline());
        assertThat(second.getSpikes()).isEqualTo(first.getSpikes());
        assertThat(second.getQuickWins()).isEqualTo(first.getQuickWins());
    }

    @Test
    void quickWinsAreTruncatedToMaxCount() {
        properties.getQuickWins().setMaxCount(2);

        AnalysisReportResponse report = service(Runnable::run).generateReport(officeRequest());

        assertThat(report.getQuickWins()).extracting(QuickWin::getType)
                .containsExactly(QuickWinType.SUMMARY, QuickWinType.AFTER_HOURS_WASTE);
    }

    @Test
    void channelOrderSurvivesParallelAnalysis() {
        SiteAnalysisRequest.SiteAnalysisRequestBuilder request = SiteAnalysisRequest.builder()
                .organizationId("org-1")
                .reportWindow(WEEK);
        for (int i = 1; i <= 8; i++) {
            request.channel(ChannelData.builder()
                    .channel(submeter("c" + i))
                    .resolutionSeconds(FIFTEEN_MINUTES)
                    .build());
        }

        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            AnalysisReportResponse report = service(pool).generateReport(request.build());

            assertThat(report.getSensorHealth().getIssues())
                    .extracting(HealthIssue::getChannelId)
                    .containsExactly("c1", "c2", "c3", "c4", "c5", "c6", "c7", "c8");
            assertThat(report.getSensorHealth().getIssues())
                    .allMatch(i -> i.getType() == IssueType.NO_DATA);
            assertThat(report.getDataQuality().getChannelsWithoutBaseline()).isEqualTo(8);
            assertThat(report.getDataQuality().getAvgCompletenessPct()).isZero();
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void siteLargerThanPoolAndQueueIsAnalyzedCompletely() {
        // Default sizing: 8 threads and 100 queued tasks
        ThreadPoolTaskExecutor executor = new AnalyticsExecutorConfig(properties).analyticsExecutor();
        List<Reading> week = officeChannel().getReadings();

        SiteAnalysisRequest.SiteAnalysisRequestBuilder request = SiteAnalysisRequest.builder()
                .organizationId("org-1")
                .reportWindow(WEEK);
        for (int i = 0; i < 150; i++) {
            request.channel(ChannelData.builder()
                    .channel(submeter("m" + i))
                    .resolutionSeconds(FIFTEEN_MINUTES)
                    .readings(week)
                    .build());
        }

        try {
            AnalysisReportResponse report = service(executor).generateReport(request.build());

            assertThat(report.getDataQuality().getChannelsAnalyzed()).isEqualTo(150);
            assertThat(report.getSensorHealth().getTotalIssues()).isZero();
            // Identical waste on every meter, so ranking keeps channel order
            assertThat(report.getAfterHoursWaste().getTopMeters())
                    .extracting(WasteWindow::getChannelId)
                    .containsExactlyElementsOf(IntStream.range(0, 150)
                            .mapToObj(i -> "m" + i)
                            .collect(Collectors.toList()));
        } finally {
            executor.shutdown();
        }
    }

    @Test
    void windowShorterThanResolutionIsRejected() {
        SiteAnalysisRequest request = SiteAnalysisRequest.builder()
                .organizationId("org-1")
                .reportWindow(AnalysisWindow.of(REPORT_START, REPORT_START.plusSeconds(600)))
                .channel(ChannelData.builder()
                        .channel(submeter("m1"))
                        .resolutionSeconds(FIFTEEN_MINUTES)
                        .reading(Reading.of(REPORT_START, 3.0))
                        .build())
                .build();

        assertThatThrownBy(() -> service(Runnable::run).generateReport(request))
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessageContaining("channel m1: resolutionSeconds 900 is longer than the report window");
    }

    @Test
    void channelWithoutBaselineSkipsAnomalyAndSpikeDetection() {
        ChannelData office = officeChannel();
        ChannelData noHistory = ChannelData.builder()
                .channel(office.getChannel())
                .resolutionSeconds(FIFTEEN_MINUTES)
                .readings(office.getReadings())
                .build();

        AnalysisReportResponse report = service(Runnable::run).generateReport(SiteAnalysisRequest.builder()
                .organizationId("org-1")
                .reportWindow(WEEK)
                .channel(noHistory)
                .build());

        assertThat(report.getAnomalyTimeline()).isEmpty();
        assertThat(report.getSpikes()).isEmpty();
        assertThat(report.getAfterHoursWaste().getTopMeters()).hasSize(1);
    }

    @Test
    void invalidConfigurationFailsBeforeAnyAnalysis() {
        properties.getAnomaly().setIqrMultiplier(-1);
        SensorHealthAnalyzer sensorHealth = mock(SensorHealthAnalyzer.class);
        AfterHoursWasteAnalyzer afterHours = mock(AfterHoursWasteAnalyzer.class);
        AnomalyDetector anomalies = mock(AnomalyDetector.class);
        SpikeDetector spikes = mock(SpikeDetector.class);
        QuickWinsGenerator quickWins = mock(QuickWinsGenerator.class);

        ReportAssemblyService service = new ReportAssemblyService(properties, new AnalyticsConfigValidator(properties),
                sensorHealth, afterHours, anomalies, spikes, quickWins, Runnable::run, meterRegistry);

        assertThatThrownBy(() -> service.generateReport(officeRequest()))
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessageContaining("anomaly.iqrMultiplier");
        verifyNoInteractions(sensorHealth, afterHours, anomalies, spikes, quickWins);
    }

    @Test
    void invalidChannelFailsWholeRun() {
        SiteAnalysisRequest request = SiteAnalysisRequest.builder()
                .organizationId("org-1")
                .reportWindow(WEEK)
                .channel(officeChannel())
                .channel(ChannelData.builder().channel(submeter("broken")).resolutionSeconds(-900).build())
                .build();

        assertThatThrownBy(() -> service(Runnable::run).generateReport(request))
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessageContaining("channel broken");
        assertThat(meterRegistry.counter("analytics.reports.generated").count()).isZero();
    }

    @Test
    void missingReportWindowDefaultsToLastCompleteWeek() {
        SiteAnalysisRequest request = SiteAnalysisRequest.builder()
                .organizationId("org-1")
                .referenceTime(Instant.parse("2026-03-11T12:00:00Z"))
                .build();

        SiteAnalysisRequest resolved = service(Runnable::run).resolveWindows(request);

        assertThat(resolved.getReportWindow()).isEqualTo(WEEK);
        assertThat(resolved.getBaselineWindow())
                .isEqualTo(AnalysisWindow.of(REPORT_START.minus(Duration.ofDays(28)), REPORT_START));
    }
}
