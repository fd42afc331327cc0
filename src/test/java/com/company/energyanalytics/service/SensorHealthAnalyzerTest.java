package com.company.energyanalytics.service;

import com.company.energyanalytics.domain.AnalysisWindow;
import com.company.energyanalytics.domain.Channel;
import com.company.energyanalytics.domain.HealthIssue;
import com.company.energyanalytics.domain.IssueSummary;
import com.company.energyanalytics.domain.Reading;
import com.company.energyanalytics.domain.enums.IssueType;
import com.company.energyanalytics.domain.enums.Severity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static com.company.energyanalytics.ReadingFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;

class SensorHealthAnalyzerTest {

    private static final Channel CHANNEL = submeter("m1");
    private static final AnalysisWindow DAY = AnalysisWindow.of(REPORT_START, REPORT_START.plus(Duration.ofDays(1)));

    private SensorHealthAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        analyzer = new SensorHealthAnalyzer(utcProperties());
    }

    private List<HealthIssue> analyze(List<Reading> readings, AnalysisWindow window) {
        return analyzer.analyze(CHANNEL, readings, window, FIFTEEN_MINUTES, null);
    }

    @Test
    void healthySeriesHasNoIssues() {
        List<Reading> readings = series(REPORT_START, FIFTEEN_MINUTES, 96, i -> alternating(i, 1.1, 0.1));

        assertThat(analyze(readings, DAY)).isEmpty();
    }

    @Test
    void emptyChannelYieldsSingleNoDataIssue() {
        List<HealthIssue> issues = analyze(List.of(), DAY);

        assertThat(issues).hasSize(1);
        assertThat(issues.get(0).getType()).isEqualTo(IssueType.NO_DATA);
        assertThat(issues.get(0).getSeverity()).isEqualTo(Severity.CRITICAL);
    }

    @Test
    void windowShorterThanOneIntervalSkipsCompleteness() {
        AnalysisWindow tenMinutes = AnalysisWindow.of(REPORT_START, REPORT_START.plusSeconds(600));

        assertThat(analyze(List.of(Reading.of(REPORT_START, 3.0)), tenMinutes)).isEmpty();
    }

    @Test
    void readingsWithoutValuesCountAsNoData() {
        List<Reading> readings = List.of(
                Reading.of(REPORT_START, null),
                Reading.of(REPORT_START.plusSeconds(900), Double.NaN));

        List<HealthIssue> issues = analyze(readings, DAY);

        assertThat(issues).extracting(HealthIssue::getType).containsExactly(IssueType.NO_DATA);
        assertThat(issues.get(0).getDescription()).contains("none carry");
    }

    @Test
    void shortGapIsMediumSeverity() {
        List<Reading> readings = series(REPORT_START, FIFTEEN_MINUTES, 96,
                i -> i >= 40 && i <= 43 ? null : alternating(i, 1.1, 0.1));

        List<HealthIssue> issues = analyze(readings, DAY);

        assertThat(issues).hasSize(1);
        HealthIssue gap = issues.get(0);
        assertThat(gap.getType()).isEqualTo(IssueType.GAP);
        assertThat(gap.getSeverity()).isEqualTo(Severity.MEDIUM);
        assertThat(gap.getMetrics()).containsEntry("missingIntervals", 4.0);
        assertThat(gap.getWindowStart()).isEqualTo(REPORT_START.plusSeconds(39 * 900));
    }

    @Test
    void singleMissingSampleIsBelowGapMultiplier() {
        List<Reading> readings = series(REPORT_START, FIFTEEN_MINUTES, 96,
                i -> i == 50 ? null : alternating(i, 1.1, 0.1));

        assertThat(analyze(readings, DAY)).isEmpty();
    }

    @Test
    void dayLongGapIsHighSeverity() {
        AnalysisWindow threeDays = AnalysisWindow.of(REPORT_START, REPORT_START.plus(Duration.ofDays(3)));
        List<Reading> readings = series(REPORT_START, FIFTEEN_MINUTES, 288,
                i -> i > 47 && i < 160 ? null : alternating(i, 1.1, 0.1));

        List<HealthIssue> issues = analyze(readings, threeDays);

        assertThat(issues)
                .anyMatch(i -> i.getType() == IssueType.GAP && i.getSeverity() == Severity.HIGH)
                .anyMatch(i -> i.getType() == IssueType.LOW_COMPLETENESS && i.getSeverity() == Severity.MEDIUM);
    }

    @Test
    void staleMeterEscalatesAfterADay() {
        List<Reading> halfDay = series(REPORT_START, FIFTEEN_MINUTES, 48, i -> alternating(i, 1.1, 0.1));

        HealthIssue stale = analyze(halfDay, DAY).stream()
                .filter(i -> i.getType() == IssueType.STALE)
                .findFirst()
                .orElseThrow();
        assertThat(stale.getSeverity()).isEqualTo(Severity.MEDIUM);
        assertThat(stale.getMetrics().get("hoursSinceLastReading")).isEqualTo(12.25);

        Instant liveNow = DAY.getEnd().plus(Duration.ofDays(1));
        HealthIssue live = analyzer.analyze(CHANNEL, halfDay, DAY, FIFTEEN_MINUTES, liveNow).stream()
                .filter(i -> i.getType() == IssueType.STALE)
                .findFirst()
                .orElseThrow();
        assertThat(live.getSeverity()).isEqualTo(Severity.HIGH);
    }

    @Test
    void constantNonZeroPowerIsFlatline() {
        List<Reading> readings = series(REPORT_START, FIFTEEN_MINUTES, 96, i -> 3.0);

        List<HealthIssue> issues = analyze(readings, DAY);

        assertThat(issues).hasSize(1);
        HealthIssue flatline = issues.get(0);
        assertThat(flatline.getType()).isEqualTo(IssueType.FLATLINE);
        assertThat(flatline.getSeverity()).isEqualTo(Severity.MEDIUM);
        assertThat(flatline.getWindowStart()).isEqualTo(REPORT_START);
        assertThat(flatline.getWindowEnd()).isEqualTo(REPORT_START.plusSeconds(95 * 900));
        assertThat(flatline.getDescription()).startsWith("Flatlined at 3.00 kW");
    }

    @Test
    void constantZeroIsNotFlatline() {
        List<Reading> readings = series(REPORT_START, FIFTEEN_MINUTES, 96, i -> 0.0);

        assertThat(analyze(readings, DAY)).isEmpty();
    }

    @Test
    void separateFlatSpansAreSeparateIssues() {
        List<Reading> readings = series(REPORT_START, FIFTEEN_MINUTES, 96, i -> {
            if (i < 30) {
                return 3.0;
            }
            return i < 60 ? alternating(i, 1.1, 0.1) : 2.0;
        });

        List<HealthIssue> issues = analyze(readings, DAY);

        assertThat(issues).extracting(HealthIssue::getType)
                .containsExactly(IssueType.FLATLINE, IssueType.FLATLINE);
        assertThat(issues.get(0).getMetrics().get("meanPowerKw")).isEqualTo(3.0);
        assertThat(issues.get(1).getMetrics().get("meanPowerKw")).isEqualTo(2.0);
    }

    @Test
    void halfCompleteSeriesIsMediumCompleteness() {
        List<Reading> readings = series(REPORT_START, FIFTEEN_MINUTES, 96,
                i -> i % 2 == 0 ? alternating(i / 2, 1.1, 0.1) : null);

        List<HealthIssue> issues = analyze(readings, DAY);

        assertThat(issues).hasSize(1);
        HealthIssue completeness = issues.get(0);
        assertThat(completeness.getType()).isEqualTo(IssueType.LOW_COMPLETENESS);
        assertThat(completeness.getSeverity()).isEqualTo(Severity.MEDIUM);
        assertThat(completeness.getMetrics())
                .containsEntry("expectedCount", 96.0)
                .containsEntry("actualCount", 48.0)
                .containsEntry("missingCount", 48.0);
    }

    @Test
    void sparseSeriesIsHighCompleteness() {
        List<Reading> readings = series(REPORT_START, FIFTEEN_MINUTES, 96,
                i -> i % 3 == 0 ? alternating(i / 3, 1.1, 0.1) : null);

        assertThat(analyze(readings, DAY))
                .anyMatch(i -> i.getType() == IssueType.LOW_COMPLETENESS && i.getSeverity() == Severity.HIGH);
    }

    @Test
    void sortsBySeverityKeepingInputOrderForTies() {
        HealthIssue gapA = issue("a", IssueType.GAP, Severity.MEDIUM);
        HealthIssue noData = issue("b", IssueType.NO_DATA, Severity.CRITICAL);
        HealthIssue gapC = issue("c", IssueType.GAP, Severity.MEDIUM);
        HealthIssue stale = issue("d", IssueType.STALE, Severity.HIGH);

        assertThat(SensorHealthAnalyzer.sortBySeverity(List.of(gapA, noData, gapC, stale)))
                .containsExactly(noData, stale, gapA, gapC);
    }

    @Test
    void summarizesByType() {
        List<IssueSummary> summary = SensorHealthAnalyzer.summarize(List.of(
                issue("a", IssueType.GAP, Severity.MEDIUM),
                issue("b", IssueType.GAP, Severity.HIGH),
                issue("a", IssueType.GAP, Severity.MEDIUM),
                issue("c", IssueType.STALE, Severity.MEDIUM)));

        assertThat(summary).extracting(IssueSummary::getType).containsExactly(IssueType.GAP, IssueType.STALE);
        assertThat(summary.get(0).getCount()).isEqualTo(3);
        assertThat(summary.get(0).getAffectedChannels()).isEqualTo(2);
        assertThat(summary.get(0).getDescription()).contains("Meter a, Meter b");
    }

    private static HealthIssue issue(String channelId, IssueType type, Severity severity) {
        return HealthIssue.builder()
                .type(type)
                .severity(severity)
                .channelId(channelId)
                .channelName("Meter " + channelId)
                .description(type.getDescription())
                .build();
    }
}
