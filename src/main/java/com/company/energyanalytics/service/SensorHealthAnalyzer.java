package com.company.energyanalytics.service;

import com.company.energyanalytics.config.AnalyticsProperties;
import com.company.energyanalytics.domain.AnalysisWindow;
import com.company.energyanalytics.domain.Channel;
import com.company.energyanalytics.domain.HealthIssue;
import com.company.energyanalytics.domain.IssueSummary;
import com.company.energyanalytics.domain.Reading;
import com.company.energyanalytics.domain.enums.IssueType;
import com.company.energyanalytics.domain.enums.Severity;
import com.company.energyanalytics.util.*;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Detects data-quality problems on a channel: gaps, stale meters, flatlined sensors
 * and low completeness.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SensorHealthAnalyzer {

    private final AnalyticsProperties properties;

    /**
     * @param referenceTime Live "now" for the stale check; null uses the report window end
     */
    public List<HealthIssue> analyze(Channel channel, List<Reading> readings, AnalysisWindow window,
                                     long resolutionSeconds, Instant referenceTime) {
        List<Reading> series = ReadingSeries.normalize(readings).stream()
                .filter(Reading::hasAnyValue)
                .collect(Collectors.toList());

        // No data short-circuits the other checks
        if (series.isEmpty()) {
            log.debug("Channel {} has no readings in {}", channel.getChannelId(), window);
            return List.of(noDataIssue(channel, window, readings == null ? 0 : readings.size()));
        }

        AnalyticsProperties.SensorHealth config = properties.getSensorHealth();
        List<HealthIssue> issues = new ArrayList<>();

        // Check 1: Gaps between consecutive readings
        issues.addAll(detectGaps(channel, series, resolutionSeconds, config));

        // Check 2: Stale meter
        Instant reference = referenceTime != null ? referenceTime : window.getEnd();
        detectStale(channel, series, reference, config).ifPresent(issues::add);

        // Check 3: Flatlined sensor
        issues.addAll(detectFlatlines(channel, series, resolutionSeconds, config));

        // Check 4: Completeness against the expected sample count
        detectLowCompleteness(channel, series, window, resolutionSeconds, config).ifPresent(issues::add);

        if (!issues.isEmpty()) {
            log.debug("Channel {}: {} sensor health issue(s)", channel.getChannelId(), issues.size());
        }
        return issues;
    }

    /**
     * Most severe first; issues of equal severity keep their input order.
     */
    public static List<HealthIssue> sortBySeverity(List<HealthIssue> issues) {
        List<HealthIssue> sorted = new ArrayList<>(issues);
        sorted.sort(Comparator.comparingInt((HealthIssue i) -> i.getSeverity().getLevel()).reversed());
        return sorted;
    }

    /**
     * One summary line per issue type, in order of first appearance.
     */
    public static List<IssueSummary> summarize(List<HealthIssue> issues) {
        Map<IssueType, List<HealthIssue>> byType = StatsUtils.groupBy(issues, HealthIssue::getType);

        List<IssueSummary> summary = new ArrayList<>();
        byType.forEach((type, typed) -> {
            Set<String> channels = new LinkedHashSet<>();
            typed.forEach(i -> channels.add(i.getChannelName() != null ? i.getChannelName() : i.getChannelId()));

            String listed = channels.stream().limit(3).collect(Collectors.joining(", "));
            String more = channels.size() > 3 ? " and " + (channels.size() - 3) + " more" : "";

            summary.add(IssueSummary.builder()
                    .type(type)
                    .count(typed.size())
                    .affectedChannels(channels.size())
                    .description(String.format("%d %s issue(s) affecting %d channel(s): %s%s",
                            typed.size(), type.name().toLowerCase(), channels.size(), listed, more))
                    .build());
        });
        return summary;
    }

    private HealthIssue noDataIssue(Channel channel, AnalysisWindow window, int rawCount) {
        String description = rawCount == 0
                ? "No readings received during the report period"
                : String.format("%d reading(s) received but none carry a power or energy value", rawCount);

        return HealthIssue.builder()
                .type(IssueType.NO_DATA)
                .severity(Severity.CRITICAL)
                .channelId(channel.getChannelId())
                .channelName(channel.getChannelName())
                .description(description)
                .windowStart(window.getStart())
                .windowEnd(window.getEnd())
                .metric("readingCount", (double) rawCount)
                .build();
    }

    private List<HealthIssue> detectGaps(Channel channel, List<Reading> series, long resolutionSeconds,
                                         AnalyticsProperties.SensorHealth config) {
        List<TimeGap> gaps = StatsUtils.findGaps(
                ReadingSeries.timestamps(series), resolutionSeconds, config.getGapToleranceFraction());

        long highSeveritySeconds = Math.round(config.getGapHighSeverityHours() * TimeUtils.SECONDS_PER_HOUR);
        List<HealthIssue> issues = new ArrayList<>();

        for (TimeGap gap : gaps) {
            if (gap.getMissingIntervals() < config.getGapMultiplier()) {
                continue;
            }
            Severity severity = gap.getActualIntervalSeconds() >= highSeveritySeconds
                    ? Severity.HIGH
                    : Severity.MEDIUM;

            issues.add(HealthIssue.builder()
                    .type(IssueType.GAP)
                    .severity(severity)
                    .channelId(channel.getChannelId())
                    .channelName(channel.getChannelName())
                    .description(String.format("Missing %d intervals (%s gap)",
                            gap.getMissingIntervals(), TimeUtils.formatHours(gap.getActualIntervalSeconds())))
                    .windowStart(gap.getStart())
                    .windowEnd(gap.getEnd())
                    .metric("missingIntervals", (double) gap.getMissingIntervals())
                    .metric("gapHours", gap.getActualIntervalSeconds() / (double) TimeUtils.SECONDS_PER_HOUR)
                    .build());
        }
        return issues;
    }

    private Optional<HealthIssue> detectStale(Channel channel, List<Reading> series, Instant reference,
                                              AnalyticsProperties.SensorHealth config) {
        Instant lastReading = series.get(series.size() - 1).getTimestamp();
        double hoursSince = Duration.between(lastReading, reference).getSeconds()
                / (double) TimeUtils.SECONDS_PER_HOUR;

        if (hoursSince <= config.getStaleHours()) {
            return Optional.empty();
        }

        Severity severity = hoursSince > config.getStaleCriticalHours() ? Severity.HIGH : Severity.MEDIUM;

        return Optional.of(HealthIssue.builder()
                .type(IssueType.STALE)
                .severity(severity)
                .channelId(channel.getChannelId())
                .channelName(channel.getChannelName())
                .description(String.format("No data for %.1f hours (last: %s)", hoursSince, lastReading))
                .detectedAt(lastReading)
                .metric("hoursSinceLastReading", hoursSince)
                .build());
    }

    private List<HealthIssue> detectFlatlines(Channel channel, List<Reading> series, long resolutionSeconds,
                                              AnalyticsProperties.SensorHealth config) {
        List<Reading> powered = ReadingSeries.withPower(series);
        int windowSize = (int) Math.ceil(config.getFlatlineHours() * TimeUtils.SECONDS_PER_HOUR / resolutionSeconds);

        if (windowSize < 2 || powered.size() < windowSize) {
            return List.of();
        }

        List<RollingWindowStats> rolling = StatsUtils.rollingStats(ReadingSeries.powerValues(powered), windowSize);
        List<HealthIssue> issues = new ArrayList<>();
        List<RollingWindowStats> span = new ArrayList<>();

        for (RollingWindowStats stats : rolling) {
            boolean flat = stats.getStdDev() < config.getFlatlineStdDevKw() && stats.getMean() != 0;
            if (flat) {
                span.add(stats);
            } else if (!span.isEmpty()) {
                issues.add(flatlineIssue(channel, powered, span, windowSize, config));
                span = new ArrayList<>();
            }
        }
        if (!span.isEmpty()) {
            issues.add(flatlineIssue(channel, powered, span, windowSize, config));
        }
        return issues;
    }

    private HealthIssue flatlineIssue(Channel channel, List<Reading> powered, List<RollingWindowStats> span,
                                      int windowSize, AnalyticsProperties.SensorHealth config) {
        RollingWindowStats first = span.get(0);
        RollingWindowStats last = span.get(span.size() - 1);
        Instant start = powered.get(first.getIndex() - windowSize + 1).getTimestamp();
        Instant end = powered.get(last.getIndex()).getTimestamp();
        double maxStdDev = span.stream().mapToDouble(RollingWindowStats::getStdDev).max().orElse(0.0);

        return HealthIssue.builder()
                .type(IssueType.FLATLINE)
                .severity(Severity.MEDIUM)
                .channelId(channel.getChannelId())
                .channelName(channel.getChannelName())
                .description(String.format("Flatlined at %.2f kW for %s+ hours (possible stuck sensor)",
                        first.getMean(), TimeUtils.formatHours(Duration.between(start, end).getSeconds())))
                .windowStart(start)
                .windowEnd(end)
                .metric("meanPowerKw", first.getMean())
                .metric("maxStdDevKw", maxStdDev)
                .metric("flatlineHoursThreshold", config.getFlatlineHours())
                .build();
    }

    private Optional<HealthIssue> detectLowCompleteness(Channel channel, List<Reading> series, AnalysisWindow window,
                                                        long resolutionSeconds,
                                                        AnalyticsProperties.SensorHealth config) {
        long expected = TimeUtils.expectedSampleCount(window, resolutionSeconds);
        if (expected == 0) {
            // Window shorter than one interval: nothing to measure against
            return Optional.empty();
        }
        long actual = series.stream().filter(r -> window.contains(r.getTimestamp())).count();
        double completeness = StatsUtils.completenessPct(actual, expected);

        if (completeness >= 100 - config.getMissingThresholdPct()) {
            return Optional.empty();
        }

        long missing = Math.max(0, expected - actual);
        Severity severity = completeness < config.getLowCompletenessHighPct() ? Severity.HIGH : Severity.MEDIUM;

        return Optional.of(HealthIssue.builder()
                .type(IssueType.LOW_COMPLETENESS)
                .severity(severity)
                .channelId(channel.getChannelId())
                .channelName(channel.getChannelName())
                .description(String.format("Only %.1f%% data completeness (missing %d intervals)",
                        completeness, missing))
                .windowStart(window.getStart())
                .windowEnd(window.getEnd())
                .metric("completenessPct", completeness)
                .metric("expectedCount", (double) expected)
                .metric("actualCount", (double) actual)
                .metric("missingCount", (double) missing)
                .build());
    }
}
