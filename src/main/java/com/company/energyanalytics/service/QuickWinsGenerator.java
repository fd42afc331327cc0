package com.company.energyanalytics.service;

import com.company.energyanalytics.config.AnalyticsProperties;
import com.company.energyanalytics.domain.*;
import com.company.energyanalytics.domain.enums.IssueType;
import com.company.energyanalytics.domain.enums.Priority;
import com.company.energyanalytics.domain.enums.QuickWinType;
import com.company.energyanalytics.domain.enums.Severity;
import com.company.energyanalytics.util.StatsUtils;
import com.company.energyanalytics.util.TimeUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Turns analyzer findings into prioritized, actionable recommendations.
 *
 * Channel-level wins are produced at most once per channel and finding type. Impacts are
 * normalized to a week so that reports over other window lengths stay comparable.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class QuickWinsGenerator {

    private final AnalyticsProperties properties;

    public List<QuickWin> generate(List<WasteWindow> wasteWindows, List<HealthIssue> issues,
                                   List<AnomalyEvent> anomalies, List<SpikeEvent> spikes,
                                   AnalysisWindow reportWindow) {
        double weeklyFactor = TimeUtils.weeklyFactor(reportWindow);
        List<QuickWin> wins = new ArrayList<>();

        // Check 1: After-hours waste on the worst meters
        wins.addAll(afterHoursWins(wasteWindows, weeklyFactor));

        // Check 2: Meters whose data cannot be trusted
        wins.addAll(sensorHealthWins(issues));

        // Check 3: Recurring anomalies
        wins.addAll(anomalyWins(anomalies, weeklyFactor));

        // Check 4: Demand spikes
        wins.addAll(spikeWins(spikes, weeklyFactor));

        // Check 5: Stuck sensors anywhere on site
        flatlineWin(issues).ifPresent(wins::add);

        // Check 6: Site-wide after-hours opportunity
        afterHoursSummaryWin(wasteWindows, weeklyFactor).ifPresent(wins::add);

        List<QuickWin> ranked = rank(wins);
        log.debug("Generated {} quick win(s)", ranked.size());
        return ranked;
    }

    /**
     * Priority first, then weekly energy impact; equal wins keep their generation order.
     */
    public static List<QuickWin> rank(List<QuickWin> wins) {
        List<QuickWin> ranked = new ArrayList<>(wins);
        ranked.sort(Comparator
                .comparingInt((QuickWin w) -> w.getPriority().getRank()).reversed()
                .thenComparing(Comparator.comparingDouble((QuickWin w) -> w.getImpact().getWeeklyKwh()).reversed()));
        return ranked;
    }

    private List<QuickWin> afterHoursWins(List<WasteWindow> wasteWindows, double weeklyFactor) {
        AnalyticsProperties.QuickWins config = properties.getQuickWins();

        return AfterHoursWasteAnalyzer.rank(wasteWindows).stream()
                .limit(config.getMaxAfterHoursWins())
                .filter(w -> w.getExcessKwh() * weeklyFactor >= config.getMinWeeklyImpactKwh())
                .map(w -> {
                    double weeklyKwh = w.getExcessKwh() * weeklyFactor;
                    String name = displayName(w.getChannelName(), w.getChannelId());

                    return QuickWin.builder()
                            .type(QuickWinType.AFTER_HOURS_WASTE)
                            .channelId(w.getChannelId())
                            .title("Reduce overnight base load on " + name)
                            .description(String.format("%s is consuming %.1f kW on average during after-hours, "
                                            + "%.0f%% of it above the %.1f kW idle baseline. "
                                            + "This suggests equipment running unnecessarily or at higher than needed levels.",
                                    name, w.getThisWeekAvgPowerKw(), w.getPercentOfTotal(), w.getBaselineKw()))
                            .priority(weeklyKwh > config.getHighPriorityKwh() ? Priority.HIGH : Priority.MEDIUM)
                            .impact(QuickWinImpact.ofWeekly(weeklyKwh, properties.getCostPerKwh(), null))
                            .recommendation("Verify equipment schedules match actual occupancy")
                            .recommendation("Check for HVAC systems running outside business hours")
                            .recommendation("Look for computers and servers left on unnecessarily")
                            .recommendation("Consider adding occupancy sensors or time-based controls")
                            .owner("Facilities Manager")
                            .effort("Low to Medium")
                            .confidence(w.getAfterHoursIntervals() > 100 ? "high" : "medium")
                            .build();
                })
                .collect(Collectors.toList());
    }

    private List<QuickWin> sensorHealthWins(List<HealthIssue> issues) {
        List<HealthIssue> severe = issues.stream()
                .filter(i -> i.getSeverity().isAtLeast(Severity.HIGH))
                .collect(Collectors.toList());

        List<QuickWin> wins = new ArrayList<>();
        StatsUtils.groupBy(severe, HealthIssue::getChannelId).forEach((channelId, channelIssues) -> {
            String name = displayName(channelIssues.get(0).getChannelName(), channelId);
            String types = channelIssues.stream()
                    .map(i -> i.getType().name().toLowerCase())
                    .distinct()
                    .collect(Collectors.joining(", "));

            wins.add(QuickWin.builder()
                    .type(QuickWinType.SENSOR_HEALTH)
                    .channelId(channelId)
                    .title("Fix data communication issues on " + name)
                    .description(String.format("%s has %d high-severity data issue(s) (%s). "
                                    + "This prevents accurate energy monitoring and may be hiding consumption anomalies.",
                            name, channelIssues.size(), types))
                    .priority(Priority.HIGH)
                    .impact(QuickWinImpact.qualitative(
                            "Missing data prevents accurate monitoring and may hide energy waste"))
                    .recommendation("Check network connectivity and power to the meter")
                    .recommendation("Verify meter configuration and data logging settings")
                    .recommendation("Contact the meter vendor if issues persist")
                    .recommendation("Consider replacing meters with repeated failures")
                    .owner("Energy Manager / Facilities")
                    .effort("Medium")
                    .confidence("high")
                    .build());
        });
        return wins;
    }

    private List<QuickWin> anomalyWins(List<AnomalyEvent> anomalies, double weeklyFactor) {
        AnalyticsProperties.QuickWins config = properties.getQuickWins();
        List<QuickWin> wins = new ArrayList<>();

        StatsUtils.groupBy(anomalies, AnomalyEvent::getChannelId).forEach((channelId, events) -> {
            if (events.size() < config.getAnomalyEventThreshold()) {
                return;
            }
            AnomalyEvent worst = events.stream()
                    .max(Comparator.comparingDouble(AnomalyEvent::getExcessKwh))
                    .orElseThrow();
            double weeklyKwh = events.stream().mapToDouble(AnomalyEvent::getExcessKwh).sum() * weeklyFactor;
            String name = displayName(worst.getChannelName(), channelId);

            wins.add(QuickWin.builder()
                    .type(QuickWinType.ANOMALY)
                    .channelId(channelId)
                    .title("Investigate unusual consumption on " + name)
                    .description(String.format("%s showed %d anomalous event(s), consuming %.1f kWh/week above "
                                    + "normal patterns. Peak was %.1f kW during %s.",
                            name, events.size(), weeklyKwh, worst.getPeakPowerKw(),
                            worst.getContext().name().toLowerCase().replace('_', ' ')))
                    .priority(weeklyKwh > config.getAnomalyHighPriorityKwh() ? Priority.HIGH : Priority.MEDIUM)
                    .impact(QuickWinImpact.ofWeekly(weeklyKwh, properties.getCostPerKwh(), null))
                    .recommendation("Review equipment operation logs for the flagged periods")
                    .recommendation("Check if new equipment was added or settings changed")
                    .recommendation("Verify load is appropriate for operational needs")
                    .recommendation("Consider load shifting if during peak demand periods")
                    .owner("Operations / Energy Manager")
                    .effort("Medium")
                    .confidence("medium")
                    .build());
        });
        return wins;
    }

    private List<QuickWin> spikeWins(List<SpikeEvent> spikes, double weeklyFactor) {
        Double demandCharge = properties.getDemandChargePerKw();
        List<QuickWin> wins = new ArrayList<>();

        StatsUtils.groupBy(spikes, SpikeEvent::getChannelId).forEach((channelId, events) -> {
            SpikeEvent worst = events.stream()
                    .max(Comparator.comparingDouble(SpikeEvent::getPeakPowerKw))
                    .orElseThrow();
            double weeklyKwh = events.stream().mapToDouble(SpikeEvent::getTotalExcessKwh).sum() * weeklyFactor;
            String name = displayName(worst.getChannelName(), channelId);

            String note = demandCharge != null
                    ? String.format("Plus potential demand charges: $%.2f/month", worst.getPeakPowerKw() * demandCharge)
                    : "May also impact demand charges if applicable";

            wins.add(QuickWin.builder()
                    .type(QuickWinType.SPIKE)
                    .channelId(channelId)
                    .title("Reduce demand spikes on " + name)
                    .description(String.format("%s experienced %d spike(s) up to %.1f kW. This may indicate "
                                    + "short-cycling, simultaneous equipment starts or undersized equipment.",
                            name, events.size(), worst.getPeakPowerKw()))
                    .priority(Priority.MEDIUM)
                    .impact(QuickWinImpact.ofWeekly(weeklyKwh, properties.getCostPerKwh(), note))
                    .recommendation("Stagger start times for large equipment")
                    .recommendation("Check for short-cycling HVAC or refrigeration")
                    .recommendation("Consider soft-start controllers for motors")
                    .recommendation("Verify equipment is properly sized")
                    .owner("Facilities Manager")
                    .effort("Medium to High")
                    .confidence("medium")
                    .build());
        });
        return wins;
    }

    private Optional<QuickWin> flatlineWin(List<HealthIssue> issues) {
        List<HealthIssue> flatlines = issues.stream()
                .filter(i -> i.getType() == IssueType.FLATLINE)
                .collect(Collectors.toList());
        if (flatlines.isEmpty()) {
            return Optional.empty();
        }
        long sensors = flatlines.stream().map(HealthIssue::getChannelId).distinct().count();

        return Optional.of(QuickWin.builder()
                .type(QuickWinType.SENSOR_HEALTH)
                .title(String.format("Check stuck sensors (%d detected)", sensors))
                .description(String.format("%d sensor(s) appear flatlined (stuck at a constant value). "
                        + "This typically indicates sensor failure or configuration issues.", sensors))
                .priority(Priority.LOW)
                .impact(QuickWinImpact.qualitative("Stuck sensors provide inaccurate data for decision-making"))
                .recommendation("Inspect physical sensors for damage or disconnection")
                .recommendation("Reset or recalibrate affected meters")
                .recommendation("Replace sensors if recalibration fails")
                .owner("Facilities / Maintenance")
                .effort("Low")
                .confidence("high")
                .build());
    }

    private Optional<QuickWin> afterHoursSummaryWin(List<WasteWindow> wasteWindows, double weeklyFactor) {
        double weeklyKwh = wasteWindows.stream().mapToDouble(WasteWindow::getExcessKwh).sum() * weeklyFactor;
        if (wasteWindows.isEmpty() || weeklyKwh < properties.getQuickWins().getMinWeeklyImpactKwh()) {
            return Optional.empty();
        }

        return Optional.of(QuickWin.builder()
                .type(QuickWinType.SUMMARY)
                .title("Overall after-hours optimization opportunity")
                .description(String.format("Site-wide after-hours consumption is %.0f kWh/week above baseline "
                        + "across %d meter(s).", weeklyKwh, wasteWindows.size()))
                .priority(Priority.HIGH)
                .impact(QuickWinImpact.ofWeekly(weeklyKwh, properties.getCostPerKwh(), null))
                .recommendation("Conduct a comprehensive after-hours walk-through")
                .recommendation("Review and update all equipment schedules")
                .recommendation("Implement building automation or occupancy-based controls")
                .recommendation("Set up weekly monitoring to track progress")
                .owner("Energy Manager / Facilities Director")
                .effort("Medium")
                .confidence("high")
                .build());
    }

    private static String displayName(String channelName, String channelId) {
        return channelName != null ? channelName : channelId;
    }
}
