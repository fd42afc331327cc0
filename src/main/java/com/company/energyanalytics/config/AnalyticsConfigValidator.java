package com.company.energyanalytics.config;

import com.company.energyanalytics.domain.AnalysisWindow;
import com.company.energyanalytics.domain.ChannelData;
import com.company.energyanalytics.domain.SiteAnalysisRequest;
import com.company.energyanalytics.exception.InvalidConfigurationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;

/**
 * Fail-fast checks run before any analyzer touches the data, so a misconfigured run
 * never produces partial results.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class AnalyticsConfigValidator {

    private final AnalyticsProperties properties;

    public void validate(SiteAnalysisRequest request) {
        List<String> violations = new ArrayList<>(checkProperties(properties));

        checkWindow("reportWindow", request.getReportWindow(), violations);
        if (request.getBaselineWindow() != null) {
            checkWindow("baselineWindow", request.getBaselineWindow(), violations);
        }

        for (ChannelData channelData : request.getChannels()) {
            if (channelData.getChannel() == null || channelData.getChannel().getChannelId() == null) {
                violations.add("every channel needs a channelId");
                continue;
            }
            if (channelData.getResolutionSeconds() <= 0) {
                violations.add("channel " + channelData.getChannel().getChannelId()
                        + ": resolutionSeconds must be positive");
            } else if (isOrdered(request.getReportWindow())
                    && channelData.getResolutionSeconds() > request.getReportWindow().getSeconds()) {
                violations.add("channel " + channelData.getChannel().getChannelId()
                        + ": resolutionSeconds " + channelData.getResolutionSeconds()
                        + " is longer than the report window");
            }
        }

        if (!violations.isEmpty()) {
            log.warn("Rejecting analysis for organization {}: {}", request.getOrganizationId(), violations);
            throw new InvalidConfigurationException(violations);
        }
    }

    public void validateProperties() {
        List<String> violations = checkProperties(properties);
        if (!violations.isEmpty()) {
            throw new InvalidConfigurationException(violations);
        }
    }

    private static boolean isOrdered(AnalysisWindow window) {
        return window != null && window.getStart() != null && window.getEnd() != null
                && window.getEnd().isAfter(window.getStart());
    }

    static List<String> checkProperties(AnalyticsProperties props) {
        List<String> violations = new ArrayList<>();

        if (props.getTimezone() == null) {
            violations.add("timezone is required");
        } else {
            try {
                ZoneId.of(props.getTimezone());
            } catch (DateTimeException e) {
                violations.add("timezone '" + props.getTimezone() + "' is not a valid zone id");
            }
        }

        if (props.getBusinessHours() != null) {
            props.getBusinessHours().forEach((day, range) -> {
                if (range == null || (range.getStart() == null && range.getEnd() == null)) {
                    return;
                }
                if (range.getStart() == null || range.getEnd() == null) {
                    violations.add("businessHours." + day + " needs both start and end");
                } else if (range.getStart() < 0 || range.getEnd() > 24 || range.getStart() >= range.getEnd()) {
                    violations.add("businessHours." + day + " must satisfy 0 <= start < end <= 24, got "
                            + range.getStart() + "-" + range.getEnd());
                }
            });
        }

        nonNegative("costPerKwh", props.getCostPerKwh(), violations);
        if (props.getDemandChargePerKw() != null) {
            nonNegative("demandChargePerKw", props.getDemandChargePerKw(), violations);
        }
        positive("baseline.weeksCount", props.getBaseline().getWeeksCount(), violations);

        AnalyticsProperties.SensorHealth health = props.getSensorHealth();
        positive("sensorHealth.gapMultiplier", health.getGapMultiplier(), violations);
        nonNegative("sensorHealth.gapToleranceFraction", health.getGapToleranceFraction(), violations);
        positive("sensorHealth.gapHighSeverityHours", health.getGapHighSeverityHours(), violations);
        positive("sensorHealth.staleHours", health.getStaleHours(), violations);
        if (health.getStaleCriticalHours() < health.getStaleHours()) {
            violations.add("sensorHealth.staleCriticalHours must not be below staleHours");
        }
        percentage("sensorHealth.missingThresholdPct", health.getMissingThresholdPct(), violations);
        percentage("sensorHealth.lowCompletenessHighPct", health.getLowCompletenessHighPct(), violations);
        positive("sensorHealth.flatlineHours", health.getFlatlineHours(), violations);
        nonNegative("sensorHealth.flatlineStdDevKw", health.getFlatlineStdDevKw(), violations);

        AnalyticsProperties.AfterHours afterHours = props.getAfterHours();
        percentage("afterHours.baselinePercentile", afterHours.getBaselinePercentile(), violations);
        nonNegative("afterHours.minExcessKwh", afterHours.getMinExcessKwh(), violations);
        nonNegative("afterHours.minPowerThresholdKw", afterHours.getMinPowerThresholdKw(), violations);
        nonNegative("afterHours.maxExcessIntervals", afterHours.getMaxExcessIntervals(), violations);
        if (afterHours.getBaselineSource() == null) {
            violations.add("afterHours.baselineSource is required");
        }

        AnalyticsProperties.Anomaly anomaly = props.getAnomaly();
        positive("anomaly.iqrMultiplier", anomaly.getIqrMultiplier(), violations);
        positive("anomaly.minConsecutiveIntervals", anomaly.getMinConsecutiveIntervals(), violations);
        positive("anomaly.maxGapIntervals", anomaly.getMaxGapIntervals(), violations);
        nonNegative("anomaly.minExcessKwh", anomaly.getMinExcessKwh(), violations);

        AnalyticsProperties.Spike spike = props.getSpike();
        percentage("spike.baselinePercentile", spike.getBaselinePercentile(), violations);
        positive("spike.multiplier", spike.getMultiplier(), violations);
        nonNegative("spike.submeterMinKw", spike.getSubmeterMinKw(), violations);
        nonNegative("spike.siteTotalMinKw", spike.getSiteTotalMinKw(), violations);
        positive("spike.minDurationIntervals", spike.getMinDurationIntervals(), violations);
        positive("spike.maxGapIntervals", spike.getMaxGapIntervals(), violations);

        AnalyticsProperties.QuickWins quickWins = props.getQuickWins();
        nonNegative("quickWins.maxCount", quickWins.getMaxCount(), violations);
        nonNegative("quickWins.minWeeklyImpactKwh", quickWins.getMinWeeklyImpactKwh(), violations);
        nonNegative("quickWins.highPriorityKwh", quickWins.getHighPriorityKwh(), violations);
        nonNegative("quickWins.anomalyHighPriorityKwh", quickWins.getAnomalyHighPriorityKwh(), violations);
        positive("quickWins.anomalyEventThreshold", quickWins.getAnomalyEventThreshold(), violations);
        nonNegative("quickWins.maxAfterHoursWins", quickWins.getMaxAfterHoursWins(), violations);

        return violations;
    }

    private static void checkWindow(String name, AnalysisWindow window, List<String> violations) {
        if (window == null || window.getStart() == null || window.getEnd() == null) {
            violations.add(name + " requires start and end");
        } else if (!window.getEnd().isAfter(window.getStart())) {
            violations.add(name + " end must be after start");
        }
    }

    private static void positive(String name, double value, List<String> violations) {
        if (!(value > 0)) {
            violations.add(name + " must be positive, got " + value);
        }
    }

    private static void nonNegative(String name, double value, List<String> violations) {
        if (!(value >= 0)) {
            violations.add(name + " must not be negative, got " + value);
        }
    }

    private static void percentage(String name, double value, List<String> violations) {
        if (!(value >= 0 && value <= 100)) {
            violations.add(name + " must be within [0, 100], got " + value);
        }
    }
}
