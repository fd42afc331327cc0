package com.company.energyanalytics.service;

import com.company.energyanalytics.config.AnalyticsProperties;
import com.company.energyanalytics.domain.*;
import com.company.energyanalytics.domain.enums.BaselineSource;
import com.company.energyanalytics.util.DescriptiveStats;
import com.company.energyanalytics.util.ReadingSeries;
import com.company.energyanalytics.util.StatsUtils;
import com.company.energyanalytics.util.TimeUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.ZoneId;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Quantifies after-hours consumption above the channel's idle baseline.
 *
 * The baseline is a low percentile of the strictly positive after-hours power, which
 * captures equipment idling normally while ignoring periods where it is switched off.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class AfterHoursWasteAnalyzer {

    private final AnalyticsProperties properties;

    /**
     * @return the waste window, or empty when the excess stays below {@code afterHours.minExcessKwh}
     */
    public Optional<WasteWindow> analyze(Channel channel, List<Reading> reportReadings, List<Reading> baselineReadings,
                                         AnalysisWindow reportWindow, long resolutionSeconds) {
        WasteWindow waste = calculate(channel, reportReadings, baselineReadings, reportWindow, resolutionSeconds);

        if (waste.getExcessKwh() < properties.getAfterHours().getMinExcessKwh()) {
            log.debug("Channel {}: after-hours excess {} kWh below reporting minimum",
                    channel.getChannelId(), String.format("%.2f", waste.getExcessKwh()));
            return Optional.empty();
        }
        return Optional.of(waste);
    }

    /**
     * Compute the waste window regardless of materiality.
     */
    public WasteWindow calculate(Channel channel, List<Reading> reportReadings, List<Reading> baselineReadings,
                                 AnalysisWindow reportWindow, long resolutionSeconds) {
        AnalyticsProperties.AfterHours config = properties.getAfterHours();
        BusinessHoursCalendar calendar = properties.businessHoursCalendar();
        ZoneId zone = properties.zoneId();
        double intervalHours = TimeUtils.intervalHours(resolutionSeconds);

        List<Reading> afterHours = afterHoursReadings(ReadingSeries.normalize(reportReadings), calendar, zone);

        // 1. Idle baseline
        BaselineSource source = config.getBaselineSource();
        List<Reading> baselineSample = afterHours;
        if (source == BaselineSource.BASELINE_WINDOW) {
            List<Reading> historical = afterHoursReadings(ReadingSeries.normalize(baselineReadings), calendar, zone);
            if (historical.isEmpty()) {
                log.debug("Channel {}: no after-hours baseline readings, using report window",
                        channel.getChannelId());
                source = BaselineSource.REPORT_WINDOW;
            } else {
                baselineSample = historical;
            }
        }
        List<Double> baselinePowers = ReadingSeries.powerValues(baselineSample).stream()
                .filter(p -> p > config.getMinPowerThresholdKw())
                .collect(Collectors.toList());
        double baselineKw = StatsUtils.nonZeroPercentile(baselinePowers, config.getBaselinePercentile());

        // 2. Excess above baseline for every after-hours interval
        double totalKwh = 0.0;
        double excessKwh = 0.0;
        List<ExcessInterval> excessIntervals = new ArrayList<>();

        for (Reading reading : afterHours) {
            double power = reading.getPowerKw();
            totalKwh += power * intervalHours;

            double excessKw = Math.max(0.0, power - baselineKw);
            double intervalExcessKwh = excessKw * intervalHours;
            excessKwh += intervalExcessKwh;

            if (excessKw > 0) {
                excessIntervals.add(ExcessInterval.builder()
                        .timestamp(reading.getTimestamp())
                        .powerKw(power)
                        .baselineKw(baselineKw)
                        .excessKw(excessKw)
                        .excessKwh(intervalExcessKwh)
                        .build());
            }
        }

        // 3. Statistics and cost
        DescriptiveStats stats = StatsUtils.calculateStats(ReadingSeries.powerValues(afterHours));
        double excessCost = excessKwh * properties.getCostPerKwh();

        excessIntervals.sort(Comparator.comparingDouble(ExcessInterval::getExcessKw).reversed());
        List<ExcessInterval> topIntervals = excessIntervals.stream()
                .limit(config.getMaxExcessIntervals())
                .collect(Collectors.toList());

        return WasteWindow.builder()
                .channelId(channel.getChannelId())
                .channelName(channel.getChannelName())
                .baselineKw(baselineKw)
                .baselineSource(source)
                .excessKwh(excessKwh)
                .excessCost(excessCost)
                .annualizedCost(excessCost * TimeUtils.annualizationFactor(reportWindow))
                .thisWeekAvgPowerKw(stats.getMean())
                .maxPowerKw(stats.getMax())
                .minPowerKw(stats.getMin())
                .totalAfterHoursKwh(totalKwh)
                .afterHoursIntervals(afterHours.size())
                .percentOfTotal(totalKwh > 0 ? excessKwh / totalKwh * 100 : 0.0)
                .excessIntervals(topIntervals)
                .build();
    }

    /**
     * Highest excess first; ties keep input order.
     */
    public static List<WasteWindow> rank(List<WasteWindow> windows) {
        List<WasteWindow> ranked = new ArrayList<>(windows);
        ranked.sort(Comparator.comparingDouble(WasteWindow::getExcessKwh).reversed());
        return ranked;
    }

    private static List<Reading> afterHoursReadings(List<Reading> readings, BusinessHoursCalendar calendar,
                                                    ZoneId zone) {
        return readings.stream()
                .filter(Reading::hasPower)
                .filter(r -> !TimeUtils.isBusinessHours(r.getTimestamp(), calendar, zone))
                .collect(Collectors.toList());
    }
}
