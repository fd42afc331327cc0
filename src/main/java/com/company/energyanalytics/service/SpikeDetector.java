package com.company.energyanalytics.service;

import com.company.energyanalytics.config.AnalyticsProperties;
import com.company.energyanalytics.domain.BusinessHoursCalendar;
import com.company.energyanalytics.domain.Channel;
import com.company.energyanalytics.domain.Reading;
import com.company.energyanalytics.domain.SpikeEvent;
import com.company.energyanalytics.util.*;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.ZoneId;
import java.util.*;

/**
 * Detects demand spikes: readings well above the channel's usual peak for that hour of
 * week and above an absolute floor that filters out noise on small loads.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SpikeDetector {

    private final AnalyticsProperties properties;

    public List<SpikeEvent> detect(Channel channel, List<Reading> reportReadings, List<Reading> baselineReadings,
                                   long resolutionSeconds) {
        AnalyticsProperties.Spike config = properties.getSpike();
        ZoneId zone = properties.zoneId();
        BusinessHoursCalendar calendar = properties.businessHoursCalendar();
        double intervalHours = TimeUtils.intervalHours(resolutionSeconds);
        double floorKw = absoluteMinimumKw(channel);

        Map<Integer, Double> peaks = peakProfile(baselineReadings);
        if (peaks.isEmpty()) {
            log.debug("Channel {}: empty spike baseline, nothing to evaluate", channel.getChannelId());
            return List.of();
        }

        List<FlaggedInterval> flagged = new ArrayList<>();
        for (Reading reading : ReadingSeries.withPower(ReadingSeries.normalize(reportReadings))) {
            Double peak = peaks.get(TimeUtils.hourOfWeek(reading.getTimestamp(), zone));
            if (peak == null) {
                continue;
            }

            double threshold = Math.max(peak * config.getMultiplier(), floorKw);
            double power = reading.getPowerKw();
            if (power > threshold) {
                flagged.add(FlaggedInterval.builder()
                        .timestamp(reading.getTimestamp())
                        .powerKw(power)
                        .referenceKw(peak)
                        .thresholdKw(threshold)
                        .excessKwh(Math.max(0.0, power - peak) * intervalHours)
                        .businessHours(TimeUtils.isBusinessHours(reading.getTimestamp(), calendar, zone))
                        .build());
            }
        }

        List<List<FlaggedInterval>> runs = FlaggedIntervalGrouper.group(
                flagged, resolutionSeconds * config.getMaxGapIntervals(), config.getMinDurationIntervals());

        List<SpikeEvent> spikes = new ArrayList<>();
        for (List<FlaggedInterval> run : runs) {
            FlaggedInterval first = run.get(0);
            FlaggedInterval last = run.get(run.size() - 1);

            spikes.add(SpikeEvent.builder()
                    .channelId(channel.getChannelId())
                    .channelName(channel.getChannelName())
                    .start(first.getTimestamp())
                    .end(last.getTimestamp())
                    .duration(Duration.between(first.getTimestamp(), last.getTimestamp()))
                    .intervals(run.size())
                    .peakPowerKw(FlaggedIntervalGrouper.peakPower(run))
                    .thresholdKw(run.stream().mapToDouble(FlaggedInterval::getThresholdKw).max().orElse(floorKw))
                    .totalExcessKwh(FlaggedIntervalGrouper.totalExcessKwh(run))
                    .context(FlaggedIntervalGrouper.context(run))
                    .build());
        }

        log.debug("Channel {}: {} spike(s) above floor {} kW", channel.getChannelId(), spikes.size(), floorKw);
        return spikes;
    }

    /**
     * Configured percentile of baseline power per hour-of-week bucket.
     */
    public Map<Integer, Double> peakProfile(List<Reading> baselineReadings) {
        double percentile = properties.getSpike().getBaselinePercentile();
        Map<Integer, List<Double>> buckets = ReadingSeries.powerByHourOfWeek(
                ReadingSeries.normalize(baselineReadings), properties.zoneId());

        Map<Integer, Double> peaks = new TreeMap<>();
        buckets.forEach((hourOfWeek, powers) -> peaks.put(hourOfWeek, StatsUtils.percentile(powers, percentile)));
        return peaks;
    }

    private double absoluteMinimumKw(Channel channel) {
        return channel.isSiteTotal()
                ? properties.getSpike().getSiteTotalMinKw()
                : properties.getSpike().getSubmeterMinKw();
    }

    /**
     * Largest peak first, across channels.
     */
    public static List<SpikeEvent> rankByPeak(List<SpikeEvent> spikes) {
        List<SpikeEvent> ranked = new ArrayList<>(spikes);
        ranked.sort(Comparator.comparingDouble(SpikeEvent::getPeakPowerKw).reversed());
        return ranked;
    }
}
