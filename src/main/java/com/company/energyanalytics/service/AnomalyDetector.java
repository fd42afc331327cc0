package com.company.energyanalytics.service;

import com.company.energyanalytics.config.AnalyticsProperties;
import com.company.energyanalytics.domain.AnomalyEvent;
import com.company.energyanalytics.domain.BusinessHoursCalendar;
import com.company.energyanalytics.domain.Channel;
import com.company.energyanalytics.domain.Reading;
import com.company.energyanalytics.util.*;
import lombok.Builder;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.ZoneId;
import java.util.*;

/**
 * Flags report-window intervals that are statistically unusual for their hour of week
 * and groups consecutive ones into events.
 *
 * Each of the 168 hour-of-week buckets gets a threshold of {@code q3 + k * iqr} from the
 * baseline window. Readings that fall into a bucket without baseline samples are not
 * evaluated.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class AnomalyDetector {

    private final AnalyticsProperties properties;

    public List<AnomalyEvent> detect(Channel channel, List<Reading> reportReadings, List<Reading> baselineReadings,
                                     long resolutionSeconds) {
        AnalyticsProperties.Anomaly config = properties.getAnomaly();
        ZoneId zone = properties.zoneId();
        BusinessHoursCalendar calendar = properties.businessHoursCalendar();
        double intervalHours = TimeUtils.intervalHours(resolutionSeconds);

        Map<Integer, BucketProfile> profile = buildProfile(baselineReadings);
        if (profile.isEmpty()) {
            log.debug("Channel {}: empty anomaly baseline, nothing to evaluate", channel.getChannelId());
            return List.of();
        }

        List<FlaggedInterval> flagged = new ArrayList<>();
        int unevaluated = 0;

        for (Reading reading : ReadingSeries.withPower(ReadingSeries.normalize(reportReadings))) {
            BucketProfile bucket = profile.get(TimeUtils.hourOfWeek(reading.getTimestamp(), zone));
            if (bucket == null) {
                unevaluated++;
                continue;
            }

            double power = reading.getPowerKw();
            if (power > bucket.getThreshold()) {
                flagged.add(FlaggedInterval.builder()
                        .timestamp(reading.getTimestamp())
                        .powerKw(power)
                        .referenceKw(bucket.getMedian())
                        .thresholdKw(bucket.getThreshold())
                        .excessKwh(Math.max(0.0, power - bucket.getMedian()) * intervalHours)
                        .zScore(StatsUtils.zScore(power, bucket.getMean(), bucket.getStdDev()))
                        .businessHours(TimeUtils.isBusinessHours(reading.getTimestamp(), calendar, zone))
                        .build());
            }
        }

        if (unevaluated > 0) {
            log.debug("Channel {}: {} reading(s) fell into hour-of-week buckets without baseline",
                    channel.getChannelId(), unevaluated);
        }

        List<List<FlaggedInterval>> runs = FlaggedIntervalGrouper.group(
                flagged, resolutionSeconds * config.getMaxGapIntervals(), config.getMinConsecutiveIntervals());

        List<AnomalyEvent> events = new ArrayList<>();
        for (List<FlaggedInterval> run : runs) {
            double excessKwh = FlaggedIntervalGrouper.totalExcessKwh(run);
            if (excessKwh < config.getMinExcessKwh()) {
                continue;
            }

            events.add(AnomalyEvent.builder()
                    .channelId(channel.getChannelId())
                    .channelName(channel.getChannelName())
                    .start(run.get(0).getTimestamp())
                    .end(run.get(run.size() - 1).getTimestamp())
                    .intervals(run.size())
                    .peakPowerKw(FlaggedIntervalGrouper.peakPower(run))
                    .excessKwh(excessKwh)
                    .maxZScore(run.stream().mapToDouble(FlaggedInterval::getZScore).max().orElse(0.0))
                    .context(FlaggedIntervalGrouper.context(run))
                    .build());
        }

        log.debug("Channel {}: {} flagged interval(s), {} anomaly event(s)",
                channel.getChannelId(), flagged.size(), events.size());
        return events;
    }

    /**
     * Statistical profile per hour-of-week bucket; buckets without baseline samples are absent.
     */
    public Map<Integer, BucketProfile> buildProfile(List<Reading> baselineReadings) {
        double multiplier = properties.getAnomaly().getIqrMultiplier();
        Map<Integer, List<Double>> buckets = ReadingSeries.powerByHourOfWeek(
                ReadingSeries.normalize(baselineReadings), properties.zoneId());

        Map<Integer, BucketProfile> profile = new TreeMap<>();
        buckets.forEach((hourOfWeek, powers) -> {
            DescriptiveStats stats = StatsUtils.calculateStats(powers);
            IqrStats iqr = StatsUtils.iqr(powers);

            profile.put(hourOfWeek, BucketProfile.builder()
                    .count(stats.getCount())
                    .median(stats.getMedian())
                    .mean(stats.getMean())
                    .stdDev(stats.getStdDev())
                    .q1(iqr.getQ1())
                    .q3(iqr.getQ3())
                    .iqr(iqr.getIqr())
                    .threshold(iqr.upperFence(multiplier))
                    .build());
        });
        return profile;
    }

    @Value
    @Builder
    public static class BucketProfile {
        int count;
        double median;
        double mean;
        double stdDev;
        double q1;
        double q3;
        double iqr;
        double threshold;
    }
}
