package com.company.energyanalytics.util;

import com.company.energyanalytics.domain.Reading;

import java.time.Instant;
import java.time.ZoneId;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Helpers for turning raw reading lists into the canonical shape the analyzers work on.
 */
public class ReadingSeries {

    private ReadingSeries() {
    }

    /**
     * Chronological copy with one reading per timestamp. Readings sharing a timestamp
     * resolve to the last one in input order.
     */
    public static List<Reading> normalize(List<Reading> readings) {
        if (readings == null || readings.isEmpty()) {
            return List.of();
        }

        Map<Instant, Reading> byTimestamp = new TreeMap<>();
        for (Reading reading : readings) {
            if (reading != null && reading.getTimestamp() != null) {
                byTimestamp.put(reading.getTimestamp(), reading);
            }
        }
        return List.copyOf(byTimestamp.values());
    }

    public static List<Reading> withPower(List<Reading> readings) {
        return readings.stream()
                .filter(Reading::hasPower)
                .collect(Collectors.toList());
    }

    public static List<Double> powerValues(List<Reading> readings) {
        return readings.stream()
                .filter(Reading::hasPower)
                .map(Reading::getPowerKw)
                .collect(Collectors.toList());
    }

    public static List<Instant> timestamps(List<Reading> readings) {
        return readings.stream()
                .map(Reading::getTimestamp)
                .collect(Collectors.toList());
    }

    /**
     * Power values bucketed by hour of week. Buckets without samples are absent.
     */
    public static Map<Integer, List<Double>> powerByHourOfWeek(List<Reading> readings, ZoneId zone) {
        Map<Integer, List<Reading>> grouped = StatsUtils.groupBy(
                withPower(readings), r -> TimeUtils.hourOfWeek(r.getTimestamp(), zone));

        Map<Integer, List<Double>> buckets = new TreeMap<>();
        grouped.forEach((hour, bucket) -> buckets.put(hour, powerValues(bucket)));
        return buckets;
    }
}
