package com.company.energyanalytics.util;

import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.function.Function;

/**
 * Statistics over double sequences. Empty input resolves to 0 instead of failing so
 * that one sparse channel never aborts a whole report.
 */
public class StatsUtils {

    public static final double DEFAULT_GAP_TOLERANCE = 0.1;
    public static final double DEFAULT_OUTLIER_MULTIPLIER = 1.5;

    private StatsUtils() {
    }

    public static double mean(List<Double> values) {
        if (values == null || values.isEmpty()) return 0.0;

        double sum = 0.0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.size();
    }

    public static double median(List<Double> values) {
        return percentile(values, 50);
    }

    /**
     * Population standard deviation.
     */
    public static double stdDev(List<Double> values) {
        if (values == null || values.isEmpty()) return 0.0;

        double mean = mean(values);
        double squares = 0.0;
        for (double v : values) {
            squares += (v - mean) * (v - mean);
        }
        return Math.sqrt(squares / values.size());
    }

    /**
     * Percentile with linear interpolation between the two bracketing order statistics,
     * {@code index = p/100 * (n-1)}.
     *
     * @param values Unsorted values, left untouched
     * @param p      Percentile in [0, 100]
     */
    public static double percentile(List<Double> values, double p) {
        if (values == null || values.isEmpty()) return 0.0;

        double[] sorted = values.stream().mapToDouble(Double::doubleValue).sorted().toArray();
        return percentileOfSorted(sorted, p);
    }

    private static double percentileOfSorted(double[] sorted, double p) {
        if (sorted.length == 1) return sorted[0];

        double clamped = Math.max(0.0, Math.min(100.0, p));
        double index = clamped / 100.0 * (sorted.length - 1);
        int lower = (int) Math.floor(index);
        int upper = (int) Math.ceil(index);
        if (lower == upper) {
            return sorted[lower];
        }
        double fraction = index - lower;
        return sorted[lower] + (sorted[upper] - sorted[lower]) * fraction;
    }

    public static IqrStats iqr(List<Double> values) {
        if (values == null || values.isEmpty()) {
            return new IqrStats(0.0, 0.0, 0.0);
        }
        double q1 = percentile(values, 25);
        double q3 = percentile(values, 75);
        return new IqrStats(q1, q3, q3 - q1);
    }

    public static double zScore(double value, double mean, double stdDev) {
        if (stdDev == 0) return 0.0;
        return (value - mean) / stdDev;
    }

    /**
     * Percentile over the strictly positive values only, so equipment-off samples do
     * not drag an idle baseline down to zero.
     */
    public static double nonZeroPercentile(List<Double> values, double p) {
        if (values == null) return 0.0;

        List<Double> positive = new ArrayList<>();
        for (double v : values) {
            if (v > 0) {
                positive.add(v);
            }
        }
        return percentile(positive, p);
    }

    public static DescriptiveStats calculateStats(List<Double> values) {
        if (values == null || values.isEmpty()) {
            return DescriptiveStats.empty();
        }

        double sum = 0.0;
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double v : values) {
            sum += v;
            min = Math.min(min, v);
            max = Math.max(max, v);
        }

        return DescriptiveStats.builder()
                .count(values.size())
                .sum(sum)
                .mean(sum / values.size())
                .min(min)
                .max(max)
                .median(median(values))
                .stdDev(stdDev(values))
                .build();
    }

    /**
     * Sliding-window statistics, producing {@code n - windowSize + 1} entries in input order.
     */
    public static List<RollingWindowStats> rollingStats(List<Double> values, int windowSize) {
        if (values == null || windowSize <= 0 || values.size() < windowSize) {
            return List.of();
        }

        List<RollingWindowStats> results = new ArrayList<>(values.size() - windowSize + 1);
        for (int i = windowSize - 1; i < values.size(); i++) {
            List<Double> window = values.subList(i - windowSize + 1, i + 1);
            double min = Double.POSITIVE_INFINITY;
            double max = Double.NEGATIVE_INFINITY;
            for (double v : window) {
                min = Math.min(min, v);
                max = Math.max(max, v);
            }
            results.add(new RollingWindowStats(i, mean(window), stdDev(window), min, max));
        }
        return results;
    }

    public static List<TimeGap> findGaps(List<Instant> timestamps, long expectedIntervalSeconds) {
        return findGaps(timestamps, expectedIntervalSeconds, DEFAULT_GAP_TOLERANCE);
    }

    /**
     * Walk consecutive timestamp pairs and report every step longer than the expected
     * interval plus the tolerance fraction.
     *
     * @param timestamps              Timestamps in chronological order
     * @param expectedIntervalSeconds Nominal sampling interval
     * @param toleranceFraction       Allowed jitter, 0.1 means 10%
     */
    public static List<TimeGap> findGaps(List<Instant> timestamps, long expectedIntervalSeconds,
                                         double toleranceFraction) {
        if (timestamps == null || timestamps.size() < 2 || expectedIntervalSeconds <= 0) {
            return List.of();
        }

        double limit = expectedIntervalSeconds * (1 + toleranceFraction);
        List<TimeGap> gaps = new ArrayList<>();

        for (int i = 1; i < timestamps.size(); i++) {
            Instant prev = timestamps.get(i - 1);
            Instant curr = timestamps.get(i);
            long actual = Duration.between(prev, curr).getSeconds();

            if (actual > limit) {
                long expectedIntervals = Math.round(actual / (double) expectedIntervalSeconds);
                gaps.add(new TimeGap(prev, curr, actual, expectedIntervals, expectedIntervals - 1));
            }
        }
        return gaps;
    }

    /**
     * General-purpose IQR outlier fence with the conventional 1.5 multiplier.
     */
    public static List<OutlierFlag> detectOutliers(List<Double> values) {
        return detectOutliers(values, DEFAULT_OUTLIER_MULTIPLIER);
    }

    /**
     * Flag values outside the {@code [q1 - k*iqr, q3 + k*iqr]} fence.
     */
    public static List<OutlierFlag> detectOutliers(List<Double> values, double iqrMultiplier) {
        if (values == null || values.isEmpty()) {
            return List.of();
        }

        IqrStats stats = iqr(values);
        double lower = stats.lowerFence(iqrMultiplier);
        double upper = stats.upperFence(iqrMultiplier);

        List<OutlierFlag> flags = new ArrayList<>(values.size());
        for (int i = 0; i < values.size(); i++) {
            double v = values.get(i);
            flags.add(new OutlierFlag(i, v, v < lower || v > upper, lower, upper));
        }
        return flags;
    }

    public static double completenessPct(long actualCount, long expectedCount) {
        if (expectedCount <= 0) return 0.0;
        return actualCount * 100.0 / expectedCount;
    }

    /**
     * Group items by a derived key, keeping first-seen key order and input order within a group.
     */
    public static <T, K> Map<K, List<T>> groupBy(Collection<T> items, Function<T, K> keyFn) {
        Map<K, List<T>> grouped = new LinkedHashMap<>();
        for (T item : items) {
            grouped.computeIfAbsent(keyFn.apply(item), k -> new ArrayList<>()).add(item);
        }
        return grouped;
    }
}
