package com.company.energyanalytics.util;

import com.company.energyanalytics.domain.enums.EventContext;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Groups flagged readings into runs that are consecutive in time.
 */
public class FlaggedIntervalGrouper {

    private FlaggedIntervalGrouper() {
    }

    /**
     * @param flagged       Flagged readings in chronological order
     * @param maxGapSeconds Largest step between two readings of the same run
     * @param minRunLength  Runs shorter than this are dropped
     */
    public static List<List<FlaggedInterval>> group(List<FlaggedInterval> flagged,
                                                    long maxGapSeconds, int minRunLength) {
        List<List<FlaggedInterval>> runs = new ArrayList<>();
        List<FlaggedInterval> current = new ArrayList<>();

        for (FlaggedInterval interval : flagged) {
            if (!current.isEmpty()) {
                FlaggedInterval last = current.get(current.size() - 1);
                long gap = Duration.between(last.getTimestamp(), interval.getTimestamp()).getSeconds();
                if (gap > maxGapSeconds) {
                    closeRun(runs, current, minRunLength);
                    current = new ArrayList<>();
                }
            }
            current.add(interval);
        }
        closeRun(runs, current, minRunLength);

        return runs;
    }

    private static void closeRun(List<List<FlaggedInterval>> runs, List<FlaggedInterval> run, int minRunLength) {
        if (!run.isEmpty() && run.size() >= minRunLength) {
            runs.add(List.copyOf(run));
        }
    }

    /**
     * Majority vote over the run; an exact tie counts as business hours.
     */
    public static EventContext context(List<FlaggedInterval> run) {
        long business = run.stream().filter(FlaggedInterval::isBusinessHours).count();
        long afterHours = run.size() - business;
        return business >= afterHours ? EventContext.BUSINESS_HOURS : EventContext.AFTER_HOURS;
    }

    public static double peakPower(List<FlaggedInterval> run) {
        return run.stream().mapToDouble(FlaggedInterval::getPowerKw).max().orElse(0.0);
    }

    public static double totalExcessKwh(List<FlaggedInterval> run) {
        return run.stream().mapToDouble(FlaggedInterval::getExcessKwh).sum();
    }
}
