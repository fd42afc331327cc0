package com.company.energyanalytics.util;

import com.company.energyanalytics.domain.AnalysisWindow;
import com.company.energyanalytics.domain.BusinessHoursCalendar;
import com.company.energyanalytics.exception.InvalidWindowException;

import java.time.*;
import java.time.temporal.TemporalAdjusters;

public class TimeUtils {

    public static final long SECONDS_PER_HOUR = 3600;
    public static final long SECONDS_PER_WEEK = 7 * 24 * SECONDS_PER_HOUR;
    public static final double SECONDS_PER_YEAR = 365.25 * 24 * SECONDS_PER_HOUR;
    public static final int WEEKS_PER_YEAR = 52;

    private TimeUtils() {
    }

    /**
     * Check whether a timestamp falls inside the business hours of its weekday.
     *
     * @param timestamp Instant to classify
     * @param calendar  Per-weekday business hours; missing weekday means after-hours all day
     * @param zone      Analysis timezone the calendar is expressed in
     * @return true when {@code start <= hour < end} for that weekday
     */
    public static boolean isBusinessHours(Instant timestamp, BusinessHoursCalendar calendar, ZoneId zone) {
        ZonedDateTime local = timestamp.atZone(zone);
        return calendar.forDay(local.getDayOfWeek())
                .map(day -> day.includesHour(local.getHour()))
                .orElse(false);
    }

    /**
     * Number of samples a complete series at the given resolution holds in [start, end).
     *
     * @throws InvalidWindowException if the window is empty or inverted or the resolution is not positive
     */
    public static long expectedSampleCount(Instant windowStart, Instant windowEnd, long resolutionSeconds) {
        if (windowStart == null || windowEnd == null
                || !windowEnd.isAfter(windowStart) || resolutionSeconds <= 0) {
            throw new InvalidWindowException(windowStart, windowEnd, resolutionSeconds);
        }
        return Duration.between(windowStart, windowEnd).getSeconds() / resolutionSeconds;
    }

    public static long expectedSampleCount(AnalysisWindow window, long resolutionSeconds) {
        return expectedSampleCount(window.getStart(), window.getEnd(), resolutionSeconds);
    }

    /**
     * Hour-of-week bucket in [0, 167]: Monday 00:00 is 0, Sunday 23:00 is 167.
     */
    public static int hourOfWeek(Instant timestamp, ZoneId zone) {
        ZonedDateTime local = timestamp.atZone(zone);
        return (local.getDayOfWeek().getValue() - 1) * 24 + local.getHour();
    }

    public static double intervalHours(long resolutionSeconds) {
        return resolutionSeconds / (double) SECONDS_PER_HOUR;
    }

    /**
     * Last complete Monday-to-Monday week before the reference instant, in the given zone.
     */
    public static AnalysisWindow lastCompleteWeek(ZoneId zone, Instant reference) {
        LocalDate today = reference.atZone(zone).toLocalDate();
        LocalDate thisMonday = today.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
        LocalDate lastMonday = thisMonday.minusWeeks(1);

        return AnalysisWindow.of(
                lastMonday.atStartOfDay(zone).toInstant(),
                thisMonday.atStartOfDay(zone).toInstant());
    }

    /**
     * Baseline window immediately preceding the report window, {@code multiple} times its length.
     */
    public static AnalysisWindow baselineWindow(AnalysisWindow reportWindow, int multiple) {
        Duration length = reportWindow.getDuration().multipliedBy(multiple);
        return AnalysisWindow.of(reportWindow.getStart().minus(length), reportWindow.getStart());
    }

    /**
     * Factor turning a per-window figure into a yearly one. A window of exactly one week
     * keeps the conventional 52.
     */
    public static double annualizationFactor(AnalysisWindow window) {
        long seconds = window.getSeconds();
        if (seconds <= 0) {
            return 0.0;
        }
        if (seconds == SECONDS_PER_WEEK) {
            return WEEKS_PER_YEAR;
        }
        return SECONDS_PER_YEAR / seconds;
    }

    /**
     * Factor turning a per-window figure into a per-week one.
     */
    public static double weeklyFactor(AnalysisWindow window) {
        long seconds = window.getSeconds();
        if (seconds <= 0) {
            return 0.0;
        }
        return SECONDS_PER_WEEK / (double) seconds;
    }

    public static String formatHours(long seconds) {
        return String.format("%.1fh", seconds / (double) SECONDS_PER_HOUR);
    }
}
