package com.company.energyanalytics.config;

import com.company.energyanalytics.domain.BusinessDay;
import com.company.energyanalytics.domain.BusinessHoursCalendar;
import com.company.energyanalytics.domain.enums.BaselineSource;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.DayOfWeek;
import java.time.ZoneId;
import java.util.EnumMap;
import java.util.Map;

/**
 * Tunables of the analytics engine. Every threshold the analyzers use lives here.
 */
@Data
@ConfigurationProperties(prefix = "analytics")
public class AnalyticsProperties {

    private String timezone = "America/New_York";

    private Map<DayOfWeek, HoursRange> businessHours = defaultBusinessHours();

    private double costPerKwh = 0.12;

    // $/kW per month, only used to annotate spike recommendations
    private Double demandChargePerKw;

    private Baseline baseline = new Baseline();
    private SensorHealth sensorHealth = new SensorHealth();
    private AfterHours afterHours = new AfterHours();
    private Anomaly anomaly = new Anomaly();
    private Spike spike = new Spike();
    private QuickWins quickWins = new QuickWins();
    private Executor executor = new Executor();

    public ZoneId zoneId() {
        return ZoneId.of(timezone);
    }

    public BusinessHoursCalendar businessHoursCalendar() {
        Map<DayOfWeek, BusinessDay> days = new EnumMap<>(DayOfWeek.class);
        businessHours.forEach((day, range) -> {
            if (range != null && range.getStart() != null && range.getEnd() != null) {
                days.put(day, BusinessDay.of(range.getStart(), range.getEnd()));
            }
        });
        return BusinessHoursCalendar.of(days);
    }

    private static Map<DayOfWeek, HoursRange> defaultBusinessHours() {
        Map<DayOfWeek, HoursRange> hours = new EnumMap<>(DayOfWeek.class);
        for (DayOfWeek day : new DayOfWeek[]{DayOfWeek.MONDAY, DayOfWeek.TUESDAY,
                DayOfWeek.WEDNESDAY, DayOfWeek.THURSDAY, DayOfWeek.FRIDAY}) {
            hours.put(day, new HoursRange(7, 18));
        }
        return hours;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class HoursRange {
        private Integer start;
        private Integer end;
    }

    @Data
    public static class Baseline {
        // Baseline window length as a multiple of the report window
        private int weeksCount = 4;
    }

    @Data
    public static class SensorHealth {
        private int gapMultiplier = 2;
        private double gapToleranceFraction = 0.1;
        private double gapHighSeverityHours = 24;
        private double staleHours = 2;
        private double staleCriticalHours = 24;
        private double missingThresholdPct = 10;
        private double lowCompletenessHighPct = 50;
        private double flatlineHours = 6;
        private double flatlineStdDevKw = 0.01;
    }

    @Data
    public static class AfterHours {
        private double baselinePercentile = 5;
        private double minExcessKwh = 10;
        private double minPowerThresholdKw = 0;
        private BaselineSource baselineSource = BaselineSource.REPORT_WINDOW;
        private int maxExcessIntervals = 10;
    }

    @Data
    public static class Anomaly {
        private double iqrMultiplier = 3;
        private int minConsecutiveIntervals = 3;
        private int maxGapIntervals = 1;
        private double minExcessKwh = 0;
    }

    @Data
    public static class Spike {
        private double baselinePercentile = 95;
        private double multiplier = 1.5;
        private double submeterMinKw = 5;
        private double siteTotalMinKw = 20;
        private int minDurationIntervals = 1;
        private int maxGapIntervals = 1;
    }

    @Data
    public static class QuickWins {
        private int maxCount = 10;
        private double minWeeklyImpactKwh = 10;
        private double highPriorityKwh = 100;
        private double anomalyHighPriorityKwh = 50;
        private int anomalyEventThreshold = 1;
        private int maxAfterHoursWins = 3;
    }

    @Data
    public static class Executor {
        private int corePoolSize = 4;
        private int maxPoolSize = 8;
        private int queueCapacity = 100;
    }
}
