package com.company.energyanalytics.service;

import com.company.energyanalytics.config.AnalyticsProperties;
import com.company.energyanalytics.domain.AnomalyEvent;
import com.company.energyanalytics.domain.Channel;
import com.company.energyanalytics.domain.Reading;
import com.company.energyanalytics.domain.enums.EventContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.company.energyanalytics.ReadingFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class AnomalyDetectorTest {

    private static final Channel CHANNEL = submeter("m1");
    private static final Instant TUESDAY = REPORT_START.plus(Duration.ofDays(1));

    private AnalyticsProperties properties;
    private AnomalyDetector detector;

    @BeforeEach
    void setUp() {
        properties = utcProperties();
        detector = new AnomalyDetector(properties);
    }

    /**
     * Four earlier Tuesdays, 00:00 to 06:00, alternating 1.2 / 1.0 kW.
     */
    private static List<Reading> baseline() {
        List<Reading> readings = new ArrayList<>();
        for (int week = 1; week <= 4; week++) {
            readings.addAll(series(TUESDAY.minus(Duration.ofDays(7L * week)), FIFTEEN_MINUTES, 24,
                    i -> alternating(i, 1.1, 0.1)));
        }
        return readings;
    }

    private static List<Reading> reportWithFlags(Set<Integer> flaggedIndexes) {
        return series(TUESDAY, FIFTEEN_MINUTES, 24, i -> flaggedIndexes.contains(i) ? 5.0 : alternating(i, 1.1, 0.1));
    }

    @Test
    void profileThresholdIsUpperIqrFence() {
        Map<Integer, AnomalyDetector.BucketProfile> profile = detector.buildProfile(baseline());

        assertThat(profile).hasSize(6);
        AnomalyDetector.BucketProfile firstHour = profile.get(24);
        assertThat(firstHour.getCount()).isEqualTo(16);
        assertThat(firstHour.getQ1()).isCloseTo(1.0, within(1e-9));
        assertThat(firstHour.getQ3()).isCloseTo(1.2, within(1e-9));
        assertThat(firstHour.getMedian()).isCloseTo(1.1, within(1e-9));
        assertThat(firstHour.getThreshold()).isCloseTo(1.8, within(1e-9));
    }

    @Test
    void isolatedFlagsBelowMinimumRunProduceNoEvent() {
        List<AnomalyEvent> events = detector.detect(CHANNEL, reportWithFlags(Set.of(4, 8)), baseline(),
                FIFTEEN_MINUTES);

        assertThat(events).isEmpty();
    }

    @Test
    void threeConsecutiveFlagsProduceOneEvent() {
        List<AnomalyEvent> events = detector.detect(CHANNEL, reportWithFlags(Set.of(4, 5, 6)), baseline(),
                FIFTEEN_MINUTES);

        assertThat(events).hasSize(1);
        AnomalyEvent event = events.get(0);
        assertThat(event.getStart()).isEqualTo(TUESDAY.plusSeconds(4 * 900));
        assertThat(event.getEnd()).isEqualTo(TUESDAY.plusSeconds(6 * 900));
        assertThat(event.getIntervals()).isEqualTo(3);
        assertThat(event.getPeakPowerKw()).isEqualTo(5.0);
        assertThat(event.getExcessKwh()).isCloseTo(3 * (5.0 - 1.1) * 0.25, within(1e-9));
        assertThat(event.getMaxZScore()).isCloseTo(39.0, within(1e-6));
        assertThat(event.getContext()).isEqualTo(EventContext.AFTER_HOURS);
    }

    @Test
    void eventsAreChronological() {
        List<AnomalyEvent> events = detector.detect(CHANNEL, reportWithFlags(Set.of(16, 17, 18, 4, 5, 6)),
                baseline(), FIFTEEN_MINUTES);

        assertThat(events).extracting(AnomalyEvent::getStart)
                .containsExactly(TUESDAY.plusSeconds(4 * 900), TUESDAY.plusSeconds(16 * 900));
    }

    @Test
    void allowedGapJoinsRuns() {
        Set<Integer> flags = Set.of(4, 5, 6, 8, 9, 10);

        assertThat(detector.detect(CHANNEL, reportWithFlags(flags), baseline(), FIFTEEN_MINUTES)).hasSize(2);

        properties.getAnomaly().setMaxGapIntervals(2);
        List<AnomalyEvent> joined = detector.detect(CHANNEL, reportWithFlags(flags), baseline(), FIFTEEN_MINUTES);
        assertThat(joined).hasSize(1);
        assertThat(joined.get(0).getIntervals()).isEqualTo(6);
    }

    @Test
    void readingsWithoutBaselineBucketAreNotEvaluated() {
        List<Reading> wednesday = series(TUESDAY.plus(Duration.ofDays(1)), FIFTEEN_MINUTES, 24, i -> 50.0);

        assertThat(detector.detect(CHANNEL, wednesday, baseline(), FIFTEEN_MINUTES)).isEmpty();
        assertThat(detector.detect(CHANNEL, reportWithFlags(Set.of(4, 5, 6)), List.of(), FIFTEEN_MINUTES))
                .isEmpty();
    }

    @Test
    void minimumExcessFiltersSmallEvents() {
        properties.getAnomaly().setMinExcessKwh(5.0);

        assertThat(detector.detect(CHANNEL, reportWithFlags(Set.of(4, 5, 6)), baseline(), FIFTEEN_MINUTES))
                .isEmpty();
    }
}
