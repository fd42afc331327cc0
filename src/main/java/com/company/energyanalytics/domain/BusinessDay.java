package com.company.energyanalytics.domain;

import lombok.Value;

import java.io.Serializable;

/**
 * Business hours of a single weekday, half-open [startHour, endHour).
 */
@Value(staticConstructor = "of")
public class BusinessDay implements Serializable {
    private static final long serialVersionUID = 1L;

    int startHour;
    int endHour;

    public boolean includesHour(int hour) {
        return startHour <= hour && hour < endHour;
    }
}
