package com.company.energyanalytics.domain;

import java.io.Serializable;
import java.time.DayOfWeek;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Weekday to business-hours mapping. A weekday without an entry is after-hours
 * for the whole day.
 */
public final class BusinessHoursCalendar implements Serializable {
    private static final long serialVersionUID = 1L;

    private final Map<DayOfWeek, BusinessDay> days;

    private BusinessHoursCalendar(Map<DayOfWeek, BusinessDay> days) {
        this.days = Collections.unmodifiableMap(days);
    }

    public static BusinessHoursCalendar of(Map<DayOfWeek, BusinessDay> days) {
        EnumMap<DayOfWeek, BusinessDay> copy = new EnumMap<>(DayOfWeek.class);
        days.forEach((day, hours) -> {
            if (hours != null) {
                copy.put(day, hours);
            }
        });
        return new BusinessHoursCalendar(copy);
    }

    /**
     * Monday to Friday 07:00-18:00, weekends after-hours.
     */
    public static BusinessHoursCalendar weekdays(int startHour, int endHour) {
        EnumMap<DayOfWeek, BusinessDay> days = new EnumMap<>(DayOfWeek.class);
        for (DayOfWeek day : DayOfWeek.values()) {
            if (day != DayOfWeek.SATURDAY && day != DayOfWeek.SUNDAY) {
                days.put(day, BusinessDay.of(startHour, endHour));
            }
        }
        return new BusinessHoursCalendar(days);
    }

    public Optional<BusinessDay> forDay(DayOfWeek day) {
        return Optional.ofNullable(days.get(day));
    }

    public Map<DayOfWeek, BusinessDay> getDays() {
        return days;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BusinessHoursCalendar)) return false;
        return days.equals(((BusinessHoursCalendar) o).days);
    }

    @Override
    public int hashCode() {
        return days.hashCode();
    }

    @Override
    public String toString() {
        return "BusinessHoursCalendar" + days;
    }
}
