package com.example.rooms.model;

import com.example.rooms.service.exception.AvailabilityConfigurationException;

import java.time.LocalDate;
import java.time.LocalTime;

/**
 * Daily opening bounds plus the grid that slot suggestions snap to.
 * Bounds are minutes of the day; {@code closeMinute == 1440} means midnight at the end of the day.
 */
public record BusinessWindow(int openMinute, int closeMinute, int granularityMinutes, int defaultDurationMinutes) {

    public static final int MINUTES_PER_DAY = 24 * 60;

    public BusinessWindow {
        if (openMinute < 0 || closeMinute > MINUTES_PER_DAY || openMinute >= closeMinute) {
            throw new AvailabilityConfigurationException(
                    "Business window must satisfy 0 <= open < close <= 1440, got " + openMinute + ".." + closeMinute);
        }
        if (granularityMinutes <= 0) {
            throw new AvailabilityConfigurationException("Granularity must be positive, got " + granularityMinutes);
        }
        if (defaultDurationMinutes <= 0) {
            throw new AvailabilityConfigurationException("Default duration must be positive, got " + defaultDurationMinutes);
        }
    }

    public static BusinessWindow of(LocalTime open, LocalTime close, int granularityMinutes, int defaultDurationMinutes) {
        int closeMinute = close.equals(LocalTime.MIDNIGHT) ? MINUTES_PER_DAY : close.toSecondOfDay() / 60;
        return new BusinessWindow(open.toSecondOfDay() / 60, closeMinute, granularityMinutes, defaultDurationMinutes);
    }

    /** 00:00 to 24:00, used when business-hour restrictions are switched off. */
    public static BusinessWindow allDay(int granularityMinutes, int defaultDurationMinutes) {
        return new BusinessWindow(0, MINUTES_PER_DAY, granularityMinutes, defaultDurationMinutes);
    }

    public static BusinessWindow standard() {
        return of(LocalTime.of(8, 0), LocalTime.of(20, 0), 15, 30);
    }

    public TimePoint openOn(LocalDate day) {
        return TimePoint.of(day.atStartOfDay().plusMinutes(openMinute));
    }

    public TimePoint closeOn(LocalDate day) {
        return TimePoint.of(day.atStartOfDay().plusMinutes(closeMinute));
    }

    public int totalMinutes() {
        return closeMinute - openMinute;
    }
}
