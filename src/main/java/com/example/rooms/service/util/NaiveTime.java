package com.example.rooms.service.util;

import com.example.rooms.model.TimePoint;
import com.example.rooms.service.exception.AvailabilityConfigurationException;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;

/**
 * Arithmetic over naive time points. Everything is computed on the stored fields;
 * no zone rules are consulted, so 23 or 25 hour days do not exist here.
 */
public final class NaiveTime {

    private static final DateTimeFormatter CLOCK = DateTimeFormatter.ofPattern("HH:mm");

    private NaiveTime() {
    }

    public static int compare(TimePoint a, TimePoint b) {
        return a.compareTo(b);
    }

    public static TimePoint addMinutes(TimePoint t, long minutes) {
        return TimePoint.of(t.value().plusMinutes(minutes));
    }

    /** Positive when {@code b} is after {@code a}. */
    public static long diffSeconds(TimePoint a, TimePoint b) {
        return ChronoUnit.SECONDS.between(a.value(), b.value());
    }

    public static TimePoint max(TimePoint a, TimePoint b) {
        return a.compareTo(b) >= 0 ? a : b;
    }

    /**
     * Rounds up to the next multiple of {@code granularityMinutes} counted in minutes from midnight
     * (minute of day), not from the top of the hour. For granularities dividing 60 the two agree:
     * 09:07 becomes 09:15 on a 15 minute grid. For others the grid is anchored at midnight:
     * 09:50 becomes 10:30 on a 45 minute grid (10:30 is minute 630 = 14 * 45).
     * Seconds are dropped first, so 09:15:40 stays at 09:15 for a 15 minute grid.
     * Carries into the next hour and, past 23:45, into the next day.
     */
    public static TimePoint ceilToGranularity(TimePoint t, int granularityMinutes) {
        if (granularityMinutes <= 0) {
            throw new AvailabilityConfigurationException("Granularity must be positive, got " + granularityMinutes);
        }
        LocalDateTime minuteFloor = t.value().truncatedTo(ChronoUnit.MINUTES);
        int minuteOfDay = minuteFloor.getHour() * 60 + minuteFloor.getMinute();
        int remainder = minuteOfDay % granularityMinutes;
        int minutesToAdd = remainder == 0 ? 0 : granularityMinutes - remainder;
        return TimePoint.of(minuteFloor.plusMinutes(minutesToAdd));
    }

    public static String formatClock(TimePoint t) {
        return CLOCK.format(t.value());
    }
}
