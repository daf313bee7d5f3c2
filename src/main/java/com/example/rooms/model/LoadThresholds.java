package com.example.rooms.model;

import com.example.rooms.service.exception.AvailabilityConfigurationException;

/**
 * When a room counts as heavily booked for the day.
 */
public record LoadThresholds(int minBookings, int bookedPercent) {

    public static final LoadThresholds DEFAULT = new LoadThresholds(3, 66);

    public LoadThresholds {
        if (minBookings <= 0) {
            throw new AvailabilityConfigurationException("minBookings must be positive, got " + minBookings);
        }
        if (bookedPercent <= 0 || bookedPercent > 100) {
            throw new AvailabilityConfigurationException("bookedPercent must be in 1..100, got " + bookedPercent);
        }
    }

    public boolean isHeavy(DailyLoad load, BusinessWindow window) {
        if (load.bookingCount() >= minBookings) {
            return true;
        }
        return load.bookedMinutes() * 100 >= (long) bookedPercent * window.totalMinutes();
    }
}
