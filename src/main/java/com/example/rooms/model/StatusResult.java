package com.example.rooms.model;

import com.example.rooms.service.util.NaiveTime;

/**
 * Display status of a room at one instant. Fields that do not apply to {@link #kind()} are null.
 *
 * @param until            block end when occupied, next booking start when available until
 * @param progressFraction 0..1 share of the current booking's block already elapsed
 * @param remainingSeconds seconds until the occupied block ends
 * @param minutesUntilNext whole minutes until the next booking starts
 */
public record StatusResult(StatusKind kind,
                           SpecialState specialState,
                           String label,
                           TimePoint until,
                           Double progressFraction,
                           Long remainingSeconds,
                           Long minutesUntilNext) {

    public static StatusResult unavailable(SpecialState state) {
        return new StatusResult(StatusKind.UNAVAILABLE, state, state.label(), null, null, null, null);
    }

    public static StatusResult fullyBooked() {
        return new StatusResult(StatusKind.FULLY_BOOKED, null, "Fully booked today", null, 0.0, null, null);
    }

    public static StatusResult occupiedUntil(TimePoint blockEnd, double progressFraction, long remainingSeconds) {
        return new StatusResult(StatusKind.OCCUPIED, null, "Occupied until " + NaiveTime.formatClock(blockEnd),
                blockEnd, progressFraction, remainingSeconds, null);
    }

    public static StatusResult availableUntil(TimePoint nextStart, long minutesUntilNext) {
        return new StatusResult(StatusKind.AVAILABLE_UNTIL, null, "Available until " + NaiveTime.formatClock(nextStart),
                nextStart, null, null, minutesUntilNext);
    }

    public static StatusResult available() {
        return new StatusResult(StatusKind.AVAILABLE, null, "Available all day", null, null, null, null);
    }
}
