package com.example.rooms.service.util;

import com.example.rooms.model.Booking;
import com.example.rooms.model.Interval;

import java.util.Collection;
import java.util.Optional;

/**
 * Overlap test of a proposed interval against one room-day of existing intervals.
 * Intervals are half-open: touching at a boundary is not a conflict.
 */
public final class ConflictChecker {

    private ConflictChecker() {
    }

    /**
     * @return the earliest-starting existing interval that overlaps {@code proposed}, or empty
     */
    public static Optional<Interval> hasConflict(Interval proposed, Collection<Interval> existing) {
        if (existing == null || existing.isEmpty()) {
            return Optional.empty();
        }
        Interval earliest = null;
        for (Interval candidate : existing) {
            if (proposed.overlaps(candidate)
                    && (earliest == null || Interval.BY_START.compare(candidate, earliest) < 0)) {
                earliest = candidate;
            }
        }
        return Optional.ofNullable(earliest);
    }

    /** Same rule as {@link #hasConflict}, keeping the booking so callers can tell who holds the slot. */
    public static Optional<Booking> findConflictingBooking(Interval proposed, Collection<Booking> existing) {
        if (existing == null || existing.isEmpty()) {
            return Optional.empty();
        }
        Booking earliest = null;
        for (Booking candidate : existing) {
            if (proposed.overlaps(candidate.interval())
                    && (earliest == null || Booking.BY_START.compare(candidate, earliest) < 0)) {
                earliest = candidate;
            }
        }
        return Optional.ofNullable(earliest);
    }
}
