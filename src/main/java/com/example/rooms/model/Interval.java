package com.example.rooms.model;

import com.example.rooms.service.exception.InvalidIntervalException;

import java.time.Duration;
import java.util.Comparator;

/**
 * Half-open span {@code [start, end)}. Always non-empty.
 */
public record Interval(TimePoint start, TimePoint end) {

    public static final Comparator<Interval> BY_START = Comparator
            .comparing(Interval::start)
            .thenComparing(Interval::end);

    public Interval {
        if (start == null || end == null) {
            throw new InvalidIntervalException("Interval bounds must not be null");
        }
        if (!start.isBefore(end)) {
            throw new InvalidIntervalException("Interval start " + start + " must be before end " + end);
        }
    }

    public static Interval of(TimePoint start, TimePoint end) {
        return new Interval(start, end);
    }

    public static Interval parse(String start, String end) {
        return new Interval(TimePoint.parse(start), TimePoint.parse(end));
    }

    /** Start inclusive, end exclusive. */
    public boolean contains(TimePoint t) {
        return !t.isBefore(start) && t.isBefore(end);
    }

    /** Touching at a boundary is not an overlap. */
    public boolean overlaps(Interval other) {
        return start.isBefore(other.end) && end.isAfter(other.start);
    }

    public long durationSeconds() {
        return Duration.between(start.value(), end.value()).getSeconds();
    }

    @Override
    public String toString() {
        return start + " - " + end;
    }
}
