package com.example.rooms.model;

import java.util.Comparator;
import java.util.Objects;

/**
 * A booking as the engine sees it. Only {@link #interval()} takes part in computations.
 */
public record Booking(Long id, Interval interval, String title, String ownerRef) {

    public static final Comparator<Booking> BY_START = Comparator.comparing(Booking::interval, Interval.BY_START);

    public Booking {
        Objects.requireNonNull(interval, "interval must not be null");
    }

    public static Booking of(Long id, Interval interval) {
        return new Booking(id, interval, null, null);
    }

    public TimePoint start() {
        return interval.start();
    }

    public TimePoint end() {
        return interval.end();
    }
}
