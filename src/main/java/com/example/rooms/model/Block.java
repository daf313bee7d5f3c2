package com.example.rooms.model;

import java.util.List;

/**
 * Maximal run of touching bookings, treated as one continuous busy span.
 */
public record Block(TimePoint start, TimePoint end, List<Booking> bookings) {

    public Block {
        bookings = List.copyOf(bookings);
    }

    public Interval toInterval() {
        return Interval.of(start, end);
    }
}
