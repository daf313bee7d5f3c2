package com.example.rooms.model;

import java.util.List;

/**
 * Booking count and booked time of one room-day. Minutes are floored once, after summing seconds.
 */
public record DailyLoad(int bookingCount, long bookedMinutes) {

    public static final DailyLoad NONE = new DailyLoad(0, 0);

    public static DailyLoad of(List<Booking> bookingsToday) {
        long seconds = bookingsToday.stream()
                .mapToLong(b -> b.interval().durationSeconds())
                .sum();
        return new DailyLoad(bookingsToday.size(), seconds / 60);
    }
}
