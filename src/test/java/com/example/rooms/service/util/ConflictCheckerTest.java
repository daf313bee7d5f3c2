package com.example.rooms.service.util;

import com.example.rooms.model.Booking;
import com.example.rooms.model.Interval;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ConflictCheckerTest {

    @Test
    void touchingBoundaryIsNoConflict() {
        assertThat(ConflictChecker.hasConflict(interval("14:00", "15:00"), List.of(interval("13:30", "14:00"))))
                .isEmpty();
        assertThat(ConflictChecker.hasConflict(interval("14:00", "15:00"), List.of(interval("15:00", "16:00"))))
                .isEmpty();
    }

    @Test
    void shouldReturnOverlappingInterval() {
        Interval existing = interval("14:30", "15:30");

        assertThat(ConflictChecker.hasConflict(interval("14:00", "15:00"), List.of(existing)))
                .contains(existing);
    }

    @Test
    void shouldReturnEarliestStartingOverlapperRegardlessOfOrder() {
        List<Interval> existing = List.of(
                interval("14:45", "15:15"),
                interval("16:00", "17:00"),
                interval("13:45", "14:15"),
                interval("14:15", "14:30")
        );

        assertThat(ConflictChecker.hasConflict(interval("14:00", "15:00"), existing))
                .contains(interval("13:45", "14:15"));
    }

    @Test
    void proposalInsideGapHasNoConflict() {
        List<Interval> existing = List.of(
                interval("09:00", "10:00"),
                interval("12:00", "13:00")
        );

        assertThat(ConflictChecker.hasConflict(interval("10:15", "11:45"), existing)).isEmpty();
        assertThat(ConflictChecker.hasConflict(interval("10:00", "12:00"), existing)).isEmpty();
        assertThat(ConflictChecker.hasConflict(interval("10:00", "12:00"), List.of())).isEmpty();
    }

    @Test
    void proposalEnclosingBookingConflicts() {
        Interval existing = interval("10:00", "10:30");

        assertThat(ConflictChecker.hasConflict(interval("09:00", "11:00"), List.of(existing))).contains(existing);
    }

    @Test
    void shouldReportConflictingBooking() {
        Booking later = new Booking(7L, interval("14:30", "15:30"), "Weekly sync", "u-7");
        Booking earlier = new Booking(3L, interval("13:00", "14:10"), "Interview", "u-3");

        assertThat(ConflictChecker.findConflictingBooking(interval("14:00", "15:00"), List.of(later, earlier)))
                .contains(earlier);
        assertThat(ConflictChecker.findConflictingBooking(interval("16:00", "17:00"), List.of(later, earlier)))
                .isEmpty();
    }

    private static Interval interval(String start, String end) {
        return Interval.parse("2025-11-13 " + start + ":00", "2025-11-13 " + end + ":00");
    }
}
