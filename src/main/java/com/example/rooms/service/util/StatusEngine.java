package com.example.rooms.service.util;

import com.example.rooms.model.Block;
import com.example.rooms.model.Booking;
import com.example.rooms.model.BusinessWindow;
import com.example.rooms.model.DailyLoad;
import com.example.rooms.model.LoadThresholds;
import com.example.rooms.model.SpecialState;
import com.example.rooms.model.StatusResult;
import com.example.rooms.model.TimePoint;
import com.example.rooms.service.exception.AvailabilityConfigurationException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Derives a room's display status from "now" and the day's bookings.
 * <p>
 * Precedence, first match wins:
 * <ol>
 *     <li>configured special state (maintenance, inactive, night rest)</li>
 *     <li>a booking covers now: fully booked when the day is heavy, otherwise occupied until the block ends</li>
 *     <li>a booking starts later today: available until it starts</li>
 *     <li>available for the rest of the day</li>
 * </ol>
 */
@Slf4j
public final class StatusEngine {

    private StatusEngine() {
    }

    public static StatusResult computeStatus(TimePoint now,
                                             SpecialState specialState,
                                             List<Booking> bookingsToday,
                                             BusinessWindow window) {
        List<Booking> bookings = bookingsToday == null ? List.of() : bookingsToday;
        return computeStatus(now, specialState, null, bookings, window, DailyLoad.of(bookings), LoadThresholds.DEFAULT);
    }

    /**
     * @param currentCandidate booking the caller believes is running; ignored unless it actually covers {@code now}
     * @param dailyLoad        booking count and booked minutes for the whole day, past bookings included
     */
    public static StatusResult computeStatus(TimePoint now,
                                             SpecialState specialState,
                                             Booking currentCandidate,
                                             List<Booking> bookingsToday,
                                             BusinessWindow window,
                                             DailyLoad dailyLoad,
                                             LoadThresholds thresholds) {
        if (now == null || window == null || thresholds == null) {
            throw new AvailabilityConfigurationException("now, window and thresholds are required");
        }
        if (specialState != null) {
            return StatusResult.unavailable(specialState);
        }

        List<Booking> bookings = new ArrayList<>(bookingsToday == null ? List.of() : bookingsToday);
        bookings.sort(Booking.BY_START);

        Optional<Booking> current = resolveCurrent(now, currentCandidate, bookings);
        if (current.isPresent()) {
            Booking running = current.get();
            if (!bookings.contains(running)) {
                bookings.add(running);
            }
            DailyLoad load = dailyLoad == null ? DailyLoad.of(bookings) : dailyLoad;
            if (thresholds.isHeavy(load, window)) {
                return StatusResult.fullyBooked();
            }
            return occupied(now, running, bookings);
        }

        return bookings.stream()
                .filter(b -> b.start().isAfter(now))
                .findFirst()
                .map(next -> StatusResult.availableUntil(next.start(),
                        Math.floorDiv(NaiveTime.diffSeconds(now, next.start()), 60)))
                .orElseGet(StatusResult::available);
    }

    /** Bookings that have not ended yet. */
    public static long upcomingCount(TimePoint now, List<Booking> bookingsToday) {
        if (bookingsToday == null) {
            return 0;
        }
        return bookingsToday.stream()
                .filter(b -> b.end().isAfter(now))
                .count();
    }

    private static Optional<Booking> resolveCurrent(TimePoint now, Booking candidate, List<Booking> bookings) {
        if (candidate != null) {
            if (candidate.interval().contains(now)) {
                return Optional.of(candidate);
            }
            log.debug("Ignoring stale current booking {} ({}) at {}", candidate.id(), candidate.interval(), now);
        }
        return bookings.stream()
                .filter(b -> b.interval().contains(now))
                .findFirst();
    }

    private static StatusResult occupied(TimePoint now, Booking running, List<Booking> bookings) {
        TimePoint blockEnd = BlockMerger.blockContaining(running, bookings)
                .map(Block::end)
                .orElse(running.end());

        long total = NaiveTime.diffSeconds(running.start(), blockEnd);
        long elapsed = NaiveTime.diffSeconds(running.start(), now);
        double progress = total > 0 ? clamp(elapsed / (double) total) : 0.0;
        long remaining = Math.max(NaiveTime.diffSeconds(now, blockEnd), 0);

        return StatusResult.occupiedUntil(blockEnd, progress, remaining);
    }

    private static double clamp(double value) {
        return Math.min(Math.max(value, 0.0), 1.0);
    }
}
