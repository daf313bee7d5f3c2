package com.example.rooms.service.impl;

import com.example.rooms.config.AvailabilityConfig;
import com.example.rooms.controllers.BookingApiClient;
import com.example.rooms.controllers.RoomApiClient;
import com.example.rooms.dto.RoomDTO;
import com.example.rooms.model.Block;
import com.example.rooms.model.Booking;
import com.example.rooms.model.BusinessWindow;
import com.example.rooms.model.DailyLoad;
import com.example.rooms.model.Interval;
import com.example.rooms.model.SpecialState;
import com.example.rooms.model.StatusResult;
import com.example.rooms.model.TimePoint;
import com.example.rooms.service.RoomAvailabilityService;
import com.example.rooms.service.SlotSuggestions;
import com.example.rooms.service.exception.AvailabilityConfigurationException;
import com.example.rooms.service.util.BlockMerger;
import com.example.rooms.service.util.BookingMapper;
import com.example.rooms.service.util.ConflictChecker;
import com.example.rooms.service.util.SlotFinder;
import com.example.rooms.service.util.StatusEngine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class RoomAvailabilityServiceImpl implements RoomAvailabilityService {

    private final BookingApiClient bookingApi;
    private final RoomApiClient roomApi;
    private final AvailabilityConfig config;
    private final Clock clock;

    @Override
    public List<Block> mergeBlocks(List<Booking> bookings) {
        return BlockMerger.mergeBlocks(bookings);
    }

    @Override
    public StatusResult computeStatus(TimePoint now, SpecialState specialState, List<Booking> bookingsToday, BusinessWindow window) {
        List<Booking> bookings = bookingsToday == null ? List.of() : bookingsToday;
        return StatusEngine.computeStatus(now, specialState, null, bookings, window,
                DailyLoad.of(bookings), config.loadThresholds());
    }

    @Override
    public Optional<Interval> hasConflict(Interval proposed, List<Interval> bookingsOnSameDay) {
        return ConflictChecker.hasConflict(proposed, bookingsOnSameDay);
    }

    @Override
    public List<Interval> findNextSlots(TimePoint now, LocalDate day, BusinessWindow window,
                                        int durationMinutes, int maxResults, List<Interval> bookingsOnDay) {
        return SlotFinder.findNextSlots(now, day, window, durationMinutes, maxResults, bookingsOnDay);
    }

    @Override
    public StatusResult statusForRoom(Long roomId) {
        RoomDTO room = roomApi.getRoom(roomId)
                .orElseThrow(() -> new AvailabilityConfigurationException("Unknown room " + roomId));
        TimePoint now = now();
        List<Booking> bookings = bookingsFor(roomId, now.date());
        StatusResult status = computeStatus(now, SpecialState.fromRaw(room.getStatus()).orElse(null),
                bookings, config.businessWindow());
        log.debug("Room {} at {}: {}", roomId, now, status.label());
        return status;
    }

    @Override
    public Optional<Booking> checkConflict(Long roomId, Interval proposed) {
        List<Booking> bookings = bookingsFor(roomId, proposed.start().date());
        Optional<Booking> conflict = ConflictChecker.findConflictingBooking(proposed, bookings);
        conflict.ifPresent(b -> log.info("Proposed {} for room {} conflicts with booking {} ({})",
                proposed, roomId, b.id(), b.interval()));
        return conflict;
    }

    @Override
    public SlotSuggestions suggestSlots(Long roomId, LocalDate day, Integer durationMinutes) {
        BusinessWindow window = config.businessWindow();
        int duration = durationMinutes != null ? durationMinutes : window.defaultDurationMinutes();
        List<Interval> existing = bookingsFor(roomId, day).stream()
                .map(Booking::interval)
                .toList();

        List<Interval> slots = findNextSlots(now(), day, window, duration, config.getMaxSuggestions(), existing);
        if (slots.isEmpty()) {
            log.info("No free {} min slot for room {} on {}", duration, roomId, day);
            return SlotSuggestions.NONE;
        }
        return new SlotSuggestions(slots);
    }

    @Override
    public long upcomingBookingCount(Long roomId) {
        TimePoint now = now();
        return StatusEngine.upcomingCount(now, bookingsFor(roomId, now.date()));
    }

    @Override
    public Optional<TimePoint> lastBusyEnd(Long roomId, LocalDate day) {
        return BlockMerger.lastBusyEnd(bookingsFor(roomId, day));
    }

    private List<Booking> bookingsFor(Long roomId, LocalDate day) {
        return BookingMapper.toBookings(bookingApi.getBookingsForRoom(roomId, day));
    }

    private TimePoint now() {
        return TimePoint.of(LocalDateTime.now(clock));
    }
}
