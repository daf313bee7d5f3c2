package com.example.rooms.controllers.impl;

import com.example.rooms.controllers.BookingApiClient;
import com.example.rooms.dto.BookingDTO;
import com.example.rooms.model.Interval;
import com.example.rooms.model.TimePoint;
import com.example.rooms.service.exception.AvailabilityConfigurationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Booking store kept in memory. A booking belongs to every day its interval overlaps,
 * so one running past midnight shows up on both days.
 */
@Slf4j
@Service
public class InMemoryBookingApiClient implements BookingApiClient {

    private final Map<Long, List<BookingDTO>> bookingsByRoom = new ConcurrentHashMap<>();

    @Override
    public List<BookingDTO> getBookingsForRoom(Long roomId, LocalDate date) {
        Interval day = Interval.of(TimePoint.of(date.atStartOfDay()), TimePoint.of(date.plusDays(1).atStartOfDay()));
        return bookingsByRoom.getOrDefault(roomId, List.of()).stream()
                .filter(b -> touchesDay(b, day, date))
                .sorted(Comparator.comparing(BookingDTO::getStartTime, Comparator.nullsLast(Comparator.naturalOrder())))
                .toList();
    }

    public void save(BookingDTO booking) {
        bookingsByRoom.computeIfAbsent(booking.getRoomId(), id -> new CopyOnWriteArrayList<>()).add(booking);
        log.debug("Stored booking {} for room {}", booking.getId(), booking.getRoomId());
    }

    public boolean remove(Long roomId, Long bookingId) {
        List<BookingDTO> bookings = bookingsByRoom.getOrDefault(roomId, new ArrayList<>());
        return bookings.removeIf(b -> bookingId.equals(b.getId()));
    }

    /** Rows that cannot be parsed stay on the day their start text names, so the mapper can report them. */
    private boolean touchesDay(BookingDTO booking, Interval day, LocalDate date) {
        try {
            return Interval.parse(booking.getStartTime(), booking.getEndTime()).overlaps(day);
        } catch (AvailabilityConfigurationException e) {
            return booking.getStartTime() != null && booking.getStartTime().startsWith(date.toString());
        }
    }
}
