package com.example.rooms.service.util;

import com.example.rooms.dto.BookingDTO;
import com.example.rooms.model.Booking;
import com.example.rooms.model.Interval;
import com.example.rooms.service.exception.AvailabilityConfigurationException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

@Slf4j
public final class BookingMapper {

    private BookingMapper() {
    }

    public static Booking toBooking(BookingDTO dto) {
        Interval interval = Interval.parse(dto.getStartTime(), dto.getEndTime());
        return new Booking(dto.getId(), interval, dto.getTitle(), dto.getOwnerRef());
    }

    /** Malformed rows are logged and left out; one bad row must not hide the rest of the day. */
    public static List<Booking> toBookings(List<BookingDTO> dtos) {
        if (dtos == null || dtos.isEmpty()) {
            return List.of();
        }
        List<Booking> bookings = new ArrayList<>(dtos.size());
        for (BookingDTO dto : dtos) {
            try {
                bookings.add(toBooking(dto));
            } catch (AvailabilityConfigurationException e) {
                log.warn("Skipping booking {}: {}", dto.getId(), e.getMessage());
            }
        }
        return bookings;
    }
}
