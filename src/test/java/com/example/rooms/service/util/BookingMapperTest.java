package com.example.rooms.service.util;

import com.example.rooms.dto.BookingDTO;
import com.example.rooms.model.Booking;
import com.example.rooms.model.TimePoint;
import com.example.rooms.service.exception.InvalidIntervalException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BookingMapperTest {

    @Test
    void shouldMapNaiveStringsAsStored() {
        Booking booking = BookingMapper.toBooking(
                new BookingDTO(5L, 1L, "Standup", "u-1", "2025-11-13 09:00:00", "2025-11-13T09:15:00Z"));

        assertThat(booking.id()).isEqualTo(5L);
        assertThat(booking.title()).isEqualTo("Standup");
        assertThat(booking.start()).isEqualTo(TimePoint.parse("2025-11-13 09:00:00"));
        assertThat(booking.end()).isEqualTo(TimePoint.parse("2025-11-13 09:15:00"));
    }

    @Test
    void singleRowRejectsReversedInterval() {
        assertThatThrownBy(() -> BookingMapper.toBooking(
                new BookingDTO(5L, 1L, "Broken", "u-1", "2025-11-13 10:00:00", "2025-11-13 09:00:00")))
                .isInstanceOf(InvalidIntervalException.class);
    }

    @Test
    void listMappingSkipsMalformedRows() {
        List<Booking> bookings = BookingMapper.toBookings(List.of(
                new BookingDTO(1L, 1L, "Ok", "u-1", "2025-11-13 09:00:00", "2025-11-13 10:00:00"),
                new BookingDTO(2L, 1L, "Reversed", "u-1", "2025-11-13 10:00:00", "2025-11-13 09:00:00"),
                new BookingDTO(3L, 1L, "Garbage", "u-1", "tomorrow", "2025-11-13 09:00:00"),
                new BookingDTO(4L, 1L, "Ok too", "u-2", "2025-11-13 11:00:00", "2025-11-13 12:00:00")
        ));

        assertThat(bookings).extracting(Booking::id).containsExactly(1L, 4L);
    }
}
