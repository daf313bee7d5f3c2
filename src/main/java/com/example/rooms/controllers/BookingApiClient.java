package com.example.rooms.controllers;

import com.example.rooms.dto.BookingDTO;

import java.time.LocalDate;
import java.util.List;

public interface BookingApiClient {

    /** Bookings of one room on one day, already scoped to that room-day */
    List<BookingDTO> getBookingsForRoom(Long roomId, LocalDate date);
}
