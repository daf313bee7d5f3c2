package com.example.rooms.service;

import com.example.rooms.model.Block;
import com.example.rooms.model.Booking;
import com.example.rooms.model.BusinessWindow;
import com.example.rooms.model.Interval;
import com.example.rooms.model.SpecialState;
import com.example.rooms.model.StatusResult;
import com.example.rooms.model.TimePoint;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

public interface RoomAvailabilityService {

    List<Block> mergeBlocks(List<Booking> bookings);

    StatusResult computeStatus(TimePoint now, SpecialState specialState, List<Booking> bookingsToday, BusinessWindow window);

    Optional<Interval> hasConflict(Interval proposed, List<Interval> bookingsOnSameDay);

    List<Interval> findNextSlots(TimePoint now, LocalDate day, BusinessWindow window,
                                 int durationMinutes, int maxResults, List<Interval> bookingsOnDay);

    /** Status of a room right now, with its configured special state and today's bookings */
    StatusResult statusForRoom(Long roomId);

    /** Earliest booking of that room-day overlapping {@code proposed} */
    Optional<Booking> checkConflict(Long roomId, Interval proposed);

    /** Soonest free slots with the configured defaults; {@code durationMinutes} null means the default duration */
    SlotSuggestions suggestSlots(Long roomId, LocalDate day, Integer durationMinutes);

    /** Today's bookings of the room that have not ended yet */
    long upcomingBookingCount(Long roomId);

    /** When the last booking of that room-day ends, empty for a free day */
    Optional<TimePoint> lastBusyEnd(Long roomId, LocalDate day);
}
