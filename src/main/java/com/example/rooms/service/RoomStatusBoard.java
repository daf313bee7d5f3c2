package com.example.rooms.service;

import com.example.rooms.controllers.RoomApiClient;
import com.example.rooms.dto.RoomDTO;
import com.example.rooms.model.RoomStats;
import com.example.rooms.model.StatusResult;
import com.example.rooms.service.util.RoomStatsCalculator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Re-evaluates every room on a fixed tick and keeps the latest statuses and upcoming booking counts for readers.
 * A room whose evaluation fails keeps its previous values.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RoomStatusBoard {

    private final RoomApiClient roomApi;
    private final RoomAvailabilityService availabilityService;

    private final AtomicReference<Snapshot> snapshot = new AtomicReference<>(Snapshot.EMPTY);

    @Scheduled(fixedDelayString = "${availability.refresh-interval-ms:60000}")
    public void refresh() {
        Snapshot previous = snapshot.get();
        Map<Long, StatusResult> statuses = new LinkedHashMap<>();
        Map<Long, Long> upcoming = new LinkedHashMap<>();

        for (RoomDTO room : roomApi.getRooms()) {
            Long roomId = room.getId();
            try {
                StatusResult status = availabilityService.statusForRoom(roomId);
                long count = availabilityService.upcomingBookingCount(roomId);
                statuses.put(roomId, status);
                upcoming.put(roomId, count);
            } catch (Exception e) {
                log.warn("Failed to refresh status of room {}: {}", roomId, e.getMessage());
                if (previous.statuses().containsKey(roomId)) {
                    statuses.put(roomId, previous.statuses().get(roomId));
                    upcoming.put(roomId, previous.upcoming().getOrDefault(roomId, 0L));
                }
            }
        }

        snapshot.set(new Snapshot(Collections.unmodifiableMap(statuses), Collections.unmodifiableMap(upcoming)));
        log.info("Room statuses refreshed: {}", stats());
    }

    public Optional<StatusResult> statusOf(Long roomId) {
        return Optional.ofNullable(snapshot.get().statuses().get(roomId));
    }

    /** Bookings of the room still ahead today as of the last refresh; 0 for unknown rooms */
    public long upcomingCountOf(Long roomId) {
        return snapshot.get().upcoming().getOrDefault(roomId, 0L);
    }

    public Map<Long, StatusResult> statuses() {
        return snapshot.get().statuses();
    }

    public RoomStats stats() {
        return RoomStatsCalculator.calculate(snapshot.get().statuses().values());
    }

    private record Snapshot(Map<Long, StatusResult> statuses, Map<Long, Long> upcoming) {
        static final Snapshot EMPTY = new Snapshot(Map.of(), Map.of());
    }
}
