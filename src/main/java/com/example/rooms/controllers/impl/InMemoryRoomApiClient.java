package com.example.rooms.controllers.impl;

import com.example.rooms.controllers.RoomApiClient;
import com.example.rooms.dto.RoomDTO;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Slf4j
@Service
public class InMemoryRoomApiClient implements RoomApiClient {

    private final Map<Long, RoomDTO> rooms = new ConcurrentHashMap<>();

    @Override
    public List<RoomDTO> getRooms() {
        return rooms.values().stream()
                .sorted(Comparator.comparing(RoomDTO::getId))
                .toList();
    }

    @Override
    public Optional<RoomDTO> getRoom(Long roomId) {
        return Optional.ofNullable(rooms.get(roomId));
    }

    public void save(RoomDTO room) {
        rooms.put(room.getId(), room);
        log.debug("Stored room {} ({}) with status {}", room.getId(), room.getName(), room.getStatus());
    }
}
