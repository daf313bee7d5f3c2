package com.example.rooms.controllers;

import com.example.rooms.dto.RoomDTO;

import java.util.List;
import java.util.Optional;

public interface RoomApiClient {

    List<RoomDTO> getRooms();

    Optional<RoomDTO> getRoom(Long roomId);
}
