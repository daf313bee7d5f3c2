package com.example.rooms.model;

public record RoomStats(int total, int available, int availableSoon, int occupied, int disabled) {

    public static final RoomStats EMPTY = new RoomStats(0, 0, 0, 0, 0);
}
