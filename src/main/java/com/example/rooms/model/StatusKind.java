package com.example.rooms.model;

public enum StatusKind {
    UNAVAILABLE,
    FULLY_BOOKED,
    OCCUPIED,
    AVAILABLE_UNTIL,
    AVAILABLE;

    public boolean isOccupied() {
        return this == OCCUPIED || this == FULLY_BOOKED;
    }

    public boolean isAvailable() {
        return this == AVAILABLE || this == AVAILABLE_UNTIL;
    }
}
