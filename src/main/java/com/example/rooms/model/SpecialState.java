package com.example.rooms.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Configured room states that make the room unavailable regardless of bookings.
 */
public enum SpecialState {
    MAINTENANCE("Under maintenance"),
    INACTIVE("Not available"),
    NIGHT_REST("Night rest");

    private final String label;

    SpecialState(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /** Maps the raw room status ("maintenance", "night_rest", ...). "active" and unknown values map to empty. */
    public static Optional<SpecialState> fromRaw(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        for (SpecialState state : values()) {
            if (state.name().equals(normalized)) {
                return Optional.of(state);
            }
        }
        return Optional.empty();
    }
}
