package com.example.rooms.service;

import com.example.rooms.model.Interval;

import java.util.Collections;
import java.util.List;

public record SlotSuggestions(List<Interval> slots) {

    public static final SlotSuggestions NONE = new SlotSuggestions(List.of());

    public SlotSuggestions {
        slots = slots == null ? Collections.emptyList() : List.copyOf(slots);
    }

    public boolean found() {
        return !slots.isEmpty();
    }

    /** The suggestion selected by default */
    public Interval best() {
        return found() ? slots.get(0) : null;
    }
}
