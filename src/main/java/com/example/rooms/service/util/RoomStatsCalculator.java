package com.example.rooms.service.util;

import com.example.rooms.model.RoomStats;
import com.example.rooms.model.StatusResult;

import java.util.Collection;

public final class RoomStatsCalculator {

    private RoomStatsCalculator() {
    }

    public static RoomStats calculate(Collection<StatusResult> statuses) {
        if (statuses == null || statuses.isEmpty()) {
            return RoomStats.EMPTY;
        }

        int available = 0;
        int availableSoon = 0;
        int occupied = 0;
        int disabled = 0;

        for (StatusResult status : statuses) {
            switch (status.kind()) {
                case AVAILABLE -> available++;
                case AVAILABLE_UNTIL -> availableSoon++;
                case OCCUPIED, FULLY_BOOKED -> occupied++;
                case UNAVAILABLE -> disabled++;
            }
        }

        return new RoomStats(statuses.size(), available, availableSoon, occupied, disabled);
    }
}
