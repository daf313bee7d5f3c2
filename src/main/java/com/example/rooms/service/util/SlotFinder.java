package com.example.rooms.service.util;

import com.example.rooms.model.BusinessWindow;
import com.example.rooms.model.Interval;
import com.example.rooms.model.TimePoint;
import com.example.rooms.service.exception.AvailabilityConfigurationException;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Walks a day's business window on its granularity grid and collects the soonest free intervals.
 */
@Slf4j
public final class SlotFinder {

    private SlotFinder() {
    }

    /**
     * Search starts at {@code now} rounded up to the grid when {@code day} is today, otherwise at opening time.
     * After each candidate, accepted or not, the start moves by one granularity step, so returned slots
     * may overlap each other. They are alternatives, not a partition of the day.
     *
     * @return at most {@code maxResults} conflict-free intervals inside the window, soonest first;
     * the first element is the default suggestion
     */
    public static List<Interval> findNextSlots(TimePoint now,
                                               LocalDate day,
                                               BusinessWindow window,
                                               int durationMinutes,
                                               int maxResults,
                                               Collection<Interval> existing) {
        if (durationMinutes <= 0) {
            throw new AvailabilityConfigurationException("Duration must be positive, got " + durationMinutes);
        }
        if (maxResults < 0) {
            throw new AvailabilityConfigurationException("maxResults must not be negative, got " + maxResults);
        }
        if (now == null || day == null || window == null) {
            throw new AvailabilityConfigurationException("now, day and window are required");
        }

        TimePoint open = window.openOn(day);
        TimePoint close = window.closeOn(day);
        TimePoint searchStart = day.equals(now.date())
                ? NaiveTime.max(NaiveTime.ceilToGranularity(now, window.granularityMinutes()), open)
                : open;

        List<Interval> slots = new ArrayList<>();
        while (slots.size() < maxResults) {
            TimePoint candidateEnd = NaiveTime.addMinutes(searchStart, durationMinutes);
            if (candidateEnd.isAfter(close)) {
                break;
            }
            Interval candidate = Interval.of(searchStart, candidateEnd);
            if (candidateEnd.isAfter(now) && ConflictChecker.hasConflict(candidate, existing).isEmpty()) {
                slots.add(candidate);
            }
            searchStart = NaiveTime.addMinutes(searchStart, window.granularityMinutes());
        }

        log.debug("Found {} slots of {} min on {} starting from {}", slots.size(), durationMinutes, day, now);
        return List.copyOf(slots);
    }
}
