package com.example.rooms.service.util;

import com.example.rooms.model.BusinessWindow;
import com.example.rooms.model.Interval;
import com.example.rooms.model.TimePoint;
import com.example.rooms.service.exception.AvailabilityConfigurationException;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SlotFinderTest {

    private static final LocalDate DAY = LocalDate.of(2025, 11, 13);

    private final BusinessWindow window = BusinessWindow.standard();

    @Test
    void beforeOpeningFirstSlotStartsAtOpening() {
        List<Interval> slots = SlotFinder.findNextSlots(at("07:00"), DAY, window, 30, 4, List.of());

        assertThat(slots).containsExactly(
                interval("08:00", "08:30"),
                interval("08:15", "08:45"),
                interval("08:30", "09:00"),
                interval("08:45", "09:15")
        );
    }

    @Test
    void todayStartsAtNowRoundedUpAndSkipsConflicts() {
        List<Interval> slots = SlotFinder.findNextSlots(at("09:07"), DAY, window, 30, 4,
                List.of(interval("09:15", "10:00")));

        assertThat(slots).containsExactly(
                interval("10:00", "10:30"),
                interval("10:15", "10:45"),
                interval("10:30", "11:00"),
                interval("10:45", "11:15")
        );
    }

    @Test
    void slotEndingExactlyAtCloseIsOffered() {
        List<Interval> slots = SlotFinder.findNextSlots(at("19:20"), DAY, window, 30, 4, List.of());

        assertThat(slots).containsExactly(interval("19:30", "20:00"));
    }

    @Test
    void anotherDayStartsAtOpening() {
        TimePoint yesterdayEvening = TimePoint.parse("2025-11-12 21:00:00");

        List<Interval> slots = SlotFinder.findNextSlots(yesterdayEvening, DAY, window, 60, 1,
                List.of(interval("08:00", "08:30")));

        assertThat(slots).containsExactly(interval("08:30", "09:30"));
    }

    @Test
    void pastDayHasNoSlots() {
        TimePoint tomorrow = TimePoint.parse("2025-11-14 09:00:00");

        assertThat(SlotFinder.findNextSlots(tomorrow, DAY, window, 30, 4, List.of())).isEmpty();
    }

    @Test
    void fullyBookedDayHasNoSlots() {
        List<Interval> slots = SlotFinder.findNextSlots(at("07:00"), DAY, window, 30, 4,
                List.of(interval("08:00", "20:00")));

        assertThat(slots).isEmpty();
    }

    @Test
    void allDayWindowStopsAtMidnight() {
        BusinessWindow allDay = BusinessWindow.allDay(15, 30);

        assertThat(SlotFinder.findNextSlots(at("23:20"), DAY, allDay, 30, 4, List.of()))
                .containsExactly(Interval.of(at("23:30"), TimePoint.parse("2025-11-14 00:00:00")));
        assertThat(SlotFinder.findNextSlots(at("23:50"), DAY, allDay, 30, 4, List.of())).isEmpty();
    }

    @Test
    void slotsAreConflictFreeAndInsideWindow() {
        List<Interval> existing = List.of(
                interval("08:10", "09:05"),
                interval("09:40", "10:20"),
                interval("11:00", "11:30"),
                interval("12:00", "19:00")
        );

        List<Interval> slots = SlotFinder.findNextSlots(at("07:30"), DAY, window, 45, 20, existing);

        assertThat(slots).isNotEmpty();
        assertThat(slots).allSatisfy(slot -> {
            assertThat(ConflictChecker.hasConflict(slot, existing)).isEmpty();
            assertThat(slot.start()).isGreaterThanOrEqualTo(window.openOn(DAY));
            assertThat(slot.end()).isLessThanOrEqualTo(window.closeOn(DAY));
        });
        assertThat(slots).containsExactly(interval("19:00", "19:45"), interval("19:15", "20:00"));
    }

    @Test
    void zeroMaxResultsGivesEmptyList() {
        assertThat(SlotFinder.findNextSlots(at("07:00"), DAY, window, 30, 0, List.of())).isEmpty();
    }

    @Test
    void shouldFailFastOnBadArguments() {
        assertThatThrownBy(() -> SlotFinder.findNextSlots(at("07:00"), DAY, window, 0, 4, List.of()))
                .isInstanceOf(AvailabilityConfigurationException.class);
        assertThatThrownBy(() -> SlotFinder.findNextSlots(at("07:00"), DAY, window, -15, 4, List.of()))
                .isInstanceOf(AvailabilityConfigurationException.class);
        assertThatThrownBy(() -> SlotFinder.findNextSlots(at("07:00"), DAY, window, 30, -1, List.of()))
                .isInstanceOf(AvailabilityConfigurationException.class);
    }

    private static TimePoint at(String clock) {
        return TimePoint.parse("2025-11-13 " + clock + ":00");
    }

    private static Interval interval(String start, String end) {
        return Interval.of(at(start), at(end));
    }
}
