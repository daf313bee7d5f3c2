package com.example.rooms.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class DailyLoadTest {

    @Test
    void shouldSumSecondsBeforeFlooringToMinutes() {
        DailyLoad load = DailyLoad.of(List.of(
                Booking.of(1L, Interval.parse("2025-11-13 09:00:00", "2025-11-13 09:01:30")),
                Booking.of(2L, Interval.parse("2025-11-13 10:00:00", "2025-11-13 10:01:30"))
        ));

        assertThat(load).isEqualTo(new DailyLoad(2, 3));
    }

    @Test
    void emptyDayHasNoLoad() {
        assertThat(DailyLoad.of(List.of())).isEqualTo(DailyLoad.NONE);
    }
}
