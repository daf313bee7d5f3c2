package com.example.rooms.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SpecialStateTest {

    @Test
    void shouldMapRawRoomStatus() {
        assertThat(SpecialState.fromRaw("maintenance")).contains(SpecialState.MAINTENANCE);
        assertThat(SpecialState.fromRaw("night_rest")).contains(SpecialState.NIGHT_REST);
        assertThat(SpecialState.fromRaw("night-rest")).contains(SpecialState.NIGHT_REST);
        assertThat(SpecialState.fromRaw(" Inactive ")).contains(SpecialState.INACTIVE);
    }

    @Test
    void activeRoomHasNoSpecialState() {
        assertThat(SpecialState.fromRaw("active")).isEmpty();
        assertThat(SpecialState.fromRaw(null)).isEmpty();
        assertThat(SpecialState.fromRaw("")).isEmpty();
    }
}
