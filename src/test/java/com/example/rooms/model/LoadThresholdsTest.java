package com.example.rooms.model;

import com.example.rooms.service.exception.AvailabilityConfigurationException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LoadThresholdsTest {

    private final BusinessWindow window = BusinessWindow.standard();

    @Test
    void threeBookingsMakeTheDayHeavy() {
        assertThat(LoadThresholds.DEFAULT.isHeavy(new DailyLoad(3, 90), window)).isTrue();
        assertThat(LoadThresholds.DEFAULT.isHeavy(new DailyLoad(2, 90), window)).isFalse();
    }

    @Test
    void twoThirdsOfTheWindowMakeTheDayHeavy() {
        // 66% of 720 minutes is 475.2
        assertThat(LoadThresholds.DEFAULT.isHeavy(new DailyLoad(1, 476), window)).isTrue();
        assertThat(LoadThresholds.DEFAULT.isHeavy(new DailyLoad(1, 475), window)).isFalse();
    }

    @Test
    void shouldRejectNonsenseThresholds() {
        assertThatThrownBy(() -> new LoadThresholds(0, 66)).isInstanceOf(AvailabilityConfigurationException.class);
        assertThatThrownBy(() -> new LoadThresholds(3, 101)).isInstanceOf(AvailabilityConfigurationException.class);
    }
}
