package com.example.rooms.config;

import com.example.rooms.model.BusinessWindow;
import com.example.rooms.model.LoadThresholds;
import com.example.rooms.service.exception.AvailabilityConfigurationException;
import lombok.Data;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.PropertySource;

import java.time.LocalTime;
import java.time.format.DateTimeParseException;

@Configuration
@Data
@PropertySource("classpath:application.properties")
public class AvailabilityConfig {

    @Value("${availability.open-time:08:00}")
    String openTime;

    /** "24:00" closes at midnight */
    @Value("${availability.close-time:20:00}")
    String closeTime;

    @Value("${availability.granularity-minutes:15}")
    int granularityMinutes;

    @Value("${availability.default-duration-minutes:30}")
    int defaultDurationMinutes;

    @Value("${availability.max-suggestions:4}")
    int maxSuggestions;

    @Value("${availability.heavy.min-bookings:3}")
    int heavyMinBookings;

    @Value("${availability.heavy.booked-percent:66}")
    int heavyBookedPercent;

    /** Lifts business-hour limits: the window becomes 00:00-24:00 */
    @Value("${availability.dev-mode:false}")
    boolean devMode;

    public BusinessWindow businessWindow() {
        if (devMode) {
            return BusinessWindow.allDay(granularityMinutes, defaultDurationMinutes);
        }
        return new BusinessWindow(toMinuteOfDay(openTime), toMinuteOfDay(closeTime),
                granularityMinutes, defaultDurationMinutes);
    }

    public LoadThresholds loadThresholds() {
        return new LoadThresholds(heavyMinBookings, heavyBookedPercent);
    }

    private static int toMinuteOfDay(String value) {
        if (value == null) {
            throw new AvailabilityConfigurationException("Business window time is missing");
        }
        String trimmed = value.trim();
        if ("24:00".equals(trimmed)) {
            return BusinessWindow.MINUTES_PER_DAY;
        }
        try {
            return LocalTime.parse(trimmed).toSecondOfDay() / 60;
        } catch (DateTimeParseException e) {
            throw new AvailabilityConfigurationException("Invalid business window time '" + value + "'", e);
        }
    }
}
