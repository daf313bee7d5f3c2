package com.example.rooms.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wall clock of the premises. Only its local date-time is read; the zone never reaches the engine.
 */
@Configuration
public class TimeConfig {

    @Bean
    public Clock localClock() {
        return Clock.systemDefaultZone();
    }
}
