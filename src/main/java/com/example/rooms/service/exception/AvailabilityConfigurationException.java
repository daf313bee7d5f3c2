package com.example.rooms.service.exception;

/**
 * Malformed input to the availability engine: bad windows, non-positive durations,
 * unparseable timestamps. Thrown instead of producing a silently wrong schedule.
 */
public class AvailabilityConfigurationException extends RuntimeException {

    public AvailabilityConfigurationException(String message) {
        super(message);
    }

    public AvailabilityConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
