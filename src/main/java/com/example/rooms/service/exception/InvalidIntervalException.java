package com.example.rooms.service.exception;

public class InvalidIntervalException extends AvailabilityConfigurationException {

    public InvalidIntervalException(String message) {
        super(message);
    }
}
