package com.example.rooms.model;

import com.example.rooms.service.exception.AvailabilityConfigurationException;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoUnit;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Timezone-naive point in time. Holds calendar and clock fields exactly as stored;
 * no offset or daylight-saving rule is ever applied to it.
 */
public record TimePoint(LocalDateTime value) implements Comparable<TimePoint> {

    private static final Pattern NAIVE = Pattern.compile(
            "(\\d{4}-\\d{2}-\\d{2})[ T](\\d{2}:\\d{2})(?::(\\d{2}))?(?:\\.\\d+)?(?:Z|[+-]\\d{2}:?\\d{2})?"
    );

    private static final DateTimeFormatter STORAGE_FORMAT = DateTimeFormatter.ofPattern("uuuu-MM-dd HH:mm:ss")
            .withResolverStyle(ResolverStyle.STRICT);

    public TimePoint {
        Objects.requireNonNull(value, "value must not be null");
        value = value.truncatedTo(ChronoUnit.SECONDS);
    }

    public static TimePoint of(LocalDateTime value) {
        return new TimePoint(value);
    }

    public static TimePoint of(int year, int month, int day, int hour, int minute, int second) {
        return new TimePoint(LocalDateTime.of(year, month, day, hour, minute, second));
    }

    /**
     * Parses "2025-11-13 14:30:00", "2025-11-13T14:30" and ISO variants. A trailing
     * {@code Z} or numeric offset is dropped, not converted. Impossible calendar dates such as
     * 2025-02-30 are rejected rather than moved to the nearest valid day.
     */
    public static TimePoint parse(String text) {
        if (text == null || text.isBlank()) {
            throw new AvailabilityConfigurationException("Timestamp must not be blank");
        }
        Matcher matcher = NAIVE.matcher(text.trim());
        if (!matcher.matches()) {
            throw new AvailabilityConfigurationException("Unsupported timestamp format: '" + text + "'");
        }
        String seconds = matcher.group(3) != null ? matcher.group(3) : "00";
        String normalized = matcher.group(1) + " " + matcher.group(2) + ":" + seconds;
        try {
            return new TimePoint(LocalDateTime.parse(normalized, STORAGE_FORMAT));
        } catch (DateTimeParseException e) {
            throw new AvailabilityConfigurationException("Invalid timestamp: '" + text + "'", e);
        }
    }

    public LocalDate date() {
        return value.toLocalDate();
    }

    public boolean isBefore(TimePoint other) {
        return value.isBefore(other.value);
    }

    public boolean isAfter(TimePoint other) {
        return value.isAfter(other.value);
    }

    @Override
    public int compareTo(TimePoint other) {
        return value.compareTo(other.value);
    }

    @Override
    public String toString() {
        return STORAGE_FORMAT.format(value);
    }
}
