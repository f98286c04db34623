package com.programmersdiary.crondaemon.scheduling;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * One scheduler evaluation instant: a calendar time truncated to the minute in the configured offset.
 * Weekday follows cron numbering, 0 = Sunday through 6 = Saturday.
 */
public record Tick(LocalDateTime time, ZoneOffset offset) implements Comparable<Tick> {

    public Tick {
        Objects.requireNonNull(time, "time");
        Objects.requireNonNull(offset, "offset");
        time = time.truncatedTo(ChronoUnit.MINUTES);
    }

    public static Tick of(Instant instant, ZoneOffset offset) {
        return new Tick(LocalDateTime.ofInstant(instant, offset), offset);
    }

    public int minute() {
        return time.getMinute();
    }

    public int hour() {
        return time.getHour();
    }

    public int dayOfMonth() {
        return time.getDayOfMonth();
    }

    public int month() {
        return time.getMonthValue();
    }

    public int weekday() {
        return time.getDayOfWeek().getValue() % 7;
    }

    public Instant instant() {
        return time.toInstant(offset);
    }

    public Tick plusMinutes(long minutes) {
        return new Tick(time.plusMinutes(minutes), offset);
    }

    public boolean isAfter(Tick other) {
        return compareTo(other) > 0;
    }

    public boolean isBefore(Tick other) {
        return compareTo(other) < 0;
    }

    public long minutesSince(Tick earlier) {
        return ChronoUnit.MINUTES.between(earlier.instant(), instant());
    }

    @Override
    public int compareTo(Tick other) {
        return instant().compareTo(other.instant());
    }

    @Override
    public String toString() {
        return time + offset.getId();
    }
}
