package com.example.barshift.schedule;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.format.TextStyle;
import java.util.Locale;
import java.util.Optional;

/**
 * A weekday paired with its date in the week under view. Rows of a {@link WeekSchedule} are keyed
 * by {@link #label()}, e.g. {@code "Saturday 2024-06-15"}.
 */
public record ScheduleDay(DayOfWeek dayOfWeek, LocalDate date) {

    public String name() {
        return nameOf(dayOfWeek);
    }

    public String label() {
        return name() + " " + date;
    }

    /** Position in the week, Sunday = 0. */
    public int index() {
        return dayOfWeek.getValue() % 7;
    }

    public static String nameOf(DayOfWeek dayOfWeek) {
        return dayOfWeek.getDisplayName(TextStyle.FULL, Locale.ENGLISH);
    }

    /**
     * Weekday named by the first word of a row label, matched case-insensitively.
     */
    public static Optional<DayOfWeek> dayOfWeekOf(String label) {
        if (label == null || label.isBlank()) {
            return Optional.empty();
        }
        String first = label.trim().split("\\s+")[0];
        for (DayOfWeek day : DayOfWeek.values()) {
            if (nameOf(day).equalsIgnoreCase(first)) {
                return Optional.of(day);
            }
        }
        return Optional.empty();
    }
}
