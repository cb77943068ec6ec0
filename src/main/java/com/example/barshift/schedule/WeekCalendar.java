package com.example.barshift.schedule;

import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Sunday-based week arithmetic plus the offset of the week under view from the current week.
 */
@Component
public class WeekCalendar {

    private final Clock clock;
    private int weekOffset;

    public WeekCalendar(Clock clock) {
        this.clock = clock;
    }

    public static LocalDate weekStart(LocalDate referenceDate) {
        int sinceSunday = referenceDate.getDayOfWeek().getValue() % 7; // Sunday=0
        return referenceDate.minusDays(sinceSunday);
    }

    /** The seven days of the week starting at {@code weekStart}, Sunday first. */
    public static List<ScheduleDay> days(LocalDate weekStart) {
        List<ScheduleDay> days = new ArrayList<>(7);
        for (int i = 0; i < 7; i++) {
            LocalDate date = weekStart.plusDays(i);
            days.add(new ScheduleDay(date.getDayOfWeek(), date));
        }
        return days;
    }

    public LocalDate today() {
        return LocalDate.now(clock);
    }

    public LocalDate currentWeekStart() {
        return weekStart(today().plusWeeks(weekOffset));
    }

    public LocalDate advance() {
        weekOffset++;
        return currentWeekStart();
    }

    public LocalDate previous() {
        weekOffset--;
        return currentWeekStart();
    }

    public LocalDate resetToToday() {
        weekOffset = 0;
        return currentWeekStart();
    }

    public int getWeekOffset() {
        return weekOffset;
    }

    public boolean isFuture(LocalDate weekStart) {
        return weekStart.isAfter(today());
    }

    static boolean isSaturday(ScheduleDay day) {
        return day.dayOfWeek() == DayOfWeek.SATURDAY;
    }
}
