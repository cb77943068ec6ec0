package com.example.barshift.schedule;

import com.example.barshift.archive.PublishedWeekRepository;
import com.example.barshift.worker.WorkerConstraintService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Counts, for every known worker, how many consecutive weeks in a row they held a Saturday slot.
 * <p>
 * Archived weeks are walked oldest first up to the week under view. A week in which the worker
 * has no Saturday slot (or which has no Saturday row at all) resets the count to zero.
 */
@Component
public class SaturdayStreakTracker {

    private static final Logger logger = LoggerFactory.getLogger(SaturdayStreakTracker.class);

    private final PublishedWeekRepository archive;
    private final WorkerConstraintService workers;
    private final WeekCalendar calendar;

    public SaturdayStreakTracker(PublishedWeekRepository archive,
                                 WorkerConstraintService workers,
                                 WeekCalendar calendar) {
        this.archive = archive;
        this.workers = workers;
        this.calendar = calendar;
    }

    /**
     * @param viewedWeekStart archived weeks starting after this date are ignored
     * @param current         the in-progress week, may be {@code null} when {@code includeCurrent} is false
     * @param includeCurrent  count {@code current} as one more week, unless the viewed week is in the
     *                        future or already archived
     */
    public Map<String, Integer> saturdayStreaks(LocalDate viewedWeekStart, WeekSchedule current, boolean includeCurrent) {
        Map<String, Integer> streaks = new LinkedHashMap<>();
        workers.names().forEach(name -> streaks.put(name, 0));

        archive.findAllChronological().forEach((weekStart, week) -> {
            if (!weekStart.isAfter(viewedWeekStart)) {
                step(streaks, week);
            }
        });

        if (includeCurrent && current != null) {
            if (calendar.isFuture(viewedWeekStart)) {
                logger.debug("Week {} is in the future, not counting it", viewedWeekStart);
            } else if (archive.contains(viewedWeekStart)) {
                logger.debug("Week {} is archived and already counted", viewedWeekStart);
            } else {
                step(streaks, current);
            }
        }
        return streaks;
    }

    private void step(Map<String, Integer> streaks, WeekSchedule week) {
        Set<String> onSaturday = week.workersOn(DayOfWeek.SATURDAY);
        streaks.replaceAll((name, streak) -> onSaturday.contains(name) ? streak + 1 : 0);
    }
}
