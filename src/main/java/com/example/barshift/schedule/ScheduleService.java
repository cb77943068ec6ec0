package com.example.barshift.schedule;

import com.example.barshift.archive.SchedulePublisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Entry point for the scheduling workflow. Holds the week under view and routes generation,
 * navigation, manual edits and publishing to the components that implement them.
 * <p>
 * There is a single in-progress week per application; calls are serialized on this instance.
 */
@Service
public class ScheduleService {

    private static final Logger logger = LoggerFactory.getLogger(ScheduleService.class);

    private final WeekCalendar calendar;
    private final ScheduleGenerator generator;
    private final ScheduleEditor editor;
    private final SchedulePublisher publisher;
    private final SaturdayStreakTracker streakTracker;

    private WorkingWeek current;

    public ScheduleService(WeekCalendar calendar,
                           ScheduleGenerator generator,
                           ScheduleEditor editor,
                           SchedulePublisher publisher,
                           SaturdayStreakTracker streakTracker) {
        this.calendar = calendar;
        this.generator = generator;
        this.editor = editor;
        this.publisher = publisher;
        this.streakTracker = streakTracker;
    }

    /** The week under view, generated on first access. */
    public synchronized WorkingWeek currentWeek() {
        if (current == null) {
            current = generator.generate(calendar.currentWeekStart());
        }
        return current;
    }

    /** Discards the in-progress week and generates it again. */
    public synchronized WorkingWeek regenerate() {
        current = generator.generate(calendar.currentWeekStart());
        return current;
    }

    public synchronized WorkingWeek nextWeek() {
        LocalDate weekStart = calendar.advance();
        logger.info("Moved to week {}", weekStart);
        current = generator.generate(weekStart);
        return current;
    }

    public synchronized WorkingWeek previousWeek() {
        LocalDate weekStart = calendar.previous();
        logger.info("Moved to week {}", weekStart);
        current = generator.generate(weekStart);
        return current;
    }

    public synchronized WorkingWeek thisWeek() {
        LocalDate weekStart = calendar.resetToToday();
        current = generator.generate(weekStart);
        return current;
    }

    public synchronized WorkingWeek swap(String day1, String shift1, String day2, String shift2) {
        WorkingWeek week = currentWeek();
        editor.swap(week, day1, shift1, day2, shift2);
        return week;
    }

    public synchronized WorkingWeek overrideAssign(String worker, String day, String shift) {
        WorkingWeek week = currentWeek();
        editor.overrideAssign(week, worker, day, shift);
        return week;
    }

    /**
     * Publishes the in-progress week. Afterwards the week under view is the archived copy.
     */
    public synchronized WorkingWeek publish() {
        WorkingWeek week = currentWeek();
        publisher.publish(week.getWeekStart(), week.getSchedule());
        current = generator.generate(week.getWeekStart());
        return current;
    }

    public synchronized Map<String, Integer> saturdayStreaks(boolean includeCurrent) {
        WorkingWeek week = currentWeek();
        return streakTracker.saturdayStreaks(week.getWeekStart(), week.getSchedule(), includeCurrent);
    }

    public List<String> publishedWeeks() {
        return publisher.publishedWeeks();
    }

    public Optional<WeekSchedule> publishedWeek(LocalDate weekStart) {
        return publisher.find(weekStart);
    }

    public int getWeekOffset() {
        return calendar.getWeekOffset();
    }
}
