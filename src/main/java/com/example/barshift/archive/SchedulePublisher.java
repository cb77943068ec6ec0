package com.example.barshift.archive;

import com.example.barshift.config.SchedulingSettings;
import com.example.barshift.exception.BusinessException;
import com.example.barshift.exception.PublishBlockedException;
import com.example.barshift.schedule.SaturdayStreakTracker;
import com.example.barshift.schedule.WeekCalendar;
import com.example.barshift.schedule.WeekSchedule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Service
public class SchedulePublisher {

    private static final Logger logger = LoggerFactory.getLogger(SchedulePublisher.class);

    private final PublishedWeekRepository archive;
    private final SaturdayStreakTracker streakTracker;
    private final SchedulingSettings settings;

    public SchedulePublisher(PublishedWeekRepository archive,
                             SaturdayStreakTracker streakTracker,
                             SchedulingSettings settings) {
        this.archive = archive;
        this.streakTracker = streakTracker;
        this.settings = settings;
    }

    /**
     * Archives {@code schedule} as the published version of the week starting {@code weekStart}.
     *
     * @throws PublishBlockedException when a worker would reach the Saturday streak limit
     * @throws BusinessException       when the week is already published or the date is not a Sunday
     */
    public void publish(LocalDate weekStart, WeekSchedule schedule) {
        if (!WeekCalendar.weekStart(weekStart).equals(weekStart) || !weekStart.equals(schedule.getWeekStart())) {
            throw new BusinessException(BusinessException.INVALID_WEEK_START,
                    "Week start must be the Sunday of the schedule: " + weekStart, weekStart);
        }
        if (archive.contains(weekStart)) {
            throw new BusinessException(BusinessException.WEEK_ALREADY_PUBLISHED,
                    "Week " + weekStart + " is already published", weekStart);
        }

        Map<String, Integer> streaks = streakTracker.saturdayStreaks(weekStart, schedule, true);
        List<String> violators = streaks.entrySet().stream()
                .filter(e -> e.getValue() >= settings.getPublishStreakLimit())
                .map(Map.Entry::getKey)
                .toList();
        if (!violators.isEmpty()) {
            throw new PublishBlockedException(settings.getPublishStreakLimit(), violators);
        }

        archive.save(schedule.copy());
        logger.info("Published week {}", weekStart);
    }

    public List<String> publishedWeeks() {
        return archive.keys();
    }

    public Optional<WeekSchedule> find(LocalDate weekStart) {
        return archive.find(weekStart);
    }
}
