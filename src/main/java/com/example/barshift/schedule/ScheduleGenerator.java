package com.example.barshift.schedule;

import com.example.barshift.archive.PublishedWeekRepository;
import com.example.barshift.config.SchedulingSettings;
import com.example.barshift.config.ShiftCatalogService;
import com.example.barshift.config.ShiftDefinition;
import com.example.barshift.worker.WorkerConstraint;
import com.example.barshift.worker.WorkerConstraintService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Fills one week slot by slot with a randomly chosen eligible worker.
 * <p>
 * Days are processed Sunday to Saturday so the rest check can compare against the worker's
 * previous slot; the shifts of each day are processed in a fresh random order. A week that is
 * already archived is returned as archived.
 */
@Component
public class ScheduleGenerator {

    private static final Logger logger = LoggerFactory.getLogger(ScheduleGenerator.class);

    static final String NO_ELIGIBLE_WORKER = "No eligible worker available";

    private final ShiftCatalogService catalog;
    private final WorkerConstraintService workers;
    private final SaturdayStreakTracker streakTracker;
    private final PublishedWeekRepository archive;
    private final RandomSource random;
    private final SchedulingSettings settings;

    public ScheduleGenerator(ShiftCatalogService catalog,
                             WorkerConstraintService workers,
                             SaturdayStreakTracker streakTracker,
                             PublishedWeekRepository archive,
                             RandomSource random,
                             SchedulingSettings settings) {
        this.catalog = catalog;
        this.workers = workers;
        this.streakTracker = streakTracker;
        this.archive = archive;
        this.random = random;
        this.settings = settings;
    }

    public WorkingWeek generate(LocalDate weekStart) {
        Optional<WeekSchedule> archived = archive.find(weekStart);
        if (archived.isPresent()) {
            logger.info("Week {} is published, using the archived schedule", weekStart);
            return WorkingWeek.restored(archived.get());
        }

        List<ShiftDefinition> shifts = catalog.activeShifts();
        Map<String, WorkerConstraint> roster = workers.list();
        Map<String, Integer> streaks = streakTracker.saturdayStreaks(weekStart, null, false);
        WorkingWeek week = WorkingWeek.fresh(weekStart, roster.keySet());
        Map<String, LastSlot> lastSlots = new HashMap<>();

        for (ScheduleDay day : WeekCalendar.days(weekStart)) {
            // rows keep catalog order whatever order the shifts are filled in
            shifts.forEach(shift -> week.getSchedule().put(day.label(), shift.label(), WeekSchedule.UNASSIGNED));

            for (ShiftDefinition shift : shuffled(shifts)) {
                List<String> eligible = roster.entrySet().stream()
                        .filter(e -> isEligible(day, shift, e.getValue(), week.loadOf(e.getKey()), lastSlots.get(e.getKey())))
                        .map(Map.Entry::getKey)
                        .toList();
                if (WeekCalendar.isSaturday(day)) {
                    List<String> rested = eligible.stream()
                            .filter(name -> streaks.getOrDefault(name, 0) < settings.getSaturdayStreakLimit())
                            .toList();
                    if (!rested.isEmpty()) {
                        eligible = rested;
                    }
                }

                if (eligible.isEmpty()) {
                    week.leaveOpen(day.label(), shift.label(), NO_ELIGIBLE_WORKER);
                    continue;
                }
                String chosen = eligible.get(random.pick(eligible.size()));
                week.assign(day.label(), shift.label(), chosen);
                lastSlots.put(chosen, new LastSlot(day.index(), shift.endHour()));
            }
        }

        logger.info("Generated week {}: {} slots, {} unassigned", weekStart,
                week.getSchedule().slotCount(), week.getSchedule().unassignedCount());
        return week;
    }

    private boolean isEligible(ScheduleDay day, ShiftDefinition shift, WorkerConstraint constraint,
                               int load, LastSlot last) {
        if (!constraint.worksOn(day.name()) || !constraint.accepts(shift.label())) {
            return false;
        }
        if (load >= constraint.maxShifts()) {
            return false;
        }
        return last == null || last.restHoursBefore(day.index(), shift.startHour()) >= settings.getMinRestHours();
    }

    private List<ShiftDefinition> shuffled(List<ShiftDefinition> shifts) {
        List<ShiftDefinition> order = new ArrayList<>(shifts);
        for (int i = order.size() - 1; i > 0; i--) {
            int j = random.pick(i + 1);
            ShiftDefinition tmp = order.get(i);
            order.set(i, order.get(j));
            order.set(j, tmp);
        }
        return order;
    }

    /** The most recent slot given to a worker during this run. */
    private record LastSlot(int dayIndex, int endHour) {
        int restHoursBefore(int nextDayIndex, int nextStartHour) {
            return (nextDayIndex - dayIndex) * 24 + (nextStartHour - endHour);
        }
    }
}
