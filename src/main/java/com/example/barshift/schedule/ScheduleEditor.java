package com.example.barshift.schedule;

import com.example.barshift.exception.BusinessException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Manual changes to an unpublished week. These are overrides: worker constraints are not
 * checked again, only the load counters are kept in step with the cells.
 */
@Component
public class ScheduleEditor {

    private static final Logger logger = LoggerFactory.getLogger(ScheduleEditor.class);

    static final String CLEARED_MANUALLY = "Cleared by manual override";

    /**
     * Exchanges the occupants of two slots. Applying the same swap twice restores the week.
     */
    public void swap(WorkingWeek week, String day1, String shift1, String day2, String shift2) {
        requireEditable(week);
        String first = resolveDay(week, day1, shift1);
        String second = resolveDay(week, day2, shift2);
        if (first.equals(second) && shift1.equals(shift2)) {
            return;
        }
        WeekSchedule schedule = week.getSchedule();

        String a = schedule.get(first, shift1).orElseThrow();
        String b = schedule.get(second, shift2).orElseThrow();
        String reasonA = week.reasonFor(first, shift1);
        String reasonB = week.reasonFor(second, shift2);

        week.decrement(a);
        week.decrement(b);
        schedule.put(first, shift1, b);
        schedule.put(second, shift2, a);
        week.increment(b);
        week.increment(a);
        week.setReason(first, shift1, reasonB);
        week.setReason(second, shift2, reasonA);

        logger.info("Swapped {} {} ({}) with {} {} ({})", first, shift1, a, second, shift2, b);
    }

    /**
     * Puts {@code worker} into a slot regardless of their constraints. Assigning
     * {@link WeekSchedule#UNASSIGNED} clears the slot.
     */
    public void overrideAssign(WorkingWeek week, String worker, String day, String shift) {
        requireEditable(week);
        if (worker == null || worker.isBlank()) {
            throw new BusinessException(BusinessException.INVALID_WORKER_NAME, "Worker name is required");
        }
        String dayLabel = resolveDay(week, day, shift);
        String outgoing = week.getSchedule().get(dayLabel, shift).orElseThrow();
        String incoming = worker.trim();

        week.decrement(outgoing);
        if (WeekSchedule.isAssigned(incoming)) {
            week.assign(dayLabel, shift, incoming);
        } else {
            week.leaveOpen(dayLabel, shift, CLEARED_MANUALLY);
        }

        logger.info("Override {} {}: {} -> {}", dayLabel, shift, outgoing, incoming);
    }

    private void requireEditable(WorkingWeek week) {
        if (week.isPublished()) {
            throw new BusinessException(BusinessException.WEEK_PUBLISHED,
                    "Week " + week.getWeekStart() + " is published and cannot be edited", week.getWeekStart());
        }
    }

    private String resolveDay(WorkingWeek week, String day, String shift) {
        WeekSchedule schedule = week.getSchedule();
        return schedule.resolveDayLabel(day)
                .filter(label -> schedule.contains(label, shift))
                .orElseThrow(() -> new BusinessException(BusinessException.UNKNOWN_SLOT,
                        "No slot " + day + " / " + shift + " in week " + week.getWeekStart(), day, shift));
    }
}
