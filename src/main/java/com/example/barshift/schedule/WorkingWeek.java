package com.example.barshift.schedule;

import java.time.LocalDate;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The week currently being worked on: its slots, how many slots each worker holds, and why
 * open slots stayed open. Loads are adjusted on every change so that they always match a
 * count of the cells.
 */
public class WorkingWeek {

    private final WeekSchedule schedule;
    private final Map<String, Integer> loads = new LinkedHashMap<>();
    private final Map<String, String> unassignedReasons = new LinkedHashMap<>();
    private final boolean published;

    private WorkingWeek(WeekSchedule schedule, boolean published) {
        this.schedule = schedule;
        this.published = published;
    }

    /** An empty week to be filled in, with a zero load for each known worker. */
    static WorkingWeek fresh(LocalDate weekStart, Collection<String> workers) {
        WorkingWeek week = new WorkingWeek(new WeekSchedule(weekStart), false);
        workers.forEach(worker -> week.loads.put(worker, 0));
        return week;
    }

    /** A copy of an archived week. Its loads are counted from the snapshot. */
    static WorkingWeek restored(WeekSchedule snapshot) {
        WorkingWeek week = new WorkingWeek(snapshot.copy(), true);
        week.loads.putAll(snapshot.countAssignments());
        return week;
    }

    public LocalDate getWeekStart() {
        return schedule.getWeekStart();
    }

    public WeekSchedule getSchedule() {
        return schedule;
    }

    public boolean isPublished() {
        return published;
    }

    public Map<String, Integer> getLoads() {
        return Collections.unmodifiableMap(loads);
    }

    public int loadOf(String worker) {
        return loads.getOrDefault(worker, 0);
    }

    public Map<String, String> getUnassignedReasons() {
        return Collections.unmodifiableMap(unassignedReasons);
    }

    void assign(String dayLabel, String shift, String worker) {
        schedule.put(dayLabel, shift, worker);
        increment(worker);
        unassignedReasons.remove(reasonKey(dayLabel, shift));
    }

    void leaveOpen(String dayLabel, String shift, String reason) {
        schedule.put(dayLabel, shift, WeekSchedule.UNASSIGNED);
        unassignedReasons.put(reasonKey(dayLabel, shift), reason);
    }

    void increment(String worker) {
        if (WeekSchedule.isAssigned(worker)) {
            loads.merge(worker, 1, Integer::sum);
        }
    }

    void decrement(String worker) {
        if (WeekSchedule.isAssigned(worker)) {
            loads.computeIfPresent(worker, (k, v) -> v - 1);
        }
    }

    String reasonFor(String dayLabel, String shift) {
        return unassignedReasons.get(reasonKey(dayLabel, shift));
    }

    void setReason(String dayLabel, String shift, String reason) {
        if (reason == null) {
            unassignedReasons.remove(reasonKey(dayLabel, shift));
        } else {
            unassignedReasons.put(reasonKey(dayLabel, shift), reason);
        }
    }

    /** Reason map key, {@code "<Day> - <shift>"}. */
    static String reasonKey(String dayLabel, String shift) {
        String day = ScheduleDay.dayOfWeekOf(dayLabel).map(ScheduleDay::nameOf).orElse(dayLabel);
        return day + " - " + shift;
    }
}
