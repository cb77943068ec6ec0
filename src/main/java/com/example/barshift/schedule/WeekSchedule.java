package com.example.barshift.schedule;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * One week of slots: day row label, then shift label, then the worker holding the slot or
 * {@link #UNASSIGNED}. Row and shift order is insertion order.
 */
public class WeekSchedule {

    public static final String UNASSIGNED = "Unassigned";

    private final LocalDate weekStart;
    private final LinkedHashMap<String, LinkedHashMap<String, String>> rows = new LinkedHashMap<>();

    public WeekSchedule(LocalDate weekStart) {
        this.weekStart = Objects.requireNonNull(weekStart, "weekStart");
    }

    public static WeekSchedule fromRows(LocalDate weekStart, Map<String, ? extends Map<String, String>> rows) {
        WeekSchedule schedule = new WeekSchedule(weekStart);
        if (rows != null) {
            rows.forEach((day, cells) -> {
                LinkedHashMap<String, String> row = schedule.rows.computeIfAbsent(day, k -> new LinkedHashMap<>());
                if (cells != null) {
                    cells.forEach((shift, worker) -> row.put(shift, worker == null ? UNASSIGNED : worker));
                }
            });
        }
        return schedule;
    }

    /** Deep copy of the rows in the persisted layout. */
    public LinkedHashMap<String, LinkedHashMap<String, String>> toRows() {
        LinkedHashMap<String, LinkedHashMap<String, String>> copy = new LinkedHashMap<>();
        rows.forEach((day, cells) -> copy.put(day, new LinkedHashMap<>(cells)));
        return copy;
    }

    public WeekSchedule copy() {
        return fromRows(weekStart, rows);
    }

    public LocalDate getWeekStart() {
        return weekStart;
    }

    public void put(String dayLabel, String shiftLabel, String worker) {
        rows.computeIfAbsent(dayLabel, k -> new LinkedHashMap<>()).put(shiftLabel, worker);
    }

    public Optional<String> get(String dayLabel, String shiftLabel) {
        Map<String, String> row = rows.get(dayLabel);
        return row == null ? Optional.empty() : Optional.ofNullable(row.get(shiftLabel));
    }

    public boolean contains(String dayLabel, String shiftLabel) {
        return get(dayLabel, shiftLabel).isPresent();
    }

    public Set<String> dayLabels() {
        return Collections.unmodifiableSet(rows.keySet());
    }

    public Map<String, String> row(String dayLabel) {
        Map<String, String> row = rows.get(dayLabel);
        return row == null ? Map.of() : Collections.unmodifiableMap(row);
    }

    /**
     * Finds the row for {@code day}, given either its full label or just the weekday name.
     */
    public Optional<String> resolveDayLabel(String day) {
        if (day == null) {
            return Optional.empty();
        }
        if (rows.containsKey(day)) {
            return Optional.of(day);
        }
        Optional<DayOfWeek> wanted = ScheduleDay.dayOfWeekOf(day);
        if (wanted.isEmpty()) {
            return Optional.empty();
        }
        return rows.keySet().stream()
                .filter(label -> ScheduleDay.dayOfWeekOf(label).equals(wanted))
                .findFirst();
    }

    /** Workers holding at least one slot on {@code dayOfWeek}. */
    public Set<String> workersOn(DayOfWeek dayOfWeek) {
        Set<String> workers = new LinkedHashSet<>();
        rows.forEach((label, cells) -> {
            if (ScheduleDay.dayOfWeekOf(label).filter(dayOfWeek::equals).isPresent()) {
                cells.values().stream().filter(WeekSchedule::isAssigned).forEach(workers::add);
            }
        });
        return workers;
    }

    /** Number of slots held per worker, counted from the cells. */
    public Map<String, Integer> countAssignments() {
        Map<String, Integer> counts = new LinkedHashMap<>();
        rows.values().forEach(cells -> cells.values().stream()
                .filter(WeekSchedule::isAssigned)
                .forEach(worker -> counts.merge(worker, 1, Integer::sum)));
        return counts;
    }

    public int slotCount() {
        return rows.values().stream().mapToInt(Map::size).sum();
    }

    public long unassignedCount() {
        return rows.values().stream()
                .flatMap(cells -> cells.values().stream())
                .filter(worker -> !isAssigned(worker))
                .count();
    }

    public static boolean isAssigned(String worker) {
        return worker != null && !UNASSIGNED.equals(worker);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof WeekSchedule)) return false;
        WeekSchedule that = (WeekSchedule) o;
        return weekStart.equals(that.weekStart) && rows.equals(that.rows);
    }

    @Override
    public int hashCode() {
        return Objects.hash(weekStart, rows);
    }

    @Override
    public String toString() {
        return "WeekSchedule{" + weekStart + ", " + rows + '}';
    }
}
