package com.example.barshift.worker;

import com.example.barshift.config.ShiftDefinition;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Per-worker scheduling limits.
 *
 * @param allowedShifts    whitelist of shift labels; empty means every shift is allowed
 * @param restrictedDays   day names (e.g. {@code Monday}) the worker never works
 * @param restrictedShifts shift labels the worker never works
 * @param maxShifts        maximum slots per week, defaults to {@value #DEFAULT_MAX_SHIFTS}
 */
public record WorkerConstraint(List<String> allowedShifts,
                               List<String> restrictedDays,
                               List<String> restrictedShifts,
                               int maxShifts) {

    public static final int DEFAULT_MAX_SHIFTS = 5;

    public WorkerConstraint {
        allowedShifts = normalizeShifts(allowedShifts);
        restrictedDays = normalizeDays(restrictedDays);
        restrictedShifts = normalizeShifts(restrictedShifts);
        if (maxShifts <= 0) {
            maxShifts = DEFAULT_MAX_SHIFTS;
        }
    }

    public static WorkerConstraint defaults() {
        return new WorkerConstraint(List.of(), List.of(), List.of(), DEFAULT_MAX_SHIFTS);
    }

    public boolean worksOn(String dayName) {
        return !restrictedDays.contains(capitalize(dayName));
    }

    public boolean accepts(String shiftLabel) {
        String label = canonicalShift(shiftLabel);
        if (restrictedShifts.contains(label)) {
            return false;
        }
        return allowedShifts.isEmpty() || allowedShifts.contains(label);
    }

    public WorkerConstraint withRestrictedDay(String day) {
        return new WorkerConstraint(allowedShifts, append(restrictedDays, day), restrictedShifts, maxShifts);
    }

    public WorkerConstraint withRestrictedShift(String shift) {
        return new WorkerConstraint(allowedShifts, restrictedDays, append(restrictedShifts, shift), maxShifts);
    }

    public WorkerConstraint withAllowedShifts(List<String> shifts) {
        List<String> allowed = new ArrayList<>(allowedShifts);
        allowed.addAll(shifts);
        return new WorkerConstraint(allowed, restrictedDays, restrictedShifts, maxShifts);
    }

    public WorkerConstraint withMaxShifts(int max) {
        return new WorkerConstraint(allowedShifts, restrictedDays, restrictedShifts, max);
    }

    static String capitalize(String value) {
        String trimmed = value == null ? "" : value.trim();
        if (trimmed.isEmpty()) {
            return trimmed;
        }
        return trimmed.substring(0, 1).toUpperCase(Locale.ROOT) + trimmed.substring(1).toLowerCase(Locale.ROOT);
    }

    static String canonicalShift(String label) {
        if (label == null) {
            return "";
        }
        return ShiftDefinition.isValid(label) ? ShiftDefinition.parse(label).label() : label.trim();
    }

    private static List<String> append(List<String> values, String value) {
        List<String> copy = new ArrayList<>(values);
        copy.add(value);
        return copy;
    }

    private static List<String> normalizeShifts(List<String> labels) {
        Set<String> result = new LinkedHashSet<>();
        if (labels != null) {
            for (String label : labels) {
                String canonical = canonicalShift(label);
                if (!canonical.isEmpty()) {
                    result.add(canonical);
                }
            }
        }
        return List.copyOf(result);
    }

    private static List<String> normalizeDays(List<String> days) {
        Set<String> result = new LinkedHashSet<>();
        if (days != null) {
            for (String day : days) {
                String name = capitalize(day);
                if (!name.isEmpty()) {
                    result.add(name);
                }
            }
        }
        return List.copyOf(result);
    }
}
