package com.example.barshift.config;

import com.example.barshift.exception.BusinessException;

/**
 * A weekly shift such as {@code 18-2}. Hours are whole hours of the day; a shift whose end is
 * before its start runs past midnight and its {@code endHour} is shifted by 24.
 */
public record ShiftDefinition(String label, int startHour, int endHour, boolean active) {

    private static final String SEPARATOR = "-";

    /**
     * Parses {@code "start-end"} into an active definition with a canonical label.
     *
     * @throws BusinessException when the label is not two hours separated by a single dash
     */
    public static ShiftDefinition parse(String label) {
        if (label == null) {
            throw invalid(null);
        }
        String[] parts = label.split(SEPARATOR, -1);
        if (parts.length != 2) {
            throw invalid(label);
        }
        int start;
        int end;
        try {
            start = Integer.parseInt(parts[0].trim());
            end = Integer.parseInt(parts[1].trim());
        } catch (NumberFormatException e) {
            throw invalid(label);
        }
        if (start < 0 || start > 24 || end < 0 || end > 24 || start == end) {
            throw invalid(label);
        }
        int normalizedEnd = end < start ? end + 24 : end;
        return new ShiftDefinition(start + SEPARATOR + end, start, normalizedEnd, true);
    }

    public static boolean isValid(String label) {
        try {
            parse(label);
            return true;
        } catch (BusinessException e) {
            return false;
        }
    }

    public ShiftDefinition withActive(boolean active) {
        return new ShiftDefinition(label, startHour, endHour, active);
    }

    public boolean overnight() {
        return endHour > 24;
    }

    private static BusinessException invalid(String label) {
        return new BusinessException(BusinessException.INVALID_SHIFT_LABEL,
                "Shift must look like start-end with whole hours between 0 and 24: " + label, label);
    }
}
