package com.example.barshift.exception;

import java.util.List;

/**
 * Publishing would give one or more workers a Saturday streak at or above the limit.
 * The archive is left untouched.
 */
public class PublishBlockedException extends RuntimeException {

    private final String constraintType;
    private final int streakLimit;
    private final List<String> violators;

    public PublishBlockedException(int streakLimit, List<String> violators) {
        super("Publishing would give " + String.join(", ", violators)
                + " " + streakLimit + " or more consecutive Saturdays");
        this.constraintType = "SATURDAY_STREAK";
        this.streakLimit = streakLimit;
        this.violators = List.copyOf(violators);
    }

    public String getConstraintType() {
        return constraintType;
    }

    public int getStreakLimit() {
        return streakLimit;
    }

    public List<String> getViolators() {
        return violators;
    }
}
