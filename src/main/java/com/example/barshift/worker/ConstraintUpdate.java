package com.example.barshift.worker;

import java.util.List;

/**
 * One change extracted from a line of free-text constraints.
 */
public interface ConstraintUpdate {

    WorkerConstraint applyTo(WorkerConstraint current);

    record RestrictDay(String day) implements ConstraintUpdate {
        @Override
        public WorkerConstraint applyTo(WorkerConstraint current) {
            return current.withRestrictedDay(day);
        }
    }

    record RestrictShift(String shift) implements ConstraintUpdate {
        @Override
        public WorkerConstraint applyTo(WorkerConstraint current) {
            return current.withRestrictedShift(shift);
        }
    }

    record AllowShifts(List<String> shifts) implements ConstraintUpdate {
        public AllowShifts {
            shifts = List.copyOf(shifts);
        }

        @Override
        public WorkerConstraint applyTo(WorkerConstraint current) {
            return current.withAllowedShifts(shifts);
        }
    }

    record MaxShifts(int maxShifts) implements ConstraintUpdate {
        @Override
        public WorkerConstraint applyTo(WorkerConstraint current) {
            return current.withMaxShifts(maxShifts);
        }
    }
}
