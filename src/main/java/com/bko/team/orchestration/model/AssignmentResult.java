package com.bko.team.orchestration.model;

import org.springframework.lang.Nullable;

/**
 * Outcome of building an assignment: either a usable {@link TaskAssignment} or an error value.
 * An out-of-range sub-task index is reported here instead of being thrown.
 */
public record AssignmentResult(@Nullable TaskAssignment assignment,
                               @Nullable AssignmentError error,
                               @Nullable String errorMessage) {

    public enum AssignmentError {
        INVALID_INDEX
    }

    public static AssignmentResult valid(TaskAssignment assignment) {
        return new AssignmentResult(assignment, null, null);
    }

    public static AssignmentResult invalidIndex(String message) {
        return new AssignmentResult(null, AssignmentError.INVALID_INDEX, message);
    }

    public boolean isValid() {
        return assignment != null && error == null;
    }
}
