package io.shotmatrix.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Phases a job walks through inside the executor.
 */
public enum JobState {
    PENDING,
    PROVISIONING,
    EXECUTING,
    VALIDATING,
    SUCCEEDED,
    FAILED,
    CANCELLED;

    public boolean terminal() {
        return this == SUCCEEDED || this == FAILED || this == CANCELLED;
    }

    public boolean canTransitionTo(JobState next) {
        if (terminal() || next == null) {
            return false;
        }
        if (next == FAILED || next == CANCELLED) {
            return true;
        }
        return allowedNext().contains(next);
    }

    public JobStatus toStatus() {
        return switch (this) {
            case PENDING -> JobStatus.PENDING;
            case PROVISIONING, EXECUTING, VALIDATING -> JobStatus.RUNNING;
            case SUCCEEDED -> JobStatus.SUCCESS;
            case FAILED -> JobStatus.FAILED;
            case CANCELLED -> JobStatus.CANCELLED;
        };
    }

    private Set<JobState> allowedNext() {
        return switch (this) {
            case PENDING -> EnumSet.of(PROVISIONING);
            case PROVISIONING -> EnumSet.of(EXECUTING);
            case EXECUTING -> EnumSet.of(VALIDATING);
            case VALIDATING -> EnumSet.of(SUCCEEDED);
            default -> EnumSet.noneOf(JobState.class);
        };
    }
}
