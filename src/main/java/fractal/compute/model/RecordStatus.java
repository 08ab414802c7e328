package fractal.compute.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle status shared by all records.
 */
public enum RecordStatus {
    /** Record created (or reset), its task can be claimed */
    WAITING,
    /** Claimed by a manager, or a service that has started iterating */
    RUNNING,
    /** Finished successfully */
    COMPLETE,
    /** Finished with an error, may be reset */
    ERROR,
    /** Cancelled by a user */
    CANCELLED,
    /** Complete, but marked as scientifically wrong */
    INVALID,
    /** Soft-deleted */
    DELETED;

    private static final Set<RecordStatus> RESTING = EnumSet.of(COMPLETE, CANCELLED, INVALID, DELETED);

    /** Statuses for which a task exists in the queue */
    public boolean hasTask() {
        return this == WAITING || this == RUNNING;
    }

    /** Resting statuses are never scheduled */
    public boolean isResting() {
        return RESTING.contains(this);
    }

    /** Waiting or running */
    public boolean isPending() {
        return this == WAITING || this == RUNNING;
    }

    /**
     * Check whether a manual or automatic transition from this status is allowed.
     */
    public boolean canTransitionTo(RecordStatus target) {
        return switch (target) {
            case WAITING -> this == ERROR || this == CANCELLED;
            case RUNNING -> this == WAITING;
            case COMPLETE -> this == RUNNING || this == INVALID;
            case ERROR -> this == RUNNING || this == WAITING;
            case CANCELLED -> this == WAITING || this == RUNNING || this == ERROR;
            case INVALID -> this == COMPLETE;
            case DELETED -> this != DELETED;
        };
    }
}
