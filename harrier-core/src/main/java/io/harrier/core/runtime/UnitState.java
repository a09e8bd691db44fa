package io.harrier.core.runtime;

/**
 * Lifecycle of a unit inside the scheduler.
 */
public enum UnitState {
    PENDING,
    SCHEDULED,
    RUNNING,
    FINISHED,
    /** never scheduled because the run was cancelled */
    CANCELLED
}
