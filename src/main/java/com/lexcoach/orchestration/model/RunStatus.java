package com.lexcoach.orchestration.model;

public enum RunStatus {
    PLANNING,
    AWAITING_APPROVAL,
    EXECUTING,
    RESPONDING,
    COMPLETED,
    ABORTED;

    /**
     * Statuses at which the orchestrator stops driving a run and returns to the caller.
     */
    public boolean isStopPoint() {
        return this == AWAITING_APPROVAL || this == COMPLETED || this == ABORTED;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == ABORTED;
    }
}
