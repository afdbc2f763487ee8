package com.syncwatch.domain;

/**
 * Lifecycle of a refresh job: PENDING -> IN_PROGRESS -> one of the terminal states.
 * No transition leaves a terminal state.
 */
public enum RefreshStatus {
    PENDING,
    IN_PROGRESS,
    COMPLETED,
    FAILED,
    CANCELLED,
    TIMED_OUT;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED || this == TIMED_OUT;
    }
}
