package io.canopy.core.communication;

/// Lifecycle of a task on the task board.
///
/// Tasks move forward only: PENDING to CLAIMED to COMPLETED, or to FAILED from
/// PENDING or CLAIMED.
public enum TaskStatus {
    PENDING,
    CLAIMED,
    COMPLETED,
    FAILED;

    /// Returns whether the task can no longer change.
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
