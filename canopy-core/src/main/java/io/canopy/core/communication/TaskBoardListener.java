package io.canopy.core.communication;

/// Notified of task board transitions.
///
/// Callbacks run on the thread that caused the transition, after it took effect.
/// Exceptions are logged and ignored.
public interface TaskBoardListener {

    default void onTaskPublished(Task task) {}

    default void onTaskClaimed(Task task) {}

    default void onTaskCompleted(Task task) {}

    default void onTaskFailed(Task task) {}
}
