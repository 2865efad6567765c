package io.canopy.core.communication;

import io.canopy.core.exception.TaskNotFoundException;
import java.util.ArrayDeque;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Shared board on which trees publish work and claim it by capability.
///
/// ### Contracts
/// - **Invariant**: a task is claimed by at most one claimant; concurrent claims are
///   serialized and the first valid one wins
/// - **Invariant**: status only moves forward, see {@link TaskStatus}
/// - **Postcondition**: ids are `task_1`, `task_2`, ... in publication order
/// - **Postcondition**: at most `terminalLimit` completed or failed tasks are retained;
///   the oldest to finish is dropped first, open tasks are never dropped
///
/// @implNote Thread-safe. Transitions run under one lock; listeners are notified after
/// it is released.
public class TaskBoard {

    private static final Logger logger = Logger.getLogger(TaskBoard.class.getName());

    public static final int DEFAULT_TERMINAL_LIMIT = 1000;

    private final Map<String, Task> tasks = new ConcurrentHashMap<>();
    private final Deque<String> terminalIds = new ArrayDeque<>();
    private final int terminalLimit;
    private final AtomicLong counter = new AtomicLong();
    private final ReentrantLock transitionLock = new ReentrantLock();
    private final List<TaskBoardListener> listeners = new CopyOnWriteArrayList<>();

    public TaskBoard() {
        this(DEFAULT_TERMINAL_LIMIT);
    }

    /// Creates a board retaining a bounded number of finished tasks.
    ///
    /// @param terminalLimit completed and failed tasks kept for lookup, positive
    public TaskBoard(int terminalLimit) {
        if (terminalLimit <= 0) {
            throw new IllegalArgumentException("terminalLimit must be positive, got " + terminalLimit);
        }
        this.terminalLimit = terminalLimit;
    }

    /// Publishes a task.
    ///
    /// @param title short title, not null
    /// @param description free text, not null
    /// @param requirements capabilities a claimant must have, not null
    /// @param priority higher values are offered first
    /// @param data payload, copied into the task, not null
    /// @return the new task id, never null
    public String publishTask(
            String title,
            String description,
            Set<String> requirements,
            int priority,
            Map<String, Object> data) {
        String id = "task_" + counter.incrementAndGet();
        Task task = new Task(id, title, description, requirements, priority, data);
        tasks.put(id, task);
        logger.fine("Published " + task + " requiring " + requirements);
        notifyListeners(l -> l.onTaskPublished(task));
        return id;
    }

    /// Claims a pending task.
    ///
    /// @param taskId task id, not null
    /// @param claimant claimant name, not null
    /// @param capabilities claimant capabilities, not null
    /// @return `true` if the claim succeeded, `false` if the task is not pending or a
    ///         requirement is missing
    /// @throws TaskNotFoundException if no task has that id
    public boolean claimTask(String taskId, String claimant, Set<String> capabilities)
            throws TaskNotFoundException {
        Objects.requireNonNull(claimant, "claimant must not be null");
        Objects.requireNonNull(capabilities, "capabilities must not be null");
        Task task = getTaskOrThrow(taskId);
        transitionLock.lock();
        try {
            if (!task.isClaimableWith(capabilities)) {
                return false;
            }
            task.markClaimed(claimant);
        } finally {
            transitionLock.unlock();
        }
        logger.fine(claimant + " claimed " + task);
        notifyListeners(l -> l.onTaskClaimed(task));
        return true;
    }

    /// Completes a claimed task, storing the result under `result` in its data.
    ///
    /// @param taskId task id, not null
    /// @param result task result, may be null
    /// @return `true` if the task was claimed and is now completed
    /// @throws TaskNotFoundException if no task has that id
    public boolean completeTask(String taskId, Object result) throws TaskNotFoundException {
        Task task = getTaskOrThrow(taskId);
        transitionLock.lock();
        try {
            if (task.getStatus() != TaskStatus.CLAIMED) {
                return false;
            }
            task.markCompleted(result);
            retire(task);
        } finally {
            transitionLock.unlock();
        }
        notifyListeners(l -> l.onTaskCompleted(task));
        return true;
    }

    /// Fails a pending or claimed task, storing the message under `error` in its data.
    ///
    /// @param taskId task id, not null
    /// @param error failure description, may be null
    /// @return `true` if the task was open and is now failed
    /// @throws TaskNotFoundException if no task has that id
    public boolean failTask(String taskId, String error) throws TaskNotFoundException {
        Task task = getTaskOrThrow(taskId);
        transitionLock.lock();
        try {
            if (task.getStatus().isTerminal()) {
                return false;
            }
            task.markFailed(error);
            retire(task);
        } finally {
            transitionLock.unlock();
        }
        notifyListeners(l -> l.onTaskFailed(task));
        return true;
    }

    /// Returns pending tasks the capabilities can claim, highest priority first.
    ///
    /// Tasks of equal priority keep publication order.
    ///
    /// @param capabilities claimant capabilities, not null
    /// @return matching tasks, never null
    public List<Task> getAvailableTasks(Set<String> capabilities) {
        return tasks.values().stream()
                .filter(t -> t.isClaimableWith(capabilities))
                .sorted(Comparator.comparingInt(Task::getPriority)
                        .reversed()
                        .thenComparingLong(TaskBoard::sequenceOf))
                .toList();
    }

    /// Returns the tasks currently claimed by a claimant.
    public List<Task> getClaimedTasks(String claimant) {
        return tasks.values().stream()
                .filter(t -> t.getStatus() == TaskStatus.CLAIMED && claimant.equals(t.getClaimedBy()))
                .sorted(Comparator.comparingLong(TaskBoard::sequenceOf))
                .toList();
    }

    public Optional<Task> getTask(String taskId) {
        return Optional.ofNullable(tasks.get(taskId));
    }

    /// Returns a task by id.
    ///
    /// @throws TaskNotFoundException if no task has that id
    public Task getTaskOrThrow(String taskId) throws TaskNotFoundException {
        Task task = tasks.get(Objects.requireNonNull(taskId, "taskId must not be null"));
        if (task == null) {
            throw new TaskNotFoundException("Task not found: " + taskId);
        }
        return task;
    }

    public List<Task> getAllTasks() {
        return tasks.values().stream().sorted(Comparator.comparingLong(TaskBoard::sequenceOf)).toList();
    }

    public TaskStats getStats() {
        int pending = 0;
        int claimed = 0;
        int completed = 0;
        int failed = 0;
        for (Task task : tasks.values()) {
            switch (task.getStatus()) {
                case PENDING -> pending++;
                case CLAIMED -> claimed++;
                case COMPLETED -> completed++;
                case FAILED -> failed++;
            }
        }
        return new TaskStats(pending + claimed + completed + failed, pending, claimed, completed, failed);
    }

    public void addListener(TaskBoardListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener must not be null"));
    }

    public boolean removeListener(TaskBoardListener listener) {
        return listeners.remove(listener);
    }

    /// Removes every task. Ids keep increasing.
    public void clear() {
        transitionLock.lock();
        try {
            tasks.clear();
            terminalIds.clear();
        } finally {
            transitionLock.unlock();
        }
    }

    public int getTerminalLimit() {
        return terminalLimit;
    }

    // caller holds transitionLock
    private void retire(Task task) {
        terminalIds.addLast(task.getId());
        while (terminalIds.size() > terminalLimit) {
            String evicted = terminalIds.pollFirst();
            tasks.remove(evicted);
            logger.fine("Evicted finished task " + evicted);
        }
    }

    private void notifyListeners(Consumer<TaskBoardListener> callback) {
        for (TaskBoardListener listener : listeners) {
            try {
                callback.accept(listener);
            } catch (RuntimeException e) {
                logger.log(Level.WARNING, "Task board listener failed", e);
            }
        }
    }

    private static long sequenceOf(Task task) {
        return Long.parseLong(task.getId().substring("task_".length()));
    }
}
