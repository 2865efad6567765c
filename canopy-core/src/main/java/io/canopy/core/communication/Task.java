package io.canopy.core.communication;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/// A unit of work published on the {@link TaskBoard}.
///
/// Identity, requirements and priority are fixed at publication. Status and claimant
/// change only through the board, which serializes every transition.
public final class Task {

    private final String id;
    private final String title;
    private final String description;
    private final Set<String> requirements;
    private final int priority;
    private final Instant createdAt;
    private final Map<String, Object> data;

    private volatile TaskStatus status = TaskStatus.PENDING;
    private volatile String claimedBy;

    Task(
            String id,
            String title,
            String description,
            Set<String> requirements,
            int priority,
            Map<String, Object> data) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.title = Objects.requireNonNull(title, "title must not be null");
        this.description = Objects.requireNonNull(description, "description must not be null");
        this.requirements = Set.copyOf(requirements);
        this.priority = priority;
        this.createdAt = Instant.now();
        this.data = new ConcurrentHashMap<>(data);
    }

    public String getId() {
        return id;
    }

    public String getTitle() {
        return title;
    }

    public String getDescription() {
        return description;
    }

    /// Returns the capabilities a claimant must have.
    public Set<String> getRequirements() {
        return requirements;
    }

    public int getPriority() {
        return priority;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    /// Returns the task's payload.
    ///
    /// Holds the publisher's data plus `result` after completion or `error` after failure.
    ///
    /// @return unmodifiable snapshot, never null
    public Map<String, Object> getData() {
        return Map.copyOf(data);
    }

    public TaskStatus getStatus() {
        return status;
    }

    /// Returns the claimant, or null while the task is unclaimed.
    public String getClaimedBy() {
        return claimedBy;
    }

    /// Returns whether a claimant with the given capabilities may take this task.
    ///
    /// @param capabilities claimant capabilities, not null
    /// @return `true` if the task is pending and every requirement is covered
    public boolean isClaimableWith(Set<String> capabilities) {
        return status == TaskStatus.PENDING && capabilities.containsAll(requirements);
    }

    void markClaimed(String claimant) {
        claimedBy = claimant;
        status = TaskStatus.CLAIMED;
    }

    void markCompleted(Object result) {
        if (result != null) {
            data.put("result", result);
        }
        status = TaskStatus.COMPLETED;
    }

    void markFailed(String error) {
        data.put("error", error == null ? "" : error);
        status = TaskStatus.FAILED;
    }

    @Override
    public String toString() {
        return "Task(" + id + ", " + title + ", " + status + ")";
    }
}
