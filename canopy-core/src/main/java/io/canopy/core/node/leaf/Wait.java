package io.canopy.core.node.leaf;

import io.canopy.core.blackboard.Blackboard;
import io.canopy.core.node.Status;
import io.canopy.core.util.Values;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/// Reports RUNNING until a wall-clock duration has passed since its first tick.
///
/// The wait restarts after it completes or when the node is reset.
public class Wait extends Action {

    public static final String DURATION = "duration";

    private final Duration duration;
    private volatile long startedAt;
    private volatile boolean waiting;

    public Wait(String name, Duration duration) {
        super(name, Set.of(DURATION));
        this.duration = Objects.requireNonNull(duration, "duration must not be null");
    }

    @Override
    protected Status execute(Blackboard blackboard) {
        Duration target = Values.toDuration(resolve(DURATION, duration));
        long now = System.nanoTime();
        if (!waiting) {
            waiting = true;
            startedAt = now;
        }
        if (now - startedAt >= target.toNanos()) {
            waiting = false;
            return Status.SUCCESS;
        }
        return Status.RUNNING;
    }

    /// Returns the time spent in the current wait.
    ///
    /// @return elapsed time, {@link Duration#ZERO} when not waiting
    public Duration getElapsed() {
        return waiting ? Duration.ofNanos(System.nanoTime() - startedAt) : Duration.ZERO;
    }

    public Duration getDuration() {
        return duration;
    }

    @Override
    protected void onReset() {
        waiting = false;
    }

    @Override
    public Map<String, Object> describeAttributes() {
        return Map.of(DURATION, duration.toString());
    }
}
