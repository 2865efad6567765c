package io.canopy.core.node.decorator;

import io.canopy.core.node.Node;
import io.canopy.core.node.Status;
import java.util.Map;

/// Re-runs its child until it has succeeded a fixed number of times.
///
/// Every child success increments a counter and resets the child. The repeater reports
/// RUNNING until the counter reaches the repeat count, then SUCCESS. A child failure
/// clears the counter and fails the repeater. The tick after a completed cycle starts a
/// new one from zero.
///
/// A repeat count of {@link #UNBOUNDED} never completes on success.
public class Repeater extends DecoratorNode {

    /// Repeat count meaning "repeat forever".
    public static final int UNBOUNDED = -1;

    private final int repeatCount;
    private volatile int currentCount;

    /// Creates a repeater.
    ///
    /// @param name node name, not null
    /// @param child wrapped node, may be null
    /// @param repeatCount positive number of successes, or {@link #UNBOUNDED}
    /// @throws IllegalArgumentException if the count is zero or below `-1`
    public Repeater(String name, Node child, int repeatCount) {
        super(name, child);
        if (repeatCount != UNBOUNDED && repeatCount <= 0) {
            throw new IllegalArgumentException(
                    "repeatCount must be positive or " + UNBOUNDED + ", got " + repeatCount);
        }
        this.repeatCount = repeatCount;
    }

    public Repeater(String name, int repeatCount) {
        this(name, null, repeatCount);
    }

    @Override
    protected Status decorate(Node child, Status childStatus) {
        if (repeatCount != UNBOUNDED && currentCount >= repeatCount) {
            currentCount = 0;
        }
        return switch (childStatus) {
            case RUNNING -> Status.RUNNING;
            case FAILURE -> {
                currentCount = 0;
                yield Status.FAILURE;
            }
            case SUCCESS -> {
                currentCount++;
                child.reset();
                yield repeatCount == UNBOUNDED || currentCount < repeatCount
                        ? Status.RUNNING
                        : Status.SUCCESS;
            }
        };
    }

    @Override
    protected void onReset() {
        currentCount = 0;
    }

    public int getRepeatCount() {
        return repeatCount;
    }

    /// Returns the successes counted in the current cycle.
    public int getCurrentCount() {
        return currentCount;
    }

    @Override
    public Map<String, Object> describeAttributes() {
        return Map.of("repeatCount", repeatCount);
    }
}
