package io.canopy.core.engine;

import io.canopy.core.node.Status;
import java.time.Duration;
import java.time.Instant;

/// Snapshot of a tick manager's counters.
///
/// @param running whether the tick loop is active
/// @param tickRate configured ticks per second
/// @param tickCount ticks performed since the last stats reset
/// @param lastStatus status of the latest tick, {@link Status#FAILURE} before the first
/// @param lastTickTime time of the latest tick, null if none
/// @param averageTickDuration mean time spent inside a tick, never null
/// @param uptime time since the loop started, {@link Duration#ZERO} when idle
/// @param failedTicks ticks whose loop iteration raised an error
public record TickStats(
        boolean running,
        double tickRate,
        long tickCount,
        Status lastStatus,
        Instant lastTickTime,
        Duration averageTickDuration,
        Duration uptime,
        long failedTicks) {}
