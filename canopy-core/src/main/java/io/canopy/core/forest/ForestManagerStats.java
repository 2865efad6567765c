package io.canopy.core.forest;

import java.time.Duration;

/// Snapshot of a {@link ForestManager}.
///
/// @param name manager name
/// @param running whether the manager has been started
/// @param totalForests managed forests
/// @param runningForests forests currently running
/// @param totalNodes forest nodes across all forests
/// @param uptime time since start, zero while stopped
public record ForestManagerStats(
        String name, boolean running, int totalForests, int runningForests, int totalNodes, Duration uptime) {}
