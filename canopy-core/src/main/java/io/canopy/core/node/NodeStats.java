package io.canopy.core.node;

import java.time.Instant;

/// Point-in-time view of a node's bookkeeping.
///
/// @param name node name, not null
/// @param type node type name as reported by {@link Node#getTypeName()}, not null
/// @param kind structural kind, not null
/// @param status status after the most recent tick, not null
/// @param childCount number of direct children
/// @param depth distance from the root, `0` for the root
/// @param tickCount ticks performed since construction
/// @param faultCount ticks that ended in a caught exception
/// @param lastTickTime wall-clock time of the most recent tick, null if never ticked since reset
public record NodeStats(
        String name,
        String type,
        NodeKind kind,
        Status status,
        int childCount,
        int depth,
        long tickCount,
        long faultCount,
        Instant lastTickTime) {}
