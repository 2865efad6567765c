package io.canopy.core.forest;

import io.canopy.core.node.Status;
import java.util.List;
import java.util.Map;

/// Snapshot of a forest.
///
/// @param name forest name
/// @param running whether the forest has been started
/// @param nodeCount number of forest nodes
/// @param nodeTypes node count per type
/// @param nodeStatuses latest status per node name
/// @param middleware names of the attached middleware in order
/// @param forestTicks forest ticks performed
/// @param blackboardSize keys on the forest blackboard
public record ForestStats(
        String name,
        boolean running,
        int nodeCount,
        Map<ForestNodeType, Integer> nodeTypes,
        Map<String, Status> nodeStatuses,
        List<String> middleware,
        long forestTicks,
        int blackboardSize) {}
