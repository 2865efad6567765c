package io.canopy.core.engine;

import io.canopy.core.blackboard.BlackboardStats;
import io.canopy.core.node.Status;
import java.util.Map;

/// Snapshot of a behavior tree.
///
/// @param name tree name
/// @param nodeCount nodes in the tree, `0` without a root
/// @param nodeTypes node count per type name
/// @param statusDistribution node count per current status
/// @param blackboardSize keys on the tree's blackboard
/// @param tickStats tick manager counters
/// @param blackboardStats blackboard counters
public record TreeStats(
        String name,
        int nodeCount,
        Map<String, Integer> nodeTypes,
        Map<Status, Integer> statusDistribution,
        int blackboardSize,
        TickStats tickStats,
        BlackboardStats blackboardStats) {}
