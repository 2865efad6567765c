package io.canopy.core.forest;

/// Summary of a forest managed by a {@link ForestManager}.
///
/// @param name forest name
/// @param running whether the forest is running
/// @param nodeCount number of forest nodes
/// @param middlewareCount number of attached middleware
/// @param forestTicks forest ticks performed
public record ForestInfo(String name, boolean running, int nodeCount, int middlewareCount, long forestTicks) {}
