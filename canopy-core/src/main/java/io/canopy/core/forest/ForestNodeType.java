package io.canopy.core.forest;

import java.util.Locale;

/// Role of a tree inside a forest.
public enum ForestNodeType {
    /// Coordinates the other trees.
    MASTER,
    /// Performs specific tasks.
    WORKER,
    /// Observes the system.
    MONITOR,
    /// Distributes tasks.
    COORDINATOR;

    /// Returns the capability every node of this type has by default.
    ///
    /// @return the lower case type name, e.g. `worker`
    public String defaultCapability() {
        return name().toLowerCase(Locale.ROOT);
    }
}
