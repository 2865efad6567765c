package io.canopy.core.blackboard;

import java.time.Duration;

/// Snapshot of blackboard usage counters.
///
/// @param readOperations reads served, cached or not
/// @param writeOperations writes, removals and clears
/// @param cacheHits reads answered from the cache
/// @param cacheMisses reads that went to the store
/// @param cacheHitRate hits divided by cache lookups, `0.0` before the first lookup
/// @param averageLockWait mean time spent waiting for the lock, never null
/// @param size number of keys currently stored
/// @param cacheSize number of entries currently cached
public record BlackboardStats(
        long readOperations,
        long writeOperations,
        long cacheHits,
        long cacheMisses,
        double cacheHitRate,
        Duration averageLockWait,
        int size,
        int cacheSize) {

    /// Returns reads plus writes.
    public long totalOperations() {
        return readOperations + writeOperations;
    }
}
