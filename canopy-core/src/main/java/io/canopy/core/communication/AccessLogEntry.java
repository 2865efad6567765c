package io.canopy.core.communication;

import java.time.Instant;

/// One access to the shared blackboard.
///
/// @param operation `set`, `get` or `remove`
/// @param key accessed key
/// @param value value written or read, null for removals and misses
/// @param source name of the accessor
/// @param timestamp access time
public record AccessLogEntry(
        String operation, String key, Object value, String source, Instant timestamp) {}
