package io.canopy.core.communication;

import java.time.Instant;

/// A change of a watched state value.
///
/// @param key state key, not null
/// @param oldValue value before the update, null if the key was new
/// @param newValue value after the update, not null
/// @param source name of the updater, not null
/// @param timestamp update time, not null
public record StateChange(
        String key, Object oldValue, Object newValue, String source, Instant timestamp) {}
