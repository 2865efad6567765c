package io.canopy.core.event;

import java.time.Instant;

/// Latest occurrence of a named event.
///
/// @param name event name, not null
/// @param source name of the emitter, may be null
/// @param timestamp time of the latest emission, not null
/// @param triggerCount emissions since the event was first seen
/// @param data payload of the latest emission, may be null
public record EventInfo(
        String name, String source, Instant timestamp, long triggerCount, Object data) {}
