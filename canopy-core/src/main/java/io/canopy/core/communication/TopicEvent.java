package io.canopy.core.communication;

import java.time.Instant;

/// A message published on a topic.
///
/// @param topic topic name, not null
/// @param data payload, shared by reference, may be null
/// @param source publisher name, not null
/// @param timestamp publication time, not null
public record TopicEvent(String topic, Object data, String source, Instant timestamp) {}
