package io.canopy.core.communication;

import java.time.Instant;

/// Data crossing the forest boundary on a named channel.
///
/// @param channel channel name, not null
/// @param data payload, may be null
/// @param source {@link #EXTERNAL} for input, {@link #INTERNAL} for output
/// @param timestamp time the entry was queued, not null
public record ChannelEntry(String channel, Object data, String source, Instant timestamp) {

    public static final String EXTERNAL = "external";
    public static final String INTERNAL = "internal";
}
