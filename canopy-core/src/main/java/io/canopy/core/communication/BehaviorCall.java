package io.canopy.core.communication;

import java.time.Instant;
import java.util.Map;

/// Record of a completed behavior call.
///
/// @param behavior called behavior name
/// @param params call parameters
/// @param source caller name
/// @param timestamp call start time
/// @param success whether the behavior returned normally
/// @param result returned value, null on failure
/// @param error failure message, null on success
public record BehaviorCall(
        String behavior,
        Map<String, Object> params,
        String source,
        Instant timestamp,
        boolean success,
        Object result,
        String error) {}
