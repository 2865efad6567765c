package io.canopy.core.communication;

/// Task counts per status.
public record TaskStats(int total, int pending, int claimed, int completed, int failed) {}
