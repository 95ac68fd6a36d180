package com.insightops.dashboard.webhook;

import lombok.Value;

import java.time.Duration;

/**
 * Outcome of {@link DuplicateEventFilter#checkAndMark}.
 */
@Value
public class DedupeResult {

    private static final DedupeResult FIRST_SIGHTING = new DedupeResult(false, null);

    boolean duplicate;

    /** Time since the event was first seen; {@code null} unless {@link #isDuplicate()}. */
    Duration timeSinceFirstSeen;

    public static DedupeResult firstSighting() {
        return FIRST_SIGHTING;
    }

    public static DedupeResult duplicateOf(Duration timeSinceFirstSeen) {
        return new DedupeResult(true, timeSinceFirstSeen);
    }
}
