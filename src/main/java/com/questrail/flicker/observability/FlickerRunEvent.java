package com.questrail.flicker.observability;

import com.questrail.flicker.FlickerRunResult;

import java.time.Instant;

/**
 * Record emitted once a repetition has finished, successfully or not.
 */
public record FlickerRunEvent(
    Instant timestamp,
    String testName,
    FlickerRunResult run
) {
}
