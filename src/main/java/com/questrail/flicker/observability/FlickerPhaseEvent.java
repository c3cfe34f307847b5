package com.questrail.flicker.observability;

import com.questrail.flicker.runner.TransitionPhase;

import java.time.Instant;

/**
 * Record emitted when a phase of the test cycle begins.
 *
 * @param iteration repetition index, or {@code -1} for phases outside any repetition
 */
public record FlickerPhaseEvent(
    Instant timestamp,
    String testName,
    int iteration,
    TransitionPhase phase
) {
}
