package com.questrail.flicker.observability;

import java.time.Instant;

/**
 * Record representing a failure that aborted (part of) an execution.
 */
public record FlickerErrorEvent(
    Instant timestamp,
    String testName,
    String message,
    Throwable cause
) {
}
