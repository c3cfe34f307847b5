package com.questrail.flicker.time;

import java.time.Instant;

/**
 * WallClock
 * =============================================================================
 * Wall-clock source used for run timestamps and observability events.
 *
 * <p>
 * Nothing in the harness schedules or times out against this clock; it only
 * stamps what happened, so that runs and events can be correlated with the
 * device's own logs.
 * </p>
 */
public interface WallClock
{
    /**
     * Returns the current wall-clock time.
     */
    Instant now();
}
