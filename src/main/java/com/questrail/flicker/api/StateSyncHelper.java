package com.questrail.flicker.api;

/**
 * StateSyncHelper
 * -----------------------------------------------------------------------------
 * Blocking synchronization helper invoked by phase commands to wait until the
 * device has settled.
 *
 * <p>Calls block the calling thread. There is no timeout at this layer; a
 * helper that never returns blocks the whole test.</p>
 */
@FunctionalInterface
public interface StateSyncHelper
{
    /**
     * Helper that returns immediately. Used when no helper is configured.
     */
    StateSyncHelper NONE = () -> { };

    /**
     * Blocks until the device reports an idle state.
     */
    void waitForIdle();
}
