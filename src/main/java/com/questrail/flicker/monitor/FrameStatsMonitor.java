package com.questrail.flicker.monitor;

/**
 * Optional monitor that counts janky frames while the transition runs.
 *
 * <p>Started after the trace monitors and stopped before them, so that the
 * count only covers the transition window.</p>
 */
public interface FrameStatsMonitor
{
    void start();

    void stop();

    /**
     * Number of janky frames observed between the last {@link #start()} and
     * {@link #stop()}.
     */
    int jankyFrameCount();
}
