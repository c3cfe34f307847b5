package com.questrail.flicker.runner;

/**
 * Phases of one test cycle, in execution order.
 */
public enum TransitionPhase
{
    /** Output directory preparation, before any command runs. */
    PREPARE,
    /** Commands executed once, before the first repetition. */
    SETUP_TEST,
    /** Commands executed before every repetition. */
    SETUP_RUN,
    MONITOR_START,
    TRANSITION,
    /** Tag snapshots, taken while the transition runs. */
    MONITOR_SNAPSHOT,
    MONITOR_STOP,
    /** Commands executed after every repetition. */
    TEARDOWN_RUN,
    /** Commands executed once, after the last repetition. */
    TEARDOWN_TEST;

    /**
     * Whether a failure in this phase means the harness could not drive its
     * monitors, rather than a command failing.
     */
    public boolean isMonitorPhase() {
        return this == MONITOR_START || this == MONITOR_SNAPSHOT || this == MONITOR_STOP;
    }
}
