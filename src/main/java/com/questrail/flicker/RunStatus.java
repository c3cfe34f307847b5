package com.questrail.flicker;

/**
 * Outcome of one repetition.
 */
public enum RunStatus
{
    /** Every phase of the run completed. */
    SUCCESS,
    /** A setup, transition or teardown command raised. */
    TRANSITION_ERROR,
    /** The harness could not drive a monitor. */
    CRASH
}
