package com.questrail.flicker.assertions;

/**
 * Which runs an assertion reads at once.
 */
public enum AssertionScope
{
    /** Evaluated independently against each run; one failure per rejecting run. */
    PER_RUN,
    /** Evaluated once against every run, e.g. to compare repetitions. */
    WHOLE_RESULT
}
