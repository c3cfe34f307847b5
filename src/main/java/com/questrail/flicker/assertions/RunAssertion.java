package com.questrail.flicker.assertions;

import com.questrail.flicker.FlickerRunResult;

/**
 * Predicate over the traces of a single run. See {@link TraceAssertion}.
 */
@FunctionalInterface
public interface RunAssertion
{
    void check(FlickerRunResult run);
}
