package com.questrail.flicker.assertions;

import com.questrail.flicker.FlickerRunResult;

import java.util.List;

/**
 * Predicate over captured trace data.
 *
 * <p>Implementations reject by throwing {@link AssertionError} whose message
 * names the state that violated the expectation and where in the trace it was
 * found. Implementations must not modify the runs or the files they read:
 * evaluating the same assertion twice yields the same outcome.</p>
 */
@FunctionalInterface
public interface TraceAssertion
{
    /**
     * @param runs the runs in scope; a single run for {@link AssertionScope#PER_RUN}
     */
    void check(List<FlickerRunResult> runs);
}
