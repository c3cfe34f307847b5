package com.questrail.flicker.assertions;

import java.util.Objects;

/**
 * A named, declarative assertion over the captured traces.
 *
 * <p>Flaky assertions are known to be unreliable. They are excluded from the
 * default assertion pass and only evaluated when flaky assertions are
 * explicitly requested.</p>
 */
public record AssertionData(
    String name,
    AssertionScope scope,
    TraceAssertion assertion,
    boolean flaky
) {
    public AssertionData {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(scope, "scope");
        Objects.requireNonNull(assertion, "assertion");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
    }

    /**
     * Assertion evaluated against every run separately.
     */
    public static AssertionData perRun(String name, RunAssertion assertion) {
        Objects.requireNonNull(assertion, "assertion");
        return new AssertionData(name, AssertionScope.PER_RUN, runs -> assertion.check(runs.get(0)), false);
    }

    /**
     * Assertion evaluated once against all runs.
     */
    public static AssertionData acrossRuns(String name, TraceAssertion assertion) {
        return new AssertionData(name, AssertionScope.WHOLE_RESULT, assertion, false);
    }

    public AssertionData asFlaky() {
        return new AssertionData(name, scope, assertion, true);
    }

    @Override
    public String toString() {
        return name + (flaky ? " (flaky)" : "");
    }
}
