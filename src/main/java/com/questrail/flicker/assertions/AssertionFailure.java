package com.questrail.flicker.assertions;

import java.util.List;
import java.util.Objects;

/**
 * A rejection reported by one assertion.
 *
 * @param assertionName name of the rejecting assertion
 * @param detail        what the predicate reported
 * @param iterations    runs the rejection applies to; these keep their artifacts on clean-up
 */
public record AssertionFailure(
    String assertionName,
    String detail,
    List<Integer> iterations
) {
    public AssertionFailure {
        Objects.requireNonNull(assertionName, "assertionName");
        Objects.requireNonNull(detail, "detail");
        iterations = List.copyOf(iterations);
    }

    /**
     * Human-readable description, e.g. {@code "navBarVisible failed on run 2: ..."}.
     */
    public String message() {
        String where;
        if (iterations.size() == 1) {
            where = " failed on run " + iterations.get(0);
        } else if (iterations.isEmpty()) {
            where = " failed";
        } else {
            where = " failed across runs " + iterations;
        }
        return assertionName + where + ": " + detail;
    }

    @Override
    public String toString() {
        return message();
    }
}
