package com.questrail.flicker.assertions;

import com.questrail.flicker.FlickerRunResult;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * AssertionEngine
 * -----------------------------------------------------------------------------
 * Evaluates assertions against captured runs.
 *
 * <h2>Semantics</h2>
 * <ul>
 *   <li>{@link AssertionScope#PER_RUN} assertions are checked once per run and
 *       produce at most one failure per run</li>
 *   <li>{@link AssertionScope#WHOLE_RESULT} assertions are checked once with all
 *       runs and produce at most one failure, implicating every run</li>
 *   <li>{@link AssertionError} and unchecked exceptions raised by a predicate
 *       are reported as failures; nothing is short-circuited</li>
 * </ul>
 *
 * The engine keeps no state. Evaluation order does not matter.
 */
public final class AssertionEngine
{
    private static final String NO_DETAIL = "assertion rejected the trace without a message";

    private AssertionEngine() {
    }

    /**
     * Evaluates one assertion.
     *
     * @return failures, empty when the assertion holds
     */
    public static List<AssertionFailure> evaluate(AssertionData assertion, List<FlickerRunResult> runs) {
        Objects.requireNonNull(assertion, "assertion");
        Objects.requireNonNull(runs, "runs");

        List<AssertionFailure> failures = new ArrayList<>();
        if (assertion.scope() == AssertionScope.PER_RUN) {
            for (FlickerRunResult run : runs) {
                String rejection = check(assertion, List.of(run));
                if (rejection != null) {
                    failures.add(new AssertionFailure(assertion.name(), rejection, List.of(run.iteration())));
                }
            }
        } else {
            String rejection = check(assertion, List.copyOf(runs));
            if (rejection != null) {
                List<Integer> iterations = new ArrayList<>(runs.size());
                for (FlickerRunResult run : runs) {
                    iterations.add(run.iteration());
                }
                failures.add(new AssertionFailure(assertion.name(), rejection, iterations));
            }
        }
        return failures;
    }

    /**
     * Evaluates every assertion, flaky ones only or non-flaky ones only.
     */
    public static List<AssertionFailure> evaluateAll(
        List<AssertionData> assertions,
        List<FlickerRunResult> runs,
        boolean onlyFlaky
    ) {
        Objects.requireNonNull(assertions, "assertions");
        List<AssertionFailure> failures = new ArrayList<>();
        for (AssertionData assertion : assertions) {
            if (assertion.flaky() == onlyFlaky) {
                failures.addAll(evaluate(assertion, runs));
            }
        }
        return List.copyOf(failures);
    }

    /**
     * @return the rejection detail, or {@code null} if the assertion holds
     */
    private static String check(AssertionData assertion, List<FlickerRunResult> runs) {
        try {
            assertion.assertion().check(runs);
            return null;
        } catch (AssertionError e) {
            return e.getMessage() == null || e.getMessage().isBlank() ? NO_DETAIL : e.getMessage();
        } catch (RuntimeException e) {
            String message = e.getMessage() == null ? "" : ": " + e.getMessage();
            return "evaluation raised " + e.getClass().getSimpleName() + message;
        }
    }
}
