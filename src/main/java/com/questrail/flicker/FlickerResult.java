package com.questrail.flicker;

import com.questrail.flicker.assertions.AssertionData;
import com.questrail.flicker.assertions.AssertionEngine;
import com.questrail.flicker.assertions.AssertionFailure;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * FlickerResult
 * -----------------------------------------------------------------------------
 * Everything one execution produced: the ordered runs and, if the execution
 * was aborted, the global error.
 *
 * <h2>Immutability</h2>
 * Runs and error never change. Re-executing or cleaning up a {@link Flicker}
 * replaces its result with a new instance. Files on disk outlive the in-memory
 * result until {@link #cleanUp()} deletes them.
 *
 * <h2>Recorded failures</h2>
 * Every failure found by {@link #checkAssertions(List, boolean)} is recorded on
 * the result. Tests sharing one result (copies on a cached runner) therefore
 * all contribute to what {@link #cleanUp()} keeps.
 *
 * <h2>Janky runs</h2>
 * When the producing test excludes janky runs, runs with at least one janky
 * frame are kept in {@link #runs()} but are not handed to assertions. If every
 * run is janky no run is eligible: per-run assertions then report nothing and
 * whole-result assertions receive an empty list.
 */
public final class FlickerResult
{
    private static final FlickerResult EMPTY = new FlickerResult(List.of(), null, false);

    private final List<FlickerRunResult> runs;
    private final Throwable error;
    private final boolean excludeJankyRuns;
    private final Set<AssertionFailure> failures = new LinkedHashSet<>();

    private FlickerResult(List<FlickerRunResult> runs, Throwable error, boolean excludeJankyRuns) {
        this.runs = List.copyOf(Objects.requireNonNull(runs, "runs"));
        this.error = error;
        this.excludeJankyRuns = excludeJankyRuns;
    }

    /**
     * Result of a test that has not been executed.
     */
    public static FlickerResult empty() {
        return EMPTY;
    }

    public static FlickerResult completed(List<FlickerRunResult> runs, boolean excludeJankyRuns) {
        return new FlickerResult(runs, null, excludeJankyRuns);
    }

    public static FlickerResult failed(List<FlickerRunResult> runs, Throwable error, boolean excludeJankyRuns) {
        return new FlickerResult(runs, Objects.requireNonNull(error, "error"), excludeJankyRuns);
    }

    public List<FlickerRunResult> runs() {
        return runs;
    }

    /**
     * Error that aborted the execution, if any.
     */
    public Optional<Throwable> error() {
        return Optional.ofNullable(error);
    }

    /**
     * Whether nothing has been executed yet: no runs and no error.
     */
    public boolean isEmpty() {
        return runs.isEmpty() && error == null;
    }

    /**
     * Whether at least one run was recorded and the execution was not aborted.
     */
    public boolean isExecuted() {
        return !runs.isEmpty() && error == null;
    }

    /**
     * @throws IllegalStateException unless {@link #isExecuted()} holds
     */
    public void checkIsExecuted() {
        if (error != null) {
            throw new IllegalStateException("Transition execution failed: " + error.getMessage(), error);
        }
        if (runs.isEmpty()) {
            throw new IllegalStateException("Transition was not executed");
        }
    }

    /**
     * Runs handed to assertions: successful runs, minus janky ones when those
     * are excluded. May be empty.
     */
    public List<FlickerRunResult> assertableRuns() {
        List<FlickerRunResult> eligible = new ArrayList<>(runs.size());
        for (FlickerRunResult run : runs) {
            if (!run.isSuccessful()) {
                continue;
            }
            if (excludeJankyRuns && run.isJanky()) {
                continue;
            }
            eligible.add(run);
        }
        return eligible;
    }

    /**
     * Evaluates the assertions, collects every failure and records it on this result.
     *
     * @param onlyFlaky {@code true} to evaluate only flaky assertions, {@code false}
     *                  to evaluate only the others
     * @throws IllegalStateException if the transition has not been executed successfully
     */
    public List<AssertionFailure> checkAssertions(List<AssertionData> assertions, boolean onlyFlaky) {
        Objects.requireNonNull(assertions, "assertions");
        checkIsExecuted();
        List<AssertionFailure> found = AssertionEngine.evaluateAll(assertions, assertableRuns(), onlyFlaky);
        synchronized (failures) {
            failures.addAll(found);
        }
        return found;
    }

    /**
     * Failures recorded by every evaluation of this result so far.
     */
    public List<AssertionFailure> failures() {
        synchronized (failures) {
            return List.copyOf(failures);
        }
    }

    /**
     * Deletes the artifacts of every successful run that no recorded failure
     * implicates. Artifacts of implicated and failed runs are kept for inspection.
     */
    public void cleanUp() {
        Set<Integer> retained = new HashSet<>();
        for (AssertionFailure failure : failures()) {
            retained.addAll(failure.iterations());
        }
        for (FlickerRunResult run : runs) {
            if (run.isSuccessful() && !retained.contains(run.iteration())) {
                run.cleanUp();
            }
        }
    }

    @Override
    public String toString() {
        return "FlickerResult(runs=" + runs.size() + (error != null ? ", error=" + error.getMessage() : "") + ")";
    }
}
