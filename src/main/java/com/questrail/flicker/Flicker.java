package com.questrail.flicker;

import com.questrail.flicker.api.DeviceHandle;
import com.questrail.flicker.api.StateSyncHelper;
import com.questrail.flicker.api.TransitionCommand;
import com.questrail.flicker.assertions.AssertionData;
import com.questrail.flicker.assertions.AssertionFailure;
import com.questrail.flicker.monitor.FrameStatsMonitor;
import com.questrail.flicker.monitor.TransitionMonitor;
import com.questrail.flicker.runner.ArtifactNames;
import com.questrail.flicker.runner.TransitionRunner;

import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Flicker
 * -----------------------------------------------------------------------------
 * Runs a UI transition repeatedly while monitors capture traces, then checks
 * assertions against those traces to detect inconsistent behavior.
 *
 * <h2>Configuration</h2>
 * Everything except the result is fixed at construction (see
 * {@link FlickerBuilder}). {@link #copy(AssertionData, String)} produces a new
 * instance that shares the configuration but not the assertions or the result.
 *
 * <h2>Result</h2>
 * The only mutable state is the current {@link FlickerResult}, which is
 * replaced wholesale by {@link #execute()} and {@link #cleanUp()}:
 * <pre>
 *   NOT_EXECUTED → EXECUTING → EXECUTED_OK | EXECUTED_WITH_ERROR
 * </pre>
 * {@link #checkAssertions()} executes lazily and may be repeated any number of
 * times until {@link #cleanUp()} resets the test.
 *
 * <h2>Failures</h2>
 * <ul>
 *   <li>{@link TransitionExecutionException}: the transition itself could not run</li>
 *   <li>{@link AssertionError}: the traces violate one or more assertions</li>
 * </ul>
 *
 * <h2>Threading</h2>
 * An instance must be driven by one caller at a time.
 */
public final class Flicker
{
    private final DeviceHandle device;
    private final Path outputDir;
    private final String testName;
    private final int repetitions;
    private final FrameStatsMonitor frameStatsMonitor;
    private final List<TransitionMonitor> traceMonitors;
    private final List<TransitionCommand> testSetup;
    private final List<TransitionCommand> runSetup;
    private final List<TransitionCommand> testTeardown;
    private final List<TransitionCommand> runTeardown;
    private final List<TransitionCommand> transitions;
    private final List<AssertionData> assertions;
    private final TransitionRunner runner;
    private final StateSyncHelper syncHelper;
    private final boolean excludeJankyRuns;

    private volatile FlickerResult result = FlickerResult.empty();
    private volatile boolean executing;

    Flicker(
        DeviceHandle device,
        Path outputDir,
        String testName,
        int repetitions,
        FrameStatsMonitor frameStatsMonitor,
        List<TransitionMonitor> traceMonitors,
        List<TransitionCommand> testSetup,
        List<TransitionCommand> runSetup,
        List<TransitionCommand> testTeardown,
        List<TransitionCommand> runTeardown,
        List<TransitionCommand> transitions,
        List<AssertionData> assertions,
        TransitionRunner runner,
        StateSyncHelper syncHelper,
        boolean excludeJankyRuns
    ) {
        this.device = Objects.requireNonNull(device, "device");
        this.outputDir = Objects.requireNonNull(outputDir, "outputDir");
        this.testName = ArtifactNames.validateTestName(testName);
        if (repetitions < 1) {
            throw new IllegalArgumentException("repetitions must be >= 1");
        }
        this.repetitions = repetitions;
        this.frameStatsMonitor = frameStatsMonitor;
        this.traceMonitors = List.copyOf(traceMonitors);
        this.testSetup = List.copyOf(testSetup);
        this.runSetup = List.copyOf(runSetup);
        this.testTeardown = List.copyOf(testTeardown);
        this.runTeardown = List.copyOf(runTeardown);
        this.transitions = List.copyOf(transitions);
        this.assertions = List.copyOf(assertions);
        this.runner = Objects.requireNonNull(runner, "runner");
        this.syncHelper = Objects.requireNonNull(syncHelper, "syncHelper");
        this.excludeJankyRuns = excludeJankyRuns;
        checkMonitors(this.traceMonitors);
        checkAssertionNames(this.assertions);
    }

    /**
     * Executes the test.
     *
     * @throws TransitionExecutionException if the transition could not be executed
     */
    public Flicker execute() {
        FlickerResult executed;
        executing = true;
        try {
            executed = runner.execute(this);
        } finally {
            executing = false;
        }
        result = executed;

        Optional<Throwable> error = executed.error();
        if (error.isPresent()) {
            throw new TransitionExecutionException("Unable to execute transition " + testName, error.get());
        }
        return this;
    }

    /**
     * Asserts that the transition of this test has been executed successfully.
     *
     * @throws IllegalStateException otherwise
     */
    public void checkIsExecuted() {
        result.checkIsExecuted();
    }

    /**
     * Runs the non-flaky assertions, executing the transition first if needed.
     *
     * @throws AssertionError if any assertion fails
     */
    public void checkAssertions() {
        checkAssertions(false);
    }

    /**
     * Runs the assertions on the traces, executing the transition first if needed.
     *
     * @param onlyFlaky runs only the flaky assertions
     * @throws AssertionError                if any assertion fails; the message lists every failure, one per line
     * @throws TransitionExecutionException if the transition could not be executed
     */
    public void checkAssertions(boolean onlyFlaky) {
        if (result.isEmpty()) {
            execute();
        }
        List<AssertionFailure> failures = result.checkAssertions(assertions, onlyFlaky);

        String failureMessage = failures.stream()
            .map(AssertionFailure::message)
            .collect(Collectors.joining("\n"));
        if (!failureMessage.isEmpty()) {
            throw new AssertionError(failureMessage);
        }
    }

    /**
     * Deletes the trace files of runs without assertion failures and resets the
     * test to its not-executed state. Failures found by other tests sharing the
     * same result also keep their runs.
     */
    public void cleanUp() {
        runner.cleanUp();
        result.cleanUp();
        result = FlickerResult.empty();
    }

    /**
     * Runs a set of commands and, at the end, creates a tag containing the device state.
     *
     * @param tag      identifier for the tag to be created
     * @param commands commands to execute before creating the tag
     * @throws IllegalArgumentException if {@code tag} cannot be converted to a valid
     *                                  file name; raised before any command runs
     */
    public void withTag(String tag, TransitionCommand... commands) throws Exception {
        runner.checkTag(tag);
        for (TransitionCommand command : commands) {
            command.run(this);
        }
        runner.createTag(this, tag);
    }

    public void createTag(String tag) {
        runner.createTag(this, tag);
    }

    /**
     * @see #copy(AssertionData, String)
     */
    public Flicker copy(AssertionData newAssertion) {
        return copy(newAssertion, "");
    }

    /**
     * Creates a test with the same configuration, a fresh result and only
     * {@code newAssertion}.
     *
     * @param newAssertion the single assertion of the copy, or {@code null} for none
     * @param newName      name of the copy; keeps this test's name when empty
     */
    public Flicker copy(AssertionData newAssertion, String newName) {
        String name = newName == null || newName.isEmpty() ? testName : newName;
        List<AssertionData> assertion = newAssertion == null ? List.of() : List.of(newAssertion);
        return new Flicker(device, outputDir, name, repetitions, frameStatsMonitor, traceMonitors,
            testSetup, runSetup, testTeardown, runTeardown, transitions, assertion, runner, syncHelper,
            excludeJankyRuns);
    }

    public ExecutionState state() {
        if (executing) {
            return ExecutionState.EXECUTING;
        }
        FlickerResult current = result;
        if (current.isEmpty()) {
            return ExecutionState.NOT_EXECUTED;
        }
        return current.error().isPresent() ? ExecutionState.EXECUTED_WITH_ERROR : ExecutionState.EXECUTED_OK;
    }

    public FlickerResult result() {
        return result;
    }

    public DeviceHandle device() {
        return device;
    }

    public Path outputDir() {
        return outputDir;
    }

    public String testName() {
        return testName;
    }

    public int repetitions() {
        return repetitions;
    }

    public Optional<FrameStatsMonitor> frameStatsMonitor() {
        return Optional.ofNullable(frameStatsMonitor);
    }

    public List<TransitionMonitor> traceMonitors() {
        return traceMonitors;
    }

    /** Commands executed once, before the first repetition. */
    public List<TransitionCommand> testSetup() {
        return testSetup;
    }

    /** Commands executed before every repetition. */
    public List<TransitionCommand> runSetup() {
        return runSetup;
    }

    /** Commands executed once, after the last repetition. */
    public List<TransitionCommand> testTeardown() {
        return testTeardown;
    }

    /** Commands executed after every repetition. */
    public List<TransitionCommand> runTeardown() {
        return runTeardown;
    }

    public List<TransitionCommand> transitions() {
        return transitions;
    }

    public List<AssertionData> assertions() {
        return assertions;
    }

    public TransitionRunner runner() {
        return runner;
    }

    public StateSyncHelper syncHelper() {
        return syncHelper;
    }

    public boolean excludeJankyRuns() {
        return excludeJankyRuns;
    }

    @Override
    public String toString() {
        return testName;
    }

    private static void checkMonitors(List<TransitionMonitor> monitors) {
        Set<String> names = new HashSet<>();
        Set<String> suffixes = new HashSet<>();
        for (TransitionMonitor monitor : monitors) {
            Objects.requireNonNull(monitor, "monitor");
            if (!names.add(monitor.name())) {
                throw new IllegalArgumentException("Duplicate monitor name: " + monitor.name());
            }
            if (!ArtifactNames.isValidSuffix(monitor.fileSuffix())) {
                throw new IllegalArgumentException(
                    "Monitor " + monitor.name() + " has an invalid file suffix: '" + monitor.fileSuffix() + "'");
            }
            if (!suffixes.add(monitor.fileSuffix())) {
                throw new IllegalArgumentException("Duplicate monitor file suffix: '" + monitor.fileSuffix() + "'");
            }
        }
    }

    private static void checkAssertionNames(List<AssertionData> assertions) {
        Set<String> names = new HashSet<>();
        for (AssertionData assertion : assertions) {
            Objects.requireNonNull(assertion, "assertion");
            if (!names.add(assertion.name())) {
                throw new IllegalArgumentException("Duplicate assertion name: " + assertion.name());
            }
        }
    }
}
