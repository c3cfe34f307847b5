package com.questrail.flicker;

import com.questrail.flicker.api.DeviceHandle;
import com.questrail.flicker.api.StateSyncHelper;
import com.questrail.flicker.api.TransitionCommand;
import com.questrail.flicker.assertions.AssertionData;
import com.questrail.flicker.monitor.FrameStatsMonitor;
import com.questrail.flicker.monitor.TransitionMonitor;
import com.questrail.flicker.runner.TransitionRunner;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * FlickerBuilder
 * -----------------------------------------------------------------------------
 * Builder for {@link Flicker} tests.
 *
 * <pre>{@code
 * Flicker flicker = new FlickerBuilder(device)
 *     .withTestName("open_app")
 *     .repeat(3)
 *     .withTraceMonitor(windowTraceMonitor)
 *     .setup(setup -> setup
 *         .test(f -> launcher.goHome(f.device()))
 *         .eachRun(f -> app.prepare(f.device())))
 *     .transitions(f -> app.open(f.device()), f -> f.syncHelper().waitForIdle())
 *     .teardown(teardown -> teardown.eachRun(f -> app.close(f.device())))
 *     .withAssertion(AssertionData.perRun("appWindowVisible", run -> ...))
 *     .build();
 * }</pre>
 *
 * <h2>Design Notes</h2>
 * <ul>
 *   <li>Setup and teardown commands are registered through a {@link PhaseBuilder}
 *       that only knows about "once per test" and "once per run"; transitions and
 *       assertions cannot be registered from inside a phase</li>
 *   <li>Commands keep their registration order</li>
 *   <li>Validation happens in {@link #build()}</li>
 * </ul>
 */
public final class FlickerBuilder
{
    static final Path DEFAULT_OUTPUT_DIR = Paths.get(System.getProperty("java.io.tmpdir"), "flicker");
    static final String DEFAULT_TEST_NAME = "flicker";

    private final DeviceHandle device;
    private Path outputDir = DEFAULT_OUTPUT_DIR;
    private String testName = DEFAULT_TEST_NAME;
    private int repetitions = 1;
    private FrameStatsMonitor frameStatsMonitor;
    private final List<TransitionMonitor> traceMonitors = new ArrayList<>();
    private final PhaseBuilder setup = new PhaseBuilder();
    private final PhaseBuilder teardown = new PhaseBuilder();
    private final List<TransitionCommand> transitions = new ArrayList<>();
    private final List<AssertionData> assertions = new ArrayList<>();
    private TransitionRunner runner;
    private StateSyncHelper syncHelper = StateSyncHelper.NONE;
    private boolean excludeJankyRuns;

    public FlickerBuilder(DeviceHandle device) {
        this.device = Objects.requireNonNull(device, "device");
    }

    public FlickerBuilder withOutputDir(Path outputDir) {
        this.outputDir = Objects.requireNonNull(outputDir, "outputDir");
        return this;
    }

    public FlickerBuilder withTestName(String testName) {
        this.testName = Objects.requireNonNull(testName, "testName");
        return this;
    }

    /**
     * Number of times the transition is executed.
     */
    public FlickerBuilder repeat(int repetitions) {
        if (repetitions < 1) {
            throw new IllegalArgumentException("repetitions must be >= 1");
        }
        this.repetitions = repetitions;
        return this;
    }

    public FlickerBuilder withTraceMonitor(TransitionMonitor monitor) {
        traceMonitors.add(Objects.requireNonNull(monitor, "monitor"));
        return this;
    }

    public FlickerBuilder withFrameStatsMonitor(FrameStatsMonitor monitor) {
        this.frameStatsMonitor = Objects.requireNonNull(monitor, "monitor");
        return this;
    }

    /**
     * Keeps runs with janky frames out of assertion evaluation.
     */
    public FlickerBuilder excludeJankyRuns(boolean exclude) {
        this.excludeJankyRuns = exclude;
        return this;
    }

    public FlickerBuilder withRunner(TransitionRunner runner) {
        this.runner = Objects.requireNonNull(runner, "runner");
        return this;
    }

    public FlickerBuilder withSyncHelper(StateSyncHelper syncHelper) {
        this.syncHelper = Objects.requireNonNull(syncHelper, "syncHelper");
        return this;
    }

    /**
     * Registers commands executed before the transition.
     */
    public FlickerBuilder setup(Consumer<PhaseBuilder> registration) {
        Objects.requireNonNull(registration, "registration").accept(setup);
        return this;
    }

    /**
     * Registers commands executed after the transition.
     */
    public FlickerBuilder teardown(Consumer<PhaseBuilder> registration) {
        Objects.requireNonNull(registration, "registration").accept(teardown);
        return this;
    }

    /**
     * Registers the commands that make up the transition under test.
     */
    public FlickerBuilder transitions(TransitionCommand... commands) {
        PhaseBuilder.addAll(transitions, commands);
        return this;
    }

    public FlickerBuilder withAssertion(AssertionData assertion) {
        assertions.add(Objects.requireNonNull(assertion, "assertion"));
        return this;
    }

    public FlickerBuilder withAssertions(List<AssertionData> assertions) {
        for (AssertionData assertion : Objects.requireNonNull(assertions, "assertions")) {
            withAssertion(assertion);
        }
        return this;
    }

    /**
     * @throws IllegalArgumentException if the configuration is inconsistent
     */
    public Flicker build() {
        return new Flicker(
            device,
            outputDir,
            testName,
            repetitions,
            frameStatsMonitor,
            traceMonitors,
            setup.test,
            setup.eachRun,
            teardown.test,
            teardown.eachRun,
            transitions,
            assertions,
            runner != null ? runner : new TransitionRunner(),
            syncHelper,
            excludeJankyRuns
        );
    }

    /**
     * Registration surface for one of the setup or teardown phases.
     */
    public static final class PhaseBuilder {
        private final List<TransitionCommand> test = new ArrayList<>();
        private final List<TransitionCommand> eachRun = new ArrayList<>();

        private PhaseBuilder() {
        }

        /**
         * Commands executed once per test: before the first run for setup,
         * after the last run for teardown.
         */
        public PhaseBuilder test(TransitionCommand... commands) {
            addAll(test, commands);
            return this;
        }

        /**
         * Commands executed around every run.
         */
        public PhaseBuilder eachRun(TransitionCommand... commands) {
            addAll(eachRun, commands);
            return this;
        }

        private static void addAll(List<TransitionCommand> target, TransitionCommand[] commands) {
            Objects.requireNonNull(commands, "commands");
            for (TransitionCommand command : Arrays.asList(commands)) {
                target.add(Objects.requireNonNull(command, "command"));
            }
        }
    }
}
