package com.questrail.flicker.runner;

import com.questrail.flicker.Flicker;
import com.questrail.flicker.FlickerResult;
import com.questrail.flicker.FlickerRunResult;
import com.questrail.flicker.api.TraceArtifact;
import com.questrail.flicker.api.TransitionCommand;
import com.questrail.flicker.monitor.FrameStatsMonitor;
import com.questrail.flicker.monitor.TransitionMonitor;
import com.questrail.flicker.observability.FlickerErrorEvent;
import com.questrail.flicker.observability.FlickerObservabilitySink;
import com.questrail.flicker.observability.FlickerPhaseEvent;
import com.questrail.flicker.observability.FlickerRunEvent;
import com.questrail.flicker.observability.FlickerTagEvent;
import com.questrail.flicker.observability.NullObservabilitySink;
import com.questrail.flicker.observability.Slf4jFlickerObservabilitySink;
import com.questrail.flicker.time.SystemWallClock;
import com.questrail.flicker.time.WallClock;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * TransitionRunner
 * =============================================================================
 * Executes the test cycle of a {@link Flicker}: setup, monitored transition
 * and teardown, repeated {@code repetitions} times.
 *
 * <h2>Order of one execution</h2>
 * <pre>
 *   SETUP_TEST                                   (before repetition 0 only)
 *   for i in 0..repetitions-1:
 *     SETUP_RUN
 *     MONITOR_START   trace monitors, then frame-stats monitor
 *     TRANSITION      (tags may be created here: MONITOR_SNAPSHOT → {testName}_{i}_{tag}{suffix})
 *     MONITOR_STOP    frame-stats monitor, then trace monitors → {testName}_{i}{suffix}
 *     TEARDOWN_RUN
 *   TEARDOWN_TEST                                (after the last repetition only)
 * </pre>
 *
 * <h2>Failures</h2>
 * <ul>
 *   <li>A command or monitor that raises aborts the rest of its run. The run is
 *       recorded with the error and no further repetitions are attempted.</li>
 *   <li>The returned result carries the error as its global error.</li>
 *   <li>Monitors that were started are stopped even when the transition raises.
 *       Setup and teardown are not monitored and need no such guarantee.</li>
 *   <li>Once setup-once has completed, teardown-once is still attempted after an
 *       aborted run. Its own failure is attached as suppressed.</li>
 * </ul>
 *
 * <h2>Threading Model</h2>
 * Strictly sequential on the calling thread. A runner executes one test at a
 * time; {@link #createTag(Flicker, String)} is meant to be called from that same
 * thread, by a transition command.
 */
public class TransitionRunner
{
    private final FlickerObservabilitySink observabilitySink;
    private final WallClock clock;

    /** Run being executed, {@code null} outside {@link #execute(Flicker)}. */
    private RunInProgress current;

    /**
     * Runner that logs through SLF4J.
     */
    public TransitionRunner() {
        this(new Slf4jFlickerObservabilitySink(), SystemWallClock.INSTANCE);
    }

    public TransitionRunner(FlickerObservabilitySink observabilitySink, WallClock clock) {
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Executes the test cycle.
     *
     * @return the runs; the global error is set if any phase raised
     */
    public FlickerResult execute(Flicker flicker) {
        Objects.requireNonNull(flicker, "flicker");
        List<FlickerRunResult> runs = new ArrayList<>(flicker.repetitions());

        try {
            prepareOutput(flicker);
            runPhase(flicker, TransitionPhase.SETUP_TEST, -1, flicker.testSetup());
        } catch (PhaseExecutionException e) {
            reportError(flicker, e);
            return FlickerResult.failed(runs, e, flicker.excludeJankyRuns());
        }

        PhaseExecutionException failure = null;
        for (int i = 0; i < flicker.repetitions() && failure == null; i++) {
            FlickerRunResult run = executeRun(flicker, i);
            runs.add(run);
            if (run.error().isPresent()) {
                failure = (PhaseExecutionException) run.error().get();
            }
        }

        int lastIteration = runs.size() - 1;
        try {
            runPhase(flicker, TransitionPhase.TEARDOWN_TEST, lastIteration, flicker.testTeardown());
        } catch (PhaseExecutionException e) {
            reportError(flicker, e);
            if (failure == null) {
                failure = e;
            } else {
                failure.addSuppressed(e);
            }
        }

        if (failure != null) {
            return FlickerResult.failed(runs, failure, flicker.excludeJankyRuns());
        }
        return FlickerResult.completed(runs, flicker.excludeJankyRuns());
    }

    /**
     * Validates a tag before the commands preceding it run.
     *
     * @throws IllegalArgumentException if the tag cannot be used in a file name
     *                                  or already exists in the current run
     */
    public void checkTag(String tag) {
        ArtifactNames.validateTag(tag);
        RunInProgress run = current;
        if (run != null && run.builder.hasTag(tag)) {
            throw new IllegalArgumentException("Tag '" + tag + "' already exists in run " + run.builder.iteration());
        }
    }

    /**
     * Asks every running trace monitor for a snapshot named after {@code tag},
     * without stopping the capture.
     *
     * @throws IllegalArgumentException if the tag is invalid or already used in this run
     * @throws IllegalStateException    if no transition is being captured
     * @throws PhaseExecutionException  in phase {@link TransitionPhase#MONITOR_SNAPSHOT}
     *                                  if a monitor fails to write its snapshot
     */
    public void createTag(Flicker flicker, String tag) {
        Objects.requireNonNull(flicker, "flicker");
        checkTag(tag);
        RunInProgress run = current;
        if (run == null || !run.monitorsRunning) {
            throw new IllegalStateException("Tag '" + tag + "' can only be created while the transition is captured");
        }

        int iteration = run.builder.iteration();
        String baseName = ArtifactNames.tagArtifact(flicker.testName(), iteration, tag);
        List<TraceArtifact> artifacts = new ArrayList<>(flicker.traceMonitors().size());
        for (TransitionMonitor monitor : flicker.traceMonitors()) {
            try {
                Path written = monitor.snapshot(flicker.outputDir().resolve(baseName + monitor.fileSuffix()));
                artifacts.add(TraceArtifact.ofTag(monitor.name(), iteration, tag, written));
            } catch (RuntimeException e) {
                // keep the snapshots already written on the run
                if (!artifacts.isEmpty()) {
                    run.builder.addTag(tag, artifacts);
                }
                throw new PhaseExecutionException(
                    TransitionPhase.MONITOR_SNAPSHOT, iteration, monitor.name() + ", tag " + tag, e);
            }
        }
        run.builder.addTag(tag, artifacts);
        observabilitySink.onTag(new FlickerTagEvent(clock.now(), flicker.testName(), iteration, tag, artifacts));
    }

    /**
     * Releases state held by this runner between executions. The base runner holds none.
     */
    public void cleanUp() {
    }

    // ------------------------
    // One repetition
    // ------------------------

    private FlickerRunResult executeRun(Flicker flicker, int iteration) {
        FlickerRunResult.Builder builder = FlickerRunResult.builder(iteration).startedAt(clock.now());
        current = new RunInProgress(builder);
        try {
            runPhase(flicker, TransitionPhase.SETUP_RUN, iteration, flicker.runSetup());
            captureTransition(flicker, iteration, builder);
            runPhase(flicker, TransitionPhase.TEARDOWN_RUN, iteration, flicker.runTeardown());
        } catch (PhaseExecutionException e) {
            builder.failed(e);
            reportError(flicker, e);
        } finally {
            current = null;
        }

        FlickerRunResult run = builder.finishedAt(clock.now()).build();
        observabilitySink.onRunCompleted(new FlickerRunEvent(clock.now(), flicker.testName(), run));
        return run;
    }

    private void captureTransition(Flicker flicker, int iteration, FlickerRunResult.Builder builder) {
        List<TransitionMonitor> started = new ArrayList<>(flicker.traceMonitors().size());
        Optional<FrameStatsMonitor> frameStats = Optional.empty();

        PhaseExecutionException failure = null;
        try {
            emitPhase(flicker, TransitionPhase.MONITOR_START, iteration);
            for (TransitionMonitor monitor : flicker.traceMonitors()) {
                startMonitor(monitor, iteration);
                started.add(monitor);
            }
            if (flicker.frameStatsMonitor().isPresent()) {
                FrameStatsMonitor monitor = flicker.frameStatsMonitor().get();
                startFrameStats(monitor, iteration);
                frameStats = Optional.of(monitor);
            }
            current.monitorsRunning = true;
            runPhase(flicker, TransitionPhase.TRANSITION, iteration, flicker.transitions());
        } catch (PhaseExecutionException e) {
            failure = e;
        } catch (RuntimeException | Error e) {
            PhaseExecutionException stopFailure = stopMonitors(flicker, iteration, started, frameStats, builder);
            if (stopFailure != null) {
                e.addSuppressed(stopFailure);
            }
            throw e;
        }

        PhaseExecutionException stopFailure = stopMonitors(flicker, iteration, started, frameStats, builder);
        if (stopFailure != null) {
            if (failure == null) {
                failure = stopFailure;
            } else {
                failure.addSuppressed(stopFailure);
            }
        }
        if (failure != null) {
            throw failure;
        }
    }

    private void startMonitor(TransitionMonitor monitor, int iteration) {
        try {
            monitor.start();
        } catch (RuntimeException e) {
            throw new PhaseExecutionException(TransitionPhase.MONITOR_START, iteration, monitor.name(), e);
        }
    }

    private void startFrameStats(FrameStatsMonitor monitor, int iteration) {
        try {
            monitor.start();
        } catch (RuntimeException e) {
            throw new PhaseExecutionException(TransitionPhase.MONITOR_START, iteration, "frame stats", e);
        }
    }

    /**
     * Stops every started monitor, even if some of them fail.
     *
     * @return the first stop failure with later ones suppressed, or {@code null}
     */
    private PhaseExecutionException stopMonitors(
        Flicker flicker,
        int iteration,
        List<TransitionMonitor> started,
        Optional<FrameStatsMonitor> frameStats,
        FlickerRunResult.Builder builder
    ) {
        current.monitorsRunning = false;
        if (started.isEmpty() && frameStats.isEmpty()) {
            return null;
        }
        emitPhase(flicker, TransitionPhase.MONITOR_STOP, iteration);

        PhaseExecutionException failure = null;
        if (frameStats.isPresent()) {
            try {
                frameStats.get().stop();
                builder.jankyFrames(frameStats.get().jankyFrameCount());
            } catch (RuntimeException e) {
                failure = new PhaseExecutionException(TransitionPhase.MONITOR_STOP, iteration, "frame stats", e);
            }
        }

        String baseName = ArtifactNames.runArtifact(flicker.testName(), iteration);
        for (TransitionMonitor monitor : started) {
            try {
                Path written = monitor.stop(flicker.outputDir().resolve(baseName + monitor.fileSuffix()));
                builder.addTrace(TraceArtifact.ofRun(monitor.name(), iteration, written));
            } catch (RuntimeException e) {
                PhaseExecutionException stopFailure =
                    new PhaseExecutionException(TransitionPhase.MONITOR_STOP, iteration, monitor.name(), e);
                if (failure == null) {
                    failure = stopFailure;
                } else {
                    failure.addSuppressed(stopFailure);
                }
            }
        }
        return failure;
    }

    // ------------------------
    // Phase helpers
    // ------------------------

    private void prepareOutput(Flicker flicker) {
        try {
            Files.createDirectories(flicker.outputDir());
        } catch (IOException e) {
            throw new PhaseExecutionException(TransitionPhase.PREPARE, -1, flicker.outputDir().toString(), e);
        }
    }

    private void runPhase(Flicker flicker, TransitionPhase phase, int iteration, List<TransitionCommand> commands) {
        if (commands.isEmpty()) {
            return;
        }
        emitPhase(flicker, phase, iteration);
        for (TransitionCommand command : commands) {
            try {
                command.run(flicker);
            } catch (PhaseExecutionException e) {
                // already attributed, e.g. a snapshot failure inside a tag
                throw e;
            } catch (Exception | AssertionError e) {
                if (e instanceof InterruptedException) {
                    Thread.currentThread().interrupt();
                }
                throw new PhaseExecutionException(phase, iteration, e);
            }
        }
    }

    private void emitPhase(Flicker flicker, TransitionPhase phase, int iteration) {
        observabilitySink.onPhase(new FlickerPhaseEvent(clock.now(), flicker.testName(), iteration, phase));
    }

    private void reportError(Flicker flicker, PhaseExecutionException e) {
        observabilitySink.onError(new FlickerErrorEvent(clock.now(), flicker.testName(), e.getMessage(), e));
    }

    private static final class RunInProgress {
        private final FlickerRunResult.Builder builder;
        private boolean monitorsRunning;

        private RunInProgress(FlickerRunResult.Builder builder) {
            this.builder = builder;
        }
    }
}
