package com.questrail.flicker.runner;

import com.questrail.flicker.Flicker;
import com.questrail.flicker.FlickerBuilder;
import com.questrail.flicker.FlickerRunResult;
import com.questrail.flicker.assertions.AssertionData;
import com.questrail.flicker.monitor.RecordingTransitionMonitor;
import com.questrail.flicker.observability.NullObservabilitySink;
import com.questrail.flicker.time.ManualWallClock;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static com.questrail.flicker.FlickerFixtures.DEVICE;
import static org.junit.jupiter.api.Assertions.*;

class CachedTransitionRunnerTest {

    @TempDir
    Path outputDir;

    @Test
    void copiesShareOneExecution() {
        AtomicInteger transitions = new AtomicInteger();
        CachedTransitionRunner runner = new CachedTransitionRunner(NullObservabilitySink.INSTANCE, new ManualWallClock());
        Flicker flicker = new FlickerBuilder(DEVICE)
            .withOutputDir(outputDir)
            .repeat(2)
            .withRunner(runner)
            .withTraceMonitor(new RecordingTransitionMonitor("wm", ".wm", new ArrayList<>()))
            .transitions(f -> transitions.incrementAndGet())
            .build();

        Flicker visible = flicker.copy(AssertionData.perRun("visible", run -> { }), "visible");
        Flicker stable = flicker.copy(AssertionData.acrossRuns("stable", runs -> assertEquals(2, runs.size())), "stable");
        visible.checkAssertions();
        stable.checkAssertions();

        assertEquals(2, transitions.get());
        assertSame(visible.result(), stable.result());
        assertTrue(runner.hasCachedResult());
    }

    @Test
    void cleanUpByOneCopyKeepsRunsFailedBySibling() {
        CachedTransitionRunner runner = new CachedTransitionRunner(NullObservabilitySink.INSTANCE, new ManualWallClock());
        Flicker flicker = new FlickerBuilder(DEVICE)
            .withOutputDir(outputDir)
            .repeat(2)
            .withRunner(runner)
            .withTraceMonitor(new RecordingTransitionMonitor("wm", ".wm", new ArrayList<>()))
            .build();
        Flicker bad = flicker.copy(AssertionData.perRun("secondRunBroken", run -> {
            if (run.iteration() == 1) {
                throw new AssertionError("status bar missing");
            }
        }), "bad");
        Flicker good = flicker.copy(AssertionData.perRun("alwaysHolds", run -> { }), "good");

        assertThrows(AssertionError.class, bad::checkAssertions);
        good.checkAssertions();
        List<FlickerRunResult> runs = good.result().runs();
        good.cleanUp();

        assertFalse(Files.exists(runs.get(0).trace("wm").orElseThrow().path()));
        assertTrue(Files.exists(runs.get(1).trace("wm").orElseThrow().path()));

        bad.cleanUp();
        assertTrue(Files.exists(runs.get(1).trace("wm").orElseThrow().path()));
    }

    @Test
    void cleanUpDropsTheCachedResult() {
        AtomicInteger transitions = new AtomicInteger();
        CachedTransitionRunner runner = new CachedTransitionRunner(NullObservabilitySink.INSTANCE, new ManualWallClock());
        Flicker flicker = new FlickerBuilder(DEVICE)
            .withOutputDir(outputDir)
            .withRunner(runner)
            .transitions(f -> transitions.incrementAndGet())
            .build();

        flicker.execute();
        flicker.cleanUp();
        assertFalse(runner.hasCachedResult());

        flicker.execute();
        assertEquals(2, transitions.get());
        assertEquals(List.of(0), flicker.result().runs().stream().map(r -> r.iteration()).toList());
    }
}
