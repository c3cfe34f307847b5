package com.questrail.flicker;

import com.questrail.flicker.api.StateSyncHelper;
import com.questrail.flicker.assertions.AssertionData;
import com.questrail.flicker.monitor.RecordingTransitionMonitor;
import com.questrail.flicker.observability.NullObservabilitySink;
import com.questrail.flicker.runner.TransitionRunner;
import com.questrail.flicker.time.ManualWallClock;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static com.questrail.flicker.FlickerFixtures.DEVICE;
import static com.questrail.flicker.FlickerFixtures.log;
import static org.junit.jupiter.api.Assertions.*;

class FlickerBuilderTest
{
    @TempDir
    Path outputDir;

    private final List<String> journal = new ArrayList<>();

    @Test
    void defaultsAreApplied() {
        Flicker flicker = new FlickerBuilder(DEVICE).build();

        assertEquals(1, flicker.repetitions());
        assertEquals("flicker", flicker.testName());
        assertEquals(FlickerBuilder.DEFAULT_OUTPUT_DIR, flicker.outputDir());
        assertSame(StateSyncHelper.NONE, flicker.syncHelper());
        assertTrue(flicker.traceMonitors().isEmpty());
        assertTrue(flicker.frameStatsMonitor().isEmpty());
        assertFalse(flicker.excludeJankyRuns());
        assertNotNull(flicker.runner());
    }

    @Test
    void phaseCommandsKeepRegistrationOrderAndGrouping() {
        Flicker flicker = new FlickerBuilder(DEVICE)
            .withOutputDir(outputDir)
            .repeat(2)
            .withRunner(new TransitionRunner(NullObservabilitySink.INSTANCE, new ManualWallClock()))
            .setup(setup -> setup
                .test(log(journal, "setup-test-1"), log(journal, "setup-test-2"))
                .eachRun(log(journal, "setup-run")))
            .teardown(teardown -> teardown
                .eachRun(log(journal, "teardown-run"))
                .test(log(journal, "teardown-test")))
            .transitions(log(journal, "transition"))
            .build();

        flicker.execute();

        assertEquals(List.of(
            "setup-test-1", "setup-test-2",
            "setup-run", "transition", "teardown-run",
            "setup-run", "transition", "teardown-run",
            "teardown-test"
        ), journal);
    }

    @Test
    void repetitionsBelowOneAreRejected() {
        FlickerBuilder builder = new FlickerBuilder(DEVICE);

        assertThrows(IllegalArgumentException.class, () -> builder.repeat(0));
        assertThrows(IllegalArgumentException.class, () -> builder.repeat(-3));
    }

    @Test
    void testNameMustBeUsableAsFileName() {
        FlickerBuilder builder = new FlickerBuilder(DEVICE).withTestName("open app/cold");

        assertThrows(IllegalArgumentException.class, builder::build);
    }

    @Test
    void duplicateMonitorSuffixesAreRejected() {
        FlickerBuilder builder = new FlickerBuilder(DEVICE)
            .withTraceMonitor(new RecordingTransitionMonitor("wm", ".trace", journal))
            .withTraceMonitor(new RecordingTransitionMonitor("layers", ".trace", journal));

        IllegalArgumentException error = assertThrows(IllegalArgumentException.class, builder::build);
        assertTrue(error.getMessage().contains(".trace"));
    }

    @Test
    void duplicateMonitorNamesAreRejected() {
        FlickerBuilder builder = new FlickerBuilder(DEVICE)
            .withTraceMonitor(new RecordingTransitionMonitor("wm", ".a", journal))
            .withTraceMonitor(new RecordingTransitionMonitor("wm", ".b", journal));

        assertThrows(IllegalArgumentException.class, builder::build);
    }

    @Test
    void duplicateAssertionNamesAreRejected() {
        FlickerBuilder builder = new FlickerBuilder(DEVICE)
            .withAssertion(AssertionData.perRun("visible", run -> { }))
            .withAssertion(AssertionData.acrossRuns("visible", runs -> { }));

        assertThrows(IllegalArgumentException.class, builder::build);
    }

    @Test
    void nullCommandsAreRejected() {
        FlickerBuilder builder = new FlickerBuilder(DEVICE);

        assertThrows(NullPointerException.class, () -> builder.transitions(log(journal, "ok"), null));
        assertThrows(NullPointerException.class, () -> new FlickerBuilder(null));
    }
}
