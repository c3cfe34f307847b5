package com.questrail.flicker.assertions;

import com.questrail.flicker.FlickerRunResult;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static com.questrail.flicker.FlickerFixtures.run;
import static org.junit.jupiter.api.Assertions.*;

class AssertionEngineTest {

    private final List<FlickerRunResult> runs = List.of(
        run(0, Path.of("t_0.wm")),
        run(1, Path.of("t_1.wm")),
        run(2, Path.of("t_2.wm"))
    );

    @Test
    void perRunAssertionReportsEveryRejectingRun() {
        AssertionData oddRunsFail = AssertionData.perRun("evenOnly", run -> {
            if (run.iteration() % 2 == 1) {
                throw new AssertionError("run was odd");
            }
        });

        List<AssertionFailure> failures = AssertionEngine.evaluate(oddRunsFail, runs);

        assertEquals(1, failures.size());
        assertEquals(List.of(1), failures.get(0).iterations());
        assertEquals("evenOnly failed on run 1: run was odd", failures.get(0).message());
    }

    @Test
    void perRunAssertionIsCheckedOncePerRun() {
        AtomicInteger calls = new AtomicInteger();

        AssertionEngine.evaluate(AssertionData.perRun("count", run -> calls.incrementAndGet()), runs);

        assertEquals(3, calls.get());
    }

    @Test
    void wholeResultAssertionImplicatesAllRuns() {
        AssertionData sameCount = AssertionData.acrossRuns("stable", all -> {
            throw new AssertionError("layer count changed between runs");
        });

        List<AssertionFailure> failures = AssertionEngine.evaluate(sameCount, runs);

        assertEquals(1, failures.size());
        assertEquals(List.of(0, 1, 2), failures.get(0).iterations());
        assertEquals("stable failed across runs [0, 1, 2]: layer count changed between runs",
            failures.get(0).message());
    }

    @Test
    void wholeResultAssertionSeesRunsInOrder() {
        AssertionData ordered = AssertionData.acrossRuns("ordered", all -> {
            for (int i = 0; i < all.size(); i++) {
                assertEquals(i, all.get(i).iteration());
            }
        });

        assertTrue(AssertionEngine.evaluate(ordered, runs).isEmpty());
    }

    @Test
    void exceptionFromPredicateIsAFailure() {
        AssertionData broken = AssertionData.perRun("broken", run -> {
            throw new IllegalArgumentException("no such layer");
        });

        List<AssertionFailure> failures = AssertionEngine.evaluate(broken, runs.subList(0, 1));

        assertEquals("evaluation raised IllegalArgumentException: no such layer", failures.get(0).detail());
    }

    @Test
    void rejectionWithoutMessageStillDescribesTheFailure() {
        AssertionData silent = AssertionData.perRun("silent", run -> {
            throw new AssertionError();
        });

        List<AssertionFailure> failures = AssertionEngine.evaluate(silent, runs.subList(0, 1));

        assertEquals("assertion rejected the trace without a message", failures.get(0).detail());
    }

    @Test
    void evaluationIsRepeatable() {
        AssertionData odd = AssertionData.perRun("odd", run -> assertEquals(0, run.iteration() % 2, "odd run"));

        assertEquals(AssertionEngine.evaluate(odd, runs), AssertionEngine.evaluate(odd, runs));
    }

    @Test
    void evaluateAllSelectsFlakyOrNonFlaky() {
        AssertionData stable = AssertionData.perRun("stable", run -> fail("stable rejected"));
        AssertionData flaky = AssertionData.acrossRuns("flaky", all -> fail("flaky rejected")).asFlaky();
        List<AssertionData> assertions = List.of(stable, flaky);

        List<AssertionFailure> regular = AssertionEngine.evaluateAll(assertions, runs, false);
        List<AssertionFailure> onlyFlaky = AssertionEngine.evaluateAll(assertions, runs, true);

        assertEquals(3, regular.size());
        assertTrue(regular.stream().allMatch(f -> f.assertionName().equals("stable")));
        assertEquals(1, onlyFlaky.size());
        assertEquals("flaky", onlyFlaky.get(0).assertionName());
    }

    @Test
    void noRunsMeansNoPerRunFailures() {
        AssertionData never = AssertionData.perRun("never", run -> fail("unexpected"));

        assertTrue(AssertionEngine.evaluate(never, List.of()).isEmpty());
    }

    @Test
    void assertionDataRejectsBlankNames() {
        assertThrows(IllegalArgumentException.class, () -> AssertionData.perRun(" ", run -> { }));
        assertThrows(NullPointerException.class, () -> AssertionData.acrossRuns("x", null));
        assertEquals("x (flaky)", AssertionData.acrossRuns("x", all -> { }).asFlaky().toString());
    }
}
