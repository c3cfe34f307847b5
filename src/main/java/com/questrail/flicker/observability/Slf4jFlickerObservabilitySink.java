package com.questrail.flicker.observability;

import com.questrail.flicker.FlickerRunResult;
import com.questrail.flicker.RunStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of FlickerObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jFlickerObservabilitySink implements FlickerObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jFlickerObservabilitySink.class);

    @Override
    public void onPhase(FlickerPhaseEvent event) {
        if (event.iteration() < 0) {
            log.debug("Flicker {}: {}", event.testName(), event.phase());
        } else {
            log.debug("Flicker {} run {}: {}", event.testName(), event.iteration(), event.phase());
        }
    }

    @Override
    public void onRunCompleted(FlickerRunEvent event) {
        FlickerRunResult run = event.run();
        if (run.status() == RunStatus.SUCCESS) {
            log.info("Flicker {} run {} completed with {} trace(s), janky frames: {}",
                event.testName(),
                run.iteration(),
                run.traces().size(),
                run.jankyFrames().isPresent() ? run.jankyFrames().getAsInt() : "n/a");
        } else {
            log.warn("Flicker {} run {} ended with {} in {}",
                event.testName(),
                run.iteration(),
                run.status(),
                run.failedPhase().map(Enum::name).orElse("UNKNOWN"));
        }
    }

    @Override
    public void onTag(FlickerTagEvent event) {
        log.info("Flicker {} run {}: tag '{}' captured ({} artifact(s))",
            event.testName(), event.iteration(), event.tag(), event.artifacts().size());
    }

    @Override
    public void onError(FlickerErrorEvent event) {
        log.error("Flicker {} Error: {}", event.testName(), event.message(), event.cause());
    }
}
