package com.questrail.flicker.runner;

import com.questrail.flicker.Flicker;
import com.questrail.flicker.FlickerResult;
import com.questrail.flicker.observability.FlickerObservabilitySink;
import com.questrail.flicker.time.WallClock;

/**
 * {@link TransitionRunner} that executes the transition once and hands the same
 * result to every test sharing it until {@link #cleanUp()}.
 *
 * <p>Intended for tests split per assertion with {@link Flicker#copy}: copies
 * share their runner, so the device runs the transition a single time for the
 * whole family.</p>
 */
public class CachedTransitionRunner extends TransitionRunner
{
    private FlickerResult cached;

    public CachedTransitionRunner() {
        super();
    }

    public CachedTransitionRunner(FlickerObservabilitySink observabilitySink, WallClock clock) {
        super(observabilitySink, clock);
    }

    @Override
    public FlickerResult execute(Flicker flicker) {
        if (cached == null) {
            cached = super.execute(flicker);
        }
        return cached;
    }

    public boolean hasCachedResult() {
        return cached != null;
    }

    @Override
    public void cleanUp() {
        super.cleanUp();
        cached = null;
    }
}
