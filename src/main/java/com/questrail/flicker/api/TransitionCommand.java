package com.questrail.flicker.api;

import com.questrail.flicker.Flicker;

/**
 * A single step of a setup, transition or teardown phase.
 *
 * <p>The test context is passed explicitly. Commands reach the device through
 * {@link Flicker#device()} and may wait for it through
 * {@link Flicker#syncHelper()}. Any exception thrown aborts the current run.</p>
 */
@FunctionalInterface
public interface TransitionCommand
{
    void run(Flicker flicker) throws Exception;
}
