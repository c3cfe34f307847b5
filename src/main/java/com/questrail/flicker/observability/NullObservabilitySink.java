package com.questrail.flicker.observability;

/**
 * No-op implementation of FlickerObservabilitySink.
 */
public final class NullObservabilitySink implements FlickerObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onPhase(FlickerPhaseEvent event) {}

    @Override
    public void onRunCompleted(FlickerRunEvent event) {}

    @Override
    public void onTag(FlickerTagEvent event) {}

    @Override
    public void onError(FlickerErrorEvent event) {}
}
