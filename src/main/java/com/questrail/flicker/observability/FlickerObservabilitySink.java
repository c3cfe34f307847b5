package com.questrail.flicker.observability;

/**
 * Main interface for receiving harness observability events.
 * Implementations can provide logging, metrics, or tracing.
 */
public interface FlickerObservabilitySink {
    /**
     * Called when a phase of the test cycle begins.
     * @param event the phase details
     */
    void onPhase(FlickerPhaseEvent event);

    /**
     * Called when a repetition has completed.
     * @param event the completed run
     */
    void onRunCompleted(FlickerRunEvent event);

    /**
     * Called when a tag snapshot has been captured.
     * @param event the tag details
     */
    void onTag(FlickerTagEvent event);

    /**
     * Called when a phase failed and the execution was aborted.
     * @param event the error event
     */
    void onError(FlickerErrorEvent event);
}
