package com.questrail.flicker.monitor;

import java.nio.file.Path;

/**
 * TransitionMonitor
 * -----------------------------------------------------------------------------
 * Capability that captures a trace of device state around a transition.
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *   monitor.start()            → capture begins
 *   monitor.snapshot(path)     → zero or more point-in-time snapshots (tags)
 *   monitor.stop(path)         → capture ends, trace written to path
 * </pre>
 *
 * A monitor is started and stopped exactly once per run. The harness decides
 * where artifacts go; the monitor decides what goes in them. The returned path
 * is the file that was actually written and may differ from the requested one
 * (for example when the monitor appends a compression extension).
 */
public interface TransitionMonitor
{
    /**
     * Stable identifier of this monitor, unique within one test.
     */
    String name();

    /**
     * Suffix appended to the artifact base name, e.g. {@code "_wm_trace.pb"}.
     * Must be unique within one test so that artifacts of different monitors
     * do not overwrite each other.
     */
    String fileSuffix();

    void start();

    /**
     * Stops capturing and writes the trace.
     *
     * @param destination requested artifact location
     * @return the file that was written
     */
    Path stop(Path destination);

    /**
     * Writes a snapshot of the current state without stopping the capture.
     *
     * @param destination requested artifact location
     * @return the file that was written
     */
    Path snapshot(Path destination);

    boolean isRunning();
}
