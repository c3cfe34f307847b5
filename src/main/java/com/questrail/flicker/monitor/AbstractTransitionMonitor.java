package com.questrail.flicker.monitor;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * AbstractTransitionMonitor
 * -----------------------------------------------------------------------------
 * Base implementation of {@link TransitionMonitor} that owns the start/stop
 * bookkeeping so that concrete monitors only deal with capture itself.
 *
 * <h2>What this class enforces</h2>
 * <ul>
 *   <li>{@link #start()} is rejected while already running</li>
 *   <li>{@link #stop(Path)} and {@link #snapshot(Path)} are rejected while stopped</li>
 *   <li>A monitor is considered stopped after {@link #stop(Path)} even when
 *       writing the trace failed, so the next run can start it again</li>
 *   <li>I/O failures of subclasses surface as {@link MonitorException}</li>
 * </ul>
 *
 * <h2>Threading model</h2>
 * Monitors are driven by the single thread executing the transition. No
 * synchronization is performed.
 */
public abstract class AbstractTransitionMonitor implements TransitionMonitor
{
    private final String name;
    private final String fileSuffix;
    private boolean running;

    protected AbstractTransitionMonitor(String name, String fileSuffix) {
        this.name = Objects.requireNonNull(name, "name");
        this.fileSuffix = Objects.requireNonNull(fileSuffix, "fileSuffix");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
    }

    @Override
    public final String name() {
        return name;
    }

    @Override
    public final String fileSuffix() {
        return fileSuffix;
    }

    @Override
    public final boolean isRunning() {
        return running;
    }

    @Override
    public final void start() {
        if (running) {
            throw new IllegalStateException("Monitor " + name + " is already running");
        }
        try {
            onStart();
        } catch (IOException e) {
            throw new MonitorException("Unable to start monitor " + name, e);
        }
        running = true;
    }

    @Override
    public final Path stop(Path destination) {
        Objects.requireNonNull(destination, "destination");
        if (!running) {
            throw new IllegalStateException("Monitor " + name + " is not running");
        }
        running = false;
        try {
            return onStop(destination);
        } catch (IOException e) {
            throw new MonitorException("Unable to write trace of monitor " + name + " to " + destination, e);
        }
    }

    @Override
    public final Path snapshot(Path destination) {
        Objects.requireNonNull(destination, "destination");
        if (!running) {
            throw new IllegalStateException("Monitor " + name + " is not running");
        }
        try {
            return onSnapshot(destination);
        } catch (IOException e) {
            throw new MonitorException("Unable to write snapshot of monitor " + name + " to " + destination, e);
        }
    }

    protected abstract void onStart() throws IOException;

    /**
     * Ends the capture and writes it to {@code destination}.
     *
     * @return the file actually written
     */
    protected abstract Path onStop(Path destination) throws IOException;

    /**
     * Writes the state captured so far to {@code destination}. Capture continues.
     *
     * @return the file actually written
     */
    protected abstract Path onSnapshot(Path destination) throws IOException;

    @Override
    public String toString() {
        return name;
    }
}
