package com.questrail.flicker.monitor;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Test-only monitor that writes the entries recorded while it runs, one per line.
 *
 * Every trace starts with {@code start}; a full-run trace ends with {@code stop}.
 * Lifecycle calls are also appended to a shared journal so that tests can
 * assert their order relative to phase commands.
 */
public final class RecordingTransitionMonitor extends AbstractTransitionMonitor {

    private final List<String> journal;
    private final List<String> entries = new ArrayList<>();
    private boolean failOnStart;
    private boolean failOnStop;
    private boolean failOnSnapshot;

    public RecordingTransitionMonitor(String name, String fileSuffix, List<String> journal) {
        super(name, fileSuffix);
        this.journal = journal;
    }

    public RecordingTransitionMonitor failOnStart() {
        this.failOnStart = true;
        return this;
    }

    public RecordingTransitionMonitor failOnStop() {
        this.failOnStop = true;
        return this;
    }

    public RecordingTransitionMonitor failOnSnapshot() {
        this.failOnSnapshot = true;
        return this;
    }

    /**
     * Appends a state entry to the trace being captured.
     */
    public void record(String state) {
        if (!isRunning()) {
            throw new IllegalStateException(name() + " is not capturing");
        }
        entries.add(state);
    }

    @Override
    protected void onStart() throws IOException {
        if (failOnStart) {
            throw new IOException("trace service unavailable");
        }
        entries.clear();
        entries.add("start");
        journal.add(name() + ":start");
    }

    @Override
    protected Path onStop(Path destination) throws IOException {
        journal.add(name() + ":stop");
        entries.add("stop");
        if (failOnStop) {
            throw new IOException("trace buffer lost");
        }
        return Files.write(destination, entries);
    }

    @Override
    protected Path onSnapshot(Path destination) throws IOException {
        journal.add(name() + ":snapshot");
        if (failOnSnapshot) {
            throw new IOException("snapshot rejected");
        }
        return Files.write(destination, entries);
    }

    public static List<String> readTrace(Path path) {
        try {
            return Files.readAllLines(path);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
