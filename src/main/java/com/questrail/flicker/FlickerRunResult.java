package com.questrail.flicker;

import com.questrail.flicker.api.TraceArtifact;
import com.questrail.flicker.runner.PhaseExecutionException;
import com.questrail.flicker.runner.TransitionPhase;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * FlickerRunResult
 * -----------------------------------------------------------------------------
 * Outcome of one repetition: the traces captured by each monitor, the tag
 * snapshots taken during the transition, the janky-frame count, and the error
 * that ended the run early, if any.
 *
 * <p>Instances are assembled by the runner through {@link Builder} while the
 * run is in progress and are immutable once built. A run is never retried in
 * place; a new execution produces new runs.</p>
 */
public final class FlickerRunResult
{
    private final int iteration;
    private final RunStatus status;
    private final List<TraceArtifact> traces;
    private final Map<String, List<TraceArtifact>> tags;
    private final Throwable error;
    private final TransitionPhase failedPhase;
    private final Integer jankyFrames;
    private final Instant startedAt;
    private final Instant finishedAt;

    private FlickerRunResult(Builder builder) {
        this.iteration = builder.iteration;
        this.traces = List.copyOf(builder.traces);
        Map<String, List<TraceArtifact>> tagCopy = new LinkedHashMap<>();
        for (Map.Entry<String, List<TraceArtifact>> entry : builder.tags.entrySet()) {
            tagCopy.put(entry.getKey(), List.copyOf(entry.getValue()));
        }
        this.tags = Collections.unmodifiableMap(tagCopy);
        this.error = builder.error;
        this.failedPhase = builder.failedPhase;
        this.jankyFrames = builder.jankyFrames;
        this.startedAt = Objects.requireNonNull(builder.startedAt, "startedAt");
        this.finishedAt = Objects.requireNonNull(builder.finishedAt, "finishedAt");
        if (error == null) {
            this.status = RunStatus.SUCCESS;
        } else if (failedPhase != null && failedPhase.isMonitorPhase()) {
            this.status = RunStatus.CRASH;
        } else {
            this.status = RunStatus.TRANSITION_ERROR;
        }
    }

    public static Builder builder(int iteration) {
        return new Builder(iteration);
    }

    public int iteration() {
        return iteration;
    }

    public RunStatus status() {
        return status;
    }

    public boolean isSuccessful() {
        return status == RunStatus.SUCCESS;
    }

    /**
     * Full-run traces, one per monitor, in monitor order.
     */
    public List<TraceArtifact> traces() {
        return traces;
    }

    public Optional<TraceArtifact> trace(String monitor) {
        return traces.stream().filter(t -> t.monitor().equals(monitor)).findFirst();
    }

    /**
     * Tag snapshots keyed by tag name, in creation order.
     */
    public Map<String, List<TraceArtifact>> tags() {
        return tags;
    }

    public Optional<TraceArtifact> tag(String tag, String monitor) {
        return tags.getOrDefault(tag, List.of()).stream()
            .filter(t -> t.monitor().equals(monitor))
            .findFirst();
    }

    public Optional<Throwable> error() {
        return Optional.ofNullable(error);
    }

    public Optional<TransitionPhase> failedPhase() {
        return Optional.ofNullable(failedPhase);
    }

    /**
     * Janky frames counted during the transition, when a frame-stats monitor was configured.
     */
    public OptionalInt jankyFrames() {
        return jankyFrames == null ? OptionalInt.empty() : OptionalInt.of(jankyFrames);
    }

    public boolean isJanky() {
        return jankyFrames != null && jankyFrames > 0;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public Instant finishedAt() {
        return finishedAt;
    }

    /**
     * All files written for this run: full-run traces followed by tag snapshots.
     */
    public List<Path> artifactPaths() {
        List<Path> paths = new ArrayList<>();
        for (TraceArtifact trace : traces) {
            paths.add(trace.path());
        }
        for (List<TraceArtifact> tagArtifacts : tags.values()) {
            for (TraceArtifact artifact : tagArtifacts) {
                paths.add(artifact.path());
            }
        }
        return paths;
    }

    /**
     * Deletes every artifact of this run from disk. Missing files are ignored.
     *
     * @throws UncheckedIOException if a file exists but cannot be deleted
     */
    public void cleanUp() {
        for (Path path : artifactPaths()) {
            try {
                Files.deleteIfExists(path);
            } catch (IOException e) {
                throw new UncheckedIOException("Unable to delete trace artifact " + path, e);
            }
        }
    }

    @Override
    public String toString() {
        return "Run#" + iteration + "(" + status + ", traces=" + traces.size() + ", tags=" + tags.keySet() + ")";
    }

    public static final class Builder {
        private final int iteration;
        private final List<TraceArtifact> traces = new ArrayList<>();
        private final Map<String, List<TraceArtifact>> tags = new LinkedHashMap<>();
        private Throwable error;
        private TransitionPhase failedPhase;
        private Integer jankyFrames;
        private Instant startedAt;
        private Instant finishedAt;

        private Builder(int iteration) {
            if (iteration < 0) {
                throw new IllegalArgumentException("iteration must be >= 0");
            }
            this.iteration = iteration;
        }

        public int iteration() {
            return iteration;
        }

        public Builder startedAt(Instant startedAt) {
            this.startedAt = Objects.requireNonNull(startedAt, "startedAt");
            return this;
        }

        public Builder finishedAt(Instant finishedAt) {
            this.finishedAt = Objects.requireNonNull(finishedAt, "finishedAt");
            return this;
        }

        public Builder addTrace(TraceArtifact trace) {
            traces.add(Objects.requireNonNull(trace, "trace"));
            return this;
        }

        public boolean hasTag(String tag) {
            return tags.containsKey(tag);
        }

        public Builder addTag(String tag, List<TraceArtifact> artifacts) {
            Objects.requireNonNull(tag, "tag");
            if (tags.containsKey(tag)) {
                throw new IllegalArgumentException("Tag '" + tag + "' already exists in run " + iteration);
            }
            tags.put(tag, List.copyOf(artifacts));
            return this;
        }

        public Builder jankyFrames(int count) {
            if (count < 0) {
                throw new IllegalArgumentException("janky frame count must be >= 0");
            }
            this.jankyFrames = count;
            return this;
        }

        public Builder failed(PhaseExecutionException error) {
            this.error = Objects.requireNonNull(error, "error");
            this.failedPhase = error.phase();
            return this;
        }

        public FlickerRunResult build() {
            return new FlickerRunResult(this);
        }
    }
}
