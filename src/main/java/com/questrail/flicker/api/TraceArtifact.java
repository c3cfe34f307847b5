package com.questrail.flicker.api;

import java.nio.file.Path;
import java.util.Objects;

/**
 * A trace file produced by one monitor for one repetition.
 *
 * <p>Full-run artifacts have a {@code null} tag. Tag artifacts carry the name of the tag
 * under which the point-in-time snapshot was taken.</p>
 */
public record TraceArtifact(
    String monitor,
    int iteration,
    String tag,
    Path path
) {
    public TraceArtifact {
        Objects.requireNonNull(monitor, "monitor");
        Objects.requireNonNull(path, "path");
        if (iteration < 0) {
            throw new IllegalArgumentException("iteration must be >= 0");
        }
    }

    public static TraceArtifact ofRun(String monitor, int iteration, Path path) {
        return new TraceArtifact(monitor, iteration, null, path);
    }

    public static TraceArtifact ofTag(String monitor, int iteration, String tag, Path path) {
        return new TraceArtifact(monitor, iteration, Objects.requireNonNull(tag, "tag"), path);
    }
}
