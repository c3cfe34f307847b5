package com.questrail.flicker.observability;

import com.questrail.flicker.api.TraceArtifact;

import java.time.Instant;
import java.util.List;

/**
 * Record emitted after a tag snapshot has been written by every running monitor.
 */
public record FlickerTagEvent(
    Instant timestamp,
    String testName,
    int iteration,
    String tag,
    List<TraceArtifact> artifacts
) {
    public FlickerTagEvent {
        artifacts = List.copyOf(artifacts);
    }
}
