package org.Meridian.routing.graph;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Descriptive metadata carried alongside a graph and persisted with it.
 */
@Value
@Builder(toBuilder = true)
public class GraphMetadata {
    /** Build timestamp, {@code null} when unknown. */
    Instant createdAt;
    /** Free-form label of the data source (e.g. an extract name). */
    String source;
    /** Bounds over all node coordinates, {@code null} for an empty graph. */
    GeoBounds bounds;

    public static GraphMetadata empty() {
        return GraphMetadata.builder().build();
    }
}
