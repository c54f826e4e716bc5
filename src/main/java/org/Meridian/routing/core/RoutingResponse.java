package org.Meridian.routing.core;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.Meridian.routing.spatial.GeoPoint;

import java.util.List;

/**
 * Client-facing point-to-point route response.
 *
 * <p>{@code geometry} is empty when geometry output was disabled. When
 * {@code turnRestrictionFallback=true} the route was recomputed by a turn-restricted search
 * because the hierarchy route crossed a forbidden transition.</p>
 */
@Value
@Builder
public class RoutingResponse {
    /** Route length in meters. */
    double distance;
    /** Sum of edge weights, plus turn penalties when requested. */
    double duration;
    /** Node coordinates from origin to destination node. */
    @Singular("geometryPoint")
    List<GeoPoint> geometry;
    /** Traversed edges in order. */
    @Singular
    List<RouteSegment> segments;
    /** Snapped origin and destination. */
    @Singular
    List<Waypoint> waypoints;
    /** Nodes or edge states settled while searching. */
    int settledNodes;
    /** Search algorithm that produced the final path. */
    String algorithm;
    /** Whether the turn-restricted fallback search produced the path. */
    boolean turnRestrictionFallback;

    /**
     * Returns traversed edge ids in order.
     */
    public int[] edgeIds() {
        int[] ids = new int[segments.size()];
        for (int i = 0; i < ids.length; i++) {
            ids[i] = segments.get(i).edgeId();
        }
        return ids;
    }
}
