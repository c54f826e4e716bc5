package org.Meridian.routing.core;

import org.Meridian.routing.spatial.GeoPoint;

/**
 * Requested coordinate together with the graph node it snapped to.
 *
 * @param input coordinate supplied by the client.
 * @param nodeId snapped node id.
 * @param location snapped node coordinate.
 * @param snapDistanceMeters haversine distance between input and location.
 */
public record Waypoint(GeoPoint input, int nodeId, GeoPoint location, double snapDistanceMeters) {
}
