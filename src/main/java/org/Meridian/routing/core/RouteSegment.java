package org.Meridian.routing.core;

/**
 * One traversed graph edge of a route.
 *
 * @param edgeId graph edge id.
 * @param fromNode edge source.
 * @param toNode edge target.
 * @param distanceMeters edge length.
 * @param duration edge weight.
 */
public record RouteSegment(int edgeId, int fromNode, int toNode, double distanceMeters, double duration) {
}
