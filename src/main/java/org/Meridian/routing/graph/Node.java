package org.Meridian.routing.graph;

import org.Meridian.routing.spatial.GeoPoint;

/**
 * Read-only view of one graph node.
 *
 * @param id dense zero-based node id.
 * @param lon longitude in degrees.
 * @param lat latitude in degrees.
 * @param elevation elevation in meters, {@link Double#NaN} when unknown.
 */
public record Node(int id, double lon, double lat, double elevation) {

    public boolean hasElevation() {
        return !Double.isNaN(elevation);
    }

    public GeoPoint location() {
        return new GeoPoint(lon, lat);
    }
}
