package org.Meridian.routing.spatial;

/**
 * Immutable geographic coordinate in degrees.
 *
 * @param lon longitude (x axis of the spatial grid).
 * @param lat latitude (y axis of the spatial grid).
 */
public record GeoPoint(double lon, double lat) {

    /**
     * Returns whether both components are finite numbers.
     */
    public boolean isFinite() {
        return Double.isFinite(lon) && Double.isFinite(lat);
    }

    @Override
    public String toString() {
        return String.format("(%.6f, %.6f)", lon, lat);
    }
}
