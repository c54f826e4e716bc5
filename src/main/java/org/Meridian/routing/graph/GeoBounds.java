package org.Meridian.routing.graph;

/**
 * Axis-aligned geographic bounding box in degrees.
 */
public record GeoBounds(double minLon, double minLat, double maxLon, double maxLat) {

    /**
     * Computes bounds over parallel coordinate arrays, or {@code null} for an empty array.
     */
    static GeoBounds of(double[] lon, double[] lat) {
        if (lon.length == 0) {
            return null;
        }
        double minLon = Double.POSITIVE_INFINITY;
        double minLat = Double.POSITIVE_INFINITY;
        double maxLon = Double.NEGATIVE_INFINITY;
        double maxLat = Double.NEGATIVE_INFINITY;
        for (int i = 0; i < lon.length; i++) {
            minLon = Math.min(minLon, lon[i]);
            maxLon = Math.max(maxLon, lon[i]);
            minLat = Math.min(minLat, lat[i]);
            maxLat = Math.max(maxLat, lat[i]);
        }
        return new GeoBounds(minLon, minLat, maxLon, maxLat);
    }

    public boolean contains(double lon, double lat) {
        return lon >= minLon && lon <= maxLon && lat >= minLat && lat <= maxLat;
    }
}
