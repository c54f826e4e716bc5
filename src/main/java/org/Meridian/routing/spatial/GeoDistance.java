package org.Meridian.routing.spatial;

import lombok.experimental.UtilityClass;

/**
 * Numeric helpers for great-circle geometry on node coordinates.
 */
@UtilityClass
public final class GeoDistance {
    public static final double EARTH_MEAN_RADIUS_METERS = 6_371_008.8d;
    /** Meridian arc length of one degree of latitude. */
    public static final double METERS_PER_DEGREE = EARTH_MEAN_RADIUS_METERS * Math.PI / 180.0d;

    /**
     * Computes great-circle distance in meters using haversine formulation.
     */
    public static double haversineMeters(double lat1Deg, double lon1Deg, double lat2Deg, double lon2Deg) {
        double lat1Rad = Math.toRadians(lat1Deg);
        double lat2Rad = Math.toRadians(lat2Deg);
        double deltaLatRad = Math.toRadians(lat2Deg - lat1Deg);
        double deltaLonRad = Math.toRadians(normalizeDeltaLongitudeDegrees(lon2Deg - lon1Deg));

        double sinHalfLat = Math.sin(deltaLatRad * 0.5d);
        double sinHalfLon = Math.sin(deltaLonRad * 0.5d);

        double a = sinHalfLat * sinHalfLat
                + Math.cos(lat1Rad) * Math.cos(lat2Rad) * sinHalfLon * sinHalfLon;
        double c = 2.0d * Math.asin(Math.sqrt(clamp(a, 0.0d, 1.0d)));
        return EARTH_MEAN_RADIUS_METERS * c;
    }

    public static double haversineMeters(GeoPoint a, GeoPoint b) {
        return haversineMeters(a.lat(), a.lon(), b.lat(), b.lon());
    }

    /**
     * Computes initial great-circle bearing from the first to the second point.
     *
     * @return bearing in degrees, clockwise from north, in {@code [0, 360)}.
     */
    public static double initialBearingDegrees(double lat1Deg, double lon1Deg, double lat2Deg, double lon2Deg) {
        double lat1Rad = Math.toRadians(lat1Deg);
        double lat2Rad = Math.toRadians(lat2Deg);
        double deltaLonRad = Math.toRadians(normalizeDeltaLongitudeDegrees(lon2Deg - lon1Deg));

        double y = Math.sin(deltaLonRad) * Math.cos(lat2Rad);
        double x = Math.cos(lat1Rad) * Math.sin(lat2Rad)
                - Math.sin(lat1Rad) * Math.cos(lat2Rad) * Math.cos(deltaLonRad);
        double bearing = Math.toDegrees(Math.atan2(y, x));
        double normalized = (bearing + 360.0d) % 360.0d;
        return normalized == 360.0d ? 0.0d : normalized;
    }

    /**
     * Returns the absolute angle between two bearings folded into {@code [0, 180]}.
     */
    public static double bearingDifferenceDegrees(double bearingA, double bearingB) {
        double diff = Math.abs(bearingA - bearingB) % 360.0d;
        return diff > 180.0d ? 360.0d - diff : diff;
    }

    /**
     * Normalizes delta-longitude into the principal range {@code (-180, 180]}.
     */
    static double normalizeDeltaLongitudeDegrees(double deltaLonDeg) {
        double normalized = ((deltaLonDeg + 540.0d) % 360.0d) - 180.0d;
        if (normalized == -180.0d) {
            return 180.0d;
        }
        return normalized;
    }

    private static double clamp(double value, double min, double max) {
        if (value < min) {
            return min;
        }
        if (value > max) {
            return max;
        }
        return value;
    }
}
