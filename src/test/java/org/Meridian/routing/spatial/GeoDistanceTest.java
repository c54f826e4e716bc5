package org.Meridian.routing.spatial;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("GeoDistance Tests")
class GeoDistanceTest {

    @Test
    @DisplayName("One hundredth of a degree along the equator is about 1112 m")
    void testHaversine() {
        double meters = GeoDistance.haversineMeters(0.0, 0.0, 0.0, 0.01);
        assertEquals(0.01 * GeoDistance.METERS_PER_DEGREE, meters, 1e-6);
        assertEquals(0.0, GeoDistance.haversineMeters(new GeoPoint(3, 4), new GeoPoint(3, 4)), 0.0);
        assertEquals(meters, GeoDistance.haversineMeters(new GeoPoint(0.01, 0.0), new GeoPoint(0.0, 0.0)), 1e-9);
    }

    @Test
    @DisplayName("Initial bearing covers the cardinal directions")
    void testBearing() {
        assertEquals(0.0, GeoDistance.initialBearingDegrees(0, 0, 1, 0), 1e-9);
        assertEquals(90.0, GeoDistance.initialBearingDegrees(0, 0, 0, 1), 1e-9);
        assertEquals(180.0, GeoDistance.initialBearingDegrees(1, 0, 0, 0), 1e-9);
        assertEquals(270.0, GeoDistance.initialBearingDegrees(0, 1, 0, 0), 1e-9);
    }

    @Test
    @DisplayName("Bearing difference folds into [0, 180]")
    void testBearingDifference() {
        assertEquals(20.0, GeoDistance.bearingDifferenceDegrees(350.0, 10.0), 1e-9);
        assertEquals(180.0, GeoDistance.bearingDifferenceDegrees(90.0, 270.0), 1e-9);
        assertEquals(0.0, GeoDistance.bearingDifferenceDegrees(45.0, 405.0), 1e-9);
    }

    @Test
    @DisplayName("Delta longitude normalizes across the antimeridian")
    void testNormalizeDeltaLongitude() {
        assertEquals(-20.0, GeoDistance.normalizeDeltaLongitudeDegrees(340.0), 1e-9);
        assertEquals(180.0, GeoDistance.normalizeDeltaLongitudeDegrees(-180.0), 1e-9);
    }
}
