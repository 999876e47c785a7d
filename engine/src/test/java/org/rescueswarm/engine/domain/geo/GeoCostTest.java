package org.rescueswarm.engine.domain.geo;

import org.rescueswarm.engine.domain.model.DispatchConfig;
import org.rescueswarm.engine.domain.model.GeoPoint;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("GeoCost Tests")
class GeoCostTest {

    // One degree along a great circle on the mean-radius sphere.
    private static final double ONE_DEGREE_METERS = 2 * Math.PI * GeoCost.EARTH_RADIUS_METERS / 360.0;

    @Test
    @DisplayName("Distance between identical points is zero")
    void testZeroDistance() {
        GeoPoint p = GeoPoint.of(48.8566, 2.3522);
        assertEquals(0.0, GeoCost.distanceMeters(p, p));
        assertEquals(0.0, GeoCost.distanceMeters(p, GeoPoint.of(48.8566, 2.3522)));
    }

    @Test
    @DisplayName("One degree of longitude on the equator matches the great-circle arc")
    void testEquatorDegree() {
        double d = GeoCost.distanceMeters(GeoPoint.of(0, 0), GeoPoint.of(0, 1));
        assertEquals(ONE_DEGREE_METERS, d, 0.5);
    }

    @Test
    @DisplayName("Distance is symmetric and non-negative")
    void testSymmetry() {
        GeoPoint a = GeoPoint.of(45.75, 4.85);
        GeoPoint b = GeoPoint.of(45.19, 5.72);
        double ab = GeoCost.distanceMeters(a, b);
        double ba = GeoCost.distanceMeters(b, a);
        assertTrue(ab > 0);
        assertEquals(ab, ba, 1e-9);
    }

    @Test
    @DisplayName("Antipodal points stay finite")
    void testAntipodal() {
        double d = GeoCost.distanceMeters(GeoPoint.of(0, 0), GeoPoint.of(0, 180));
        assertTrue(Double.isFinite(d));
        assertEquals(Math.PI * GeoCost.EARTH_RADIUS_METERS, d, 1.0);
    }

    @Test
    @DisplayName("Path distance sums consecutive legs without a return leg")
    void testPathDistance() {
        GeoPoint start = GeoPoint.of(0, 0);
        GeoPoint first = GeoPoint.of(0, 1);
        GeoPoint second = GeoPoint.of(0, 2);

        double path = GeoCost.pathDistanceMeters(start, Arrays.asList(first, second));
        assertEquals(2 * ONE_DEGREE_METERS, path, 1.0);
        assertEquals(0.0, GeoCost.pathDistanceMeters(start, Collections.emptyList()));
    }

    @Test
    @DisplayName("Travel time and reach are inverse at the configured speed")
    void testTravelTime() {
        GeoCost cost = new GeoCost(2.0);
        assertEquals(50.0, cost.travelTimeSeconds(100.0), 1e-9);
        assertEquals(100.0, cost.reachMeters(50.0), 1e-9);
        assertEquals(2.0, cost.getSpeedMetersPerSecond());
    }

    @Test
    @DisplayName("Default speed comes from DispatchConfig")
    void testFromConfig() {
        GeoCost cost = GeoCost.from(DispatchConfig.defaults());
        assertEquals(DispatchConfig.DEFAULT_TRAVEL_SPEED_MPS, cost.getSpeedMetersPerSecond(), 1e-12);
        assertEquals(3600.0, cost.travelTimeSeconds(5000.0), 1e-6);
    }

    @Test
    @DisplayName("Speed must be positive and finite")
    void testSpeedValidation() {
        assertThrows(IllegalArgumentException.class, () -> new GeoCost(0.0));
        assertThrows(IllegalArgumentException.class, () -> new GeoCost(-1.0));
        assertThrows(IllegalArgumentException.class, () -> new GeoCost(Double.NaN));
        assertThrows(IllegalArgumentException.class, () -> new GeoCost(Double.POSITIVE_INFINITY));
    }
}
