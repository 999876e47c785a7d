package org.rescueswarm.engine.domain.geo;

import org.rescueswarm.engine.domain.model.DispatchConfig;
import org.rescueswarm.engine.domain.model.GeoPoint;

import java.util.List;

/**
 * Great-circle distances and travel-time conversion on a spherical Earth.
 */
public final class GeoCost {

    public static final double EARTH_RADIUS_METERS = 6_371_000.0;

    private final double speedMetersPerSecond;

    public GeoCost(double speedMetersPerSecond) {
        if (!(speedMetersPerSecond > 0.0) || Double.isInfinite(speedMetersPerSecond)) {
            throw new IllegalArgumentException("speedMetersPerSecond must be positive and finite");
        }
        this.speedMetersPerSecond = speedMetersPerSecond;
    }

    public static GeoCost from(DispatchConfig config) {
        return new GeoCost(config.getTravelSpeedMetersPerSecond());
    }

    /**
     * Haversine distance between two points, in meters.
     */
    public static double distanceMeters(GeoPoint a, GeoPoint b) {
        if (a.equals(b)) {
            return 0.0;
        }
        double lat1 = Math.toRadians(a.getLatitude());
        double lat2 = Math.toRadians(b.getLatitude());
        double dLat = lat2 - lat1;
        double dLon = Math.toRadians(b.getLongitude() - a.getLongitude());
        double h = Math.sin(dLat / 2) * Math.sin(dLat / 2)
                + Math.cos(lat1) * Math.cos(lat2) * Math.sin(dLon / 2) * Math.sin(dLon / 2);
        // clamp guards asin against rounding just above 1 for antipodal points
        double c = 2 * Math.asin(Math.sqrt(Math.min(1.0, h)));
        return EARTH_RADIUS_METERS * c;
    }

    /**
     * Length of an open path from {@code start} through {@code stops} in order. No return leg.
     */
    public static double pathDistanceMeters(GeoPoint start, List<GeoPoint> stops) {
        double total = 0.0;
        GeoPoint previous = start;
        for (GeoPoint stop : stops) {
            total += distanceMeters(previous, stop);
            previous = stop;
        }
        return total;
    }

    public double travelTimeSeconds(double meters) {
        return meters / speedMetersPerSecond;
    }

    /**
     * Longest distance that fits into the given time at the configured speed.
     */
    public double reachMeters(double seconds) {
        return seconds * speedMetersPerSecond;
    }

    public double getSpeedMetersPerSecond() {
        return speedMetersPerSecond;
    }
}
