package org.walknav.routing.geo;

/**
 * WGS84 position in degrees, longitude first (GeoJSON order).
 *
 * <p>Equality is exact component equality. The graph builder relies on this to merge
 * shared polyline endpoints into one node without any tolerance.</p>
 */
public record Coordinate(double lon, double lat) {

    public static Coordinate of(double lon, double lat) {
        return new Coordinate(lon, lat);
    }

    /**
     * Returns whether both components are finite and inside WGS84 ranges.
     */
    public boolean isValid() {
        return Double.isFinite(lon) && Double.isFinite(lat)
                && lon >= -180.0d && lon <= 180.0d
                && lat >= -90.0d && lat <= 90.0d;
    }

    @Override
    public String toString() {
        return String.format("(%.7f, %.7f)", lon, lat);
    }
}
