package org.walknav.routing.geo;

/**
 * Axis-aligned lon/lat rectangle, bounds inclusive.
 */
public record BoundingBox(double minLon, double minLat, double maxLon, double maxLat) {

    public BoundingBox {
        if (!(Double.isFinite(minLon) && Double.isFinite(minLat)
                && Double.isFinite(maxLon) && Double.isFinite(maxLat))) {
            throw new IllegalArgumentException("bounding box corners must be finite");
        }
        if (minLon > maxLon || minLat > maxLat) {
            throw new IllegalArgumentException(
                    "bounding box min must not exceed max: " + minLon + "," + minLat + " / " + maxLon + "," + maxLat);
        }
    }

    public boolean contains(Coordinate point) {
        return point.lon() >= minLon && point.lon() <= maxLon
                && point.lat() >= minLat && point.lat() <= maxLat;
    }

    /**
     * Returns this box grown by {@code meters} on every side.
     */
    public BoundingBox expandedBy(double meters) {
        double dLat = GeoUtils.metersToLatitudeDegrees(meters);
        double widestLat = Math.max(Math.abs(minLat), Math.abs(maxLat));
        double dLon = GeoUtils.metersToLongitudeDegrees(meters, widestLat);
        return new BoundingBox(
                Math.max(-180.0d, minLon - dLon),
                Math.max(-90.0d, minLat - dLat),
                Math.min(180.0d, maxLon + dLon),
                Math.min(90.0d, maxLat + dLat)
        );
    }

    public double centerLat() {
        return (minLat + maxLat) * 0.5d;
    }
}
