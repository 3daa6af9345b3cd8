package org.walknav.routing.geo;

import lombok.experimental.UtilityClass;

/**
 * Great-circle primitives for campus-scale geometry.
 *
 * <p>No antimeridian handling: every input is expected to lie inside one bounded area.</p>
 */
@UtilityClass
public final class GeoUtils {
    public static final double EARTH_MEAN_RADIUS_METERS = 6_371_008.8d;
    /** Length of one degree of latitude on the mean sphere. */
    public static final double METERS_PER_DEGREE = EARTH_MEAN_RADIUS_METERS * Math.PI / 180.0d;

    private static final String[] CARDINALS = {
            "north", "northeast", "east", "southeast", "south", "southwest", "west", "northwest"
    };

    /**
     * Great-circle distance in meters using the haversine formulation.
     */
    public static double distance(Coordinate p1, Coordinate p2) {
        return greatCircleDistanceMeters(p1.lat(), p1.lon(), p2.lat(), p2.lon());
    }

    static double greatCircleDistanceMeters(double lat1Deg, double lon1Deg, double lat2Deg, double lon2Deg) {
        double lat1Rad = Math.toRadians(lat1Deg);
        double lat2Rad = Math.toRadians(lat2Deg);
        double deltaLatRad = Math.toRadians(lat2Deg - lat1Deg);
        double deltaLonRad = Math.toRadians(lon2Deg - lon1Deg);

        double sinHalfLat = Math.sin(deltaLatRad * 0.5d);
        double sinHalfLon = Math.sin(deltaLonRad * 0.5d);

        double a = sinHalfLat * sinHalfLat
                + Math.cos(lat1Rad) * Math.cos(lat2Rad) * sinHalfLon * sinHalfLon;
        double clampedA = clamp(a, 0.0d, 1.0d);
        double c = 2.0d * Math.asin(Math.sqrt(clampedA));
        return EARTH_MEAN_RADIUS_METERS * c;
    }

    /**
     * Forward azimuth from {@code from} toward {@code to}, in degrees {@code [0, 360)}.
     */
    public static double bearing(Coordinate from, Coordinate to) {
        double lat1Rad = Math.toRadians(from.lat());
        double lat2Rad = Math.toRadians(to.lat());
        double deltaLonRad = Math.toRadians(to.lon() - from.lon());

        double y = Math.sin(deltaLonRad) * Math.cos(lat2Rad);
        double x = Math.cos(lat1Rad) * Math.sin(lat2Rad)
                - Math.sin(lat1Rad) * Math.cos(lat2Rad) * Math.cos(deltaLonRad);
        return normalizeBearing(Math.toDegrees(Math.atan2(y, x)));
    }

    /**
     * Maps a bearing onto one of eight compass labels (45 degree sectors centred on each label).
     */
    public static String bearingToCardinal(double bearing) {
        int sector = (int) Math.round(normalizeBearing(bearing) / 45.0d) % CARDINALS.length;
        return CARDINALS[sector];
    }

    /**
     * Signed turn between an incoming and outgoing bearing, in {@code (-180, 180]}.
     * Positive values turn right (clockwise).
     */
    public static double turnAngle(double bearingIn, double bearingOut) {
        double shifted = (bearingOut - bearingIn + 180.0d) % 360.0d;
        if (shifted < 0.0d) {
            shifted += 360.0d;
        }
        double angle = shifted - 180.0d;
        if (angle == -180.0d) {
            return 180.0d;
        }
        return angle;
    }

    /**
     * Normalizes any finite angle into {@code [0, 360)}.
     */
    public static double normalizeBearing(double degrees) {
        double normalized = degrees % 360.0d;
        if (normalized < 0.0d) {
            normalized += 360.0d;
        }
        if (normalized >= 360.0d) {
            normalized -= 360.0d;
        }
        return normalized;
    }

    /**
     * Projects {@code point} onto segment {@code a -> b}.
     *
     * <p>The fraction is solved in a local equirectangular plane anchored at {@code a}, which is
     * accurate to well under a centimetre over campus-length segments. The reported distance is
     * the haversine distance between the point and its projection.</p>
     */
    public static SegmentProjection projectOntoSegment(Coordinate point, Coordinate a, Coordinate b) {
        double lonScale = Math.cos(Math.toRadians(a.lat()));
        double segX = (b.lon() - a.lon()) * lonScale;
        double segY = b.lat() - a.lat();
        double ptX = (point.lon() - a.lon()) * lonScale;
        double ptY = point.lat() - a.lat();

        double lengthSquared = segX * segX + segY * segY;
        double fraction = 0.0d;
        if (lengthSquared > 0.0d) {
            fraction = clamp((ptX * segX + ptY * segY) / lengthSquared, 0.0d, 1.0d);
        }

        Coordinate projected;
        if (fraction == 0.0d) {
            projected = a;
        } else if (fraction == 1.0d) {
            projected = b;
        } else {
            projected = new Coordinate(
                    a.lon() + fraction * (b.lon() - a.lon()),
                    a.lat() + fraction * (b.lat() - a.lat())
            );
        }
        return new SegmentProjection(projected, fraction, distance(point, projected));
    }

    /**
     * Approximate degrees of longitude spanned by {@code meters} at the given latitude.
     */
    public static double metersToLongitudeDegrees(double meters, double latitudeDeg) {
        double cos = Math.max(Math.cos(Math.toRadians(latitudeDeg)), 1e-6d);
        return meters / (METERS_PER_DEGREE * cos);
    }

    public static double metersToLatitudeDegrees(double meters) {
        return meters / METERS_PER_DEGREE;
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
