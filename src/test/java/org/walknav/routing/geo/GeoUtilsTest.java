package org.walknav.routing.geo;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("GeoUtils Tests")
class GeoUtilsTest {

    private static final Coordinate ORIGIN = new Coordinate(7.40, 9.05);

    @Test
    @DisplayName("One degree of latitude spans the mean-sphere arc length")
    void testDistanceOneDegreeLatitude() {
        double meters = GeoUtils.distance(new Coordinate(0.0, 0.0), new Coordinate(0.0, 1.0));
        assertEquals(GeoUtils.METERS_PER_DEGREE, meters, 1e-6);
        assertEquals(111_195.08, meters, 0.01);
    }

    @Test
    @DisplayName("Distance is zero for identical points and symmetric")
    void testDistanceSymmetry() {
        Coordinate other = new Coordinate(7.41, 9.06);
        assertEquals(0.0, GeoUtils.distance(ORIGIN, ORIGIN), 0.0);
        assertEquals(GeoUtils.distance(ORIGIN, other), GeoUtils.distance(other, ORIGIN), 1e-9);
    }

    @Test
    @DisplayName("Bearing follows compass convention")
    void testBearingCardinalDirections() {
        Coordinate north = new Coordinate(ORIGIN.lon(), ORIGIN.lat() + 0.001);
        Coordinate east = new Coordinate(ORIGIN.lon() + 0.001, ORIGIN.lat());
        Coordinate south = new Coordinate(ORIGIN.lon(), ORIGIN.lat() - 0.001);
        Coordinate west = new Coordinate(ORIGIN.lon() - 0.001, ORIGIN.lat());

        assertEquals(0.0, GeoUtils.bearing(ORIGIN, north), 1e-9);
        assertEquals(90.0, GeoUtils.bearing(ORIGIN, east), 0.01);
        assertEquals(180.0, GeoUtils.bearing(ORIGIN, south), 1e-9);
        assertEquals(270.0, GeoUtils.bearing(ORIGIN, west), 0.01);
    }

    @Test
    @DisplayName("Bearing is always inside [0, 360)")
    void testBearingRange() {
        for (int i = 0; i < 360; i += 7) {
            double rad = Math.toRadians(i);
            Coordinate target = new Coordinate(ORIGIN.lon() + 0.001 * Math.sin(rad), ORIGIN.lat() + 0.001 * Math.cos(rad));
            double bearing = GeoUtils.bearing(ORIGIN, target);
            assertTrue(bearing >= 0.0 && bearing < 360.0, "bearing out of range: " + bearing);
        }
    }

    @Test
    @DisplayName("Cardinal labels cover 45 degree sectors centred on each label")
    void testBearingToCardinal() {
        assertEquals("north", GeoUtils.bearingToCardinal(0.0));
        assertEquals("north", GeoUtils.bearingToCardinal(22.4));
        assertEquals("northeast", GeoUtils.bearingToCardinal(22.5));
        assertEquals("east", GeoUtils.bearingToCardinal(90.0));
        assertEquals("southeast", GeoUtils.bearingToCardinal(135.0));
        assertEquals("south", GeoUtils.bearingToCardinal(180.0));
        assertEquals("southwest", GeoUtils.bearingToCardinal(225.0));
        assertEquals("west", GeoUtils.bearingToCardinal(270.0));
        assertEquals("northwest", GeoUtils.bearingToCardinal(315.0));
        assertEquals("north", GeoUtils.bearingToCardinal(337.5));
        assertEquals("north", GeoUtils.bearingToCardinal(359.9));
        assertEquals("west", GeoUtils.bearingToCardinal(-90.0));
    }

    @Test
    @DisplayName("Turn angle is signed, right positive, in (-180, 180]")
    void testTurnAngle() {
        assertEquals(90.0, GeoUtils.turnAngle(0.0, 90.0), 1e-9);
        assertEquals(-90.0, GeoUtils.turnAngle(0.0, 270.0), 1e-9);
        assertEquals(20.0, GeoUtils.turnAngle(350.0, 10.0), 1e-9);
        assertEquals(-20.0, GeoUtils.turnAngle(10.0, 350.0), 1e-9);
        assertEquals(0.0, GeoUtils.turnAngle(123.0, 123.0), 1e-9);
        assertEquals(180.0, GeoUtils.turnAngle(0.0, 180.0), 1e-9);
        assertEquals(180.0, GeoUtils.turnAngle(180.0, 0.0), 1e-9);
        assertEquals(180.0, GeoUtils.turnAngle(90.0, 270.0), 1e-9);
    }

    @Test
    @DisplayName("Projection clamps to segment endpoints")
    void testProjectOntoSegmentClamps() {
        Coordinate a = ORIGIN;
        Coordinate b = new Coordinate(ORIGIN.lon(), ORIGIN.lat() + 0.001);

        SegmentProjection before = GeoUtils.projectOntoSegment(new Coordinate(a.lon(), a.lat() - 0.001), a, b);
        assertEquals(0.0, before.fraction(), 0.0);
        assertEquals(a, before.point());

        SegmentProjection after = GeoUtils.projectOntoSegment(new Coordinate(b.lon(), b.lat() + 0.001), a, b);
        assertEquals(1.0, after.fraction(), 0.0);
        assertEquals(b, after.point());
    }

    @Test
    @DisplayName("Projection of a perpendicular offset lands mid-segment")
    void testProjectOntoSegmentMidpoint() {
        Coordinate a = ORIGIN;
        Coordinate b = new Coordinate(ORIGIN.lon(), ORIGIN.lat() + 0.001);
        Coordinate east = new Coordinate(ORIGIN.lon() + 0.0001, ORIGIN.lat() + 0.0005);

        SegmentProjection projection = GeoUtils.projectOntoSegment(east, a, b);
        assertEquals(0.5, projection.fraction(), 1e-9);
        assertEquals(GeoUtils.distance(east, projection.point()), projection.distanceMeters(), 1e-9);
        assertEquals(10.98, projection.distanceMeters(), 0.01);
    }

    @Test
    @DisplayName("Degenerate segment projects onto its single point")
    void testProjectOntoDegenerateSegment() {
        Coordinate other = new Coordinate(ORIGIN.lon() + 0.001, ORIGIN.lat());
        SegmentProjection projection = GeoUtils.projectOntoSegment(other, ORIGIN, ORIGIN);
        assertEquals(0.0, projection.fraction(), 0.0);
        assertEquals(GeoUtils.distance(other, ORIGIN), projection.distanceMeters(), 1e-9);
    }

    @Test
    @DisplayName("Bounding box expansion grows every side")
    void testBoundingBoxExpansion() {
        BoundingBox box = new BoundingBox(7.40, 9.05, 7.41, 9.06);
        BoundingBox grown = box.expandedBy(100.0);
        assertTrue(grown.minLon() < box.minLon());
        assertTrue(grown.maxLat() > box.maxLat());
        assertTrue(grown.contains(new Coordinate(7.4005, 9.0500 - GeoUtils.metersToLatitudeDegrees(99.0))));
        assertFalse(grown.contains(new Coordinate(7.4005, 9.0500 - GeoUtils.metersToLatitudeDegrees(101.0))));
        assertThrows(IllegalArgumentException.class, () -> new BoundingBox(1.0, 0.0, 0.0, 1.0));
    }
}
