package org.walknav.routing.geo;

/**
 * Result of projecting a point onto one segment.
 *
 * @param point projected coordinate on the segment.
 * @param fraction clamped position along the segment in {@code [0, 1]}.
 * @param distanceMeters haversine distance from the query point to {@code point}.
 */
public record SegmentProjection(Coordinate point, double fraction, double distanceMeters) {
}
