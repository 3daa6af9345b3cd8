package org.walknav.navigation;

import org.walknav.routing.core.Route;
import org.walknav.routing.geo.Coordinate;
import org.walknav.routing.geo.GeoUtils;
import org.walknav.routing.geo.SegmentProjection;

import java.util.List;

/**
 * Position-to-route measurements over one route path.
 */
final class RouteProgress {
    private final List<Coordinate> path;
    // cumulative[i] = path distance from the start to vertex i
    private final double[] cumulative;

    RouteProgress(Route route) {
        this.path = route.getPath();
        this.cumulative = new double[path.size()];
        for (int i = 1; i < path.size(); i++) {
            cumulative[i] = cumulative[i - 1] + GeoUtils.distance(path.get(i - 1), path.get(i));
        }
    }

    /**
     * Distance to the closest path vertex.
     */
    double minVertexDistance(Coordinate position) {
        double best = Double.POSITIVE_INFINITY;
        for (Coordinate vertex : path) {
            best = Math.min(best, GeoUtils.distance(position, vertex));
        }
        return best;
    }

    /**
     * Arc length from the start to the projection of {@code position} onto the nearest segment.
     */
    double distanceTraveled(Coordinate position) {
        double bestDistance = Double.POSITIVE_INFINITY;
        double traveled = 0.0d;
        for (int i = 0; i + 1 < path.size(); i++) {
            SegmentProjection projection = GeoUtils.projectOntoSegment(position, path.get(i), path.get(i + 1));
            if (projection.distanceMeters() < bestDistance) {
                bestDistance = projection.distanceMeters();
                traveled = cumulative[i] + projection.fraction() * (cumulative[i + 1] - cumulative[i]);
            }
        }
        return traveled;
    }

    double totalDistance() {
        return cumulative[cumulative.length - 1];
    }
}
