package org.walknav.routing.spatial;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;
import org.walknav.routing.geo.Coordinate;

/**
 * Immutable projection of a query point onto its nearest graph edge.
 */
@Getter
@Accessors(fluent = true)
@RequiredArgsConstructor
public final class SnapResult {
    private final Coordinate query;
    private final Coordinate snappedPoint;
    private final double distanceMeters;
    private final int edgeId;
    /** Position along the edge from origin (0) to target (1). */
    private final double fraction;
    private final int edgeOriginNode;
    private final int edgeTargetNode;

    /**
     * Edge endpoint nearer to the snapped point; origin wins an exact midpoint.
     */
    public int nearestNode() {
        return fraction <= 0.5d ? edgeOriginNode : edgeTargetNode;
    }

    @Override
    public String toString() {
        return String.format("SnapResult[edge=%d, fraction=%.3f, distance=%.2fm, point=%s]",
                edgeId, fraction, distanceMeters, snappedPoint);
    }
}
