package org.walknav.routing.spatial;

import lombok.Builder;
import lombok.Value;
import org.walknav.routing.geo.BoundingBox;

/**
 * Snapping thresholds and grid-index tuning.
 */
@Value
@Builder
public class SnapConfig {
    public static final double DEFAULT_MAX_SNAP_DISTANCE_METERS = 75.0d;
    public static final double DEFAULT_TRACKING_MIN_METERS = 50.0d;
    public static final double DEFAULT_TRACKING_MAX_METERS = 100.0d;
    public static final double DEFAULT_GRID_CELL_DEGREES = 0.0005d;

    /**
     * Largest accepted distance from a query point to its nearest edge (inclusive).
     */
    @Builder.Default
    double maxSnapDistanceMeters = DEFAULT_MAX_SNAP_DISTANCE_METERS;

    /**
     * Lower clamp of the tracking band applied to GPS accuracy.
     */
    @Builder.Default
    double trackingMinMeters = DEFAULT_TRACKING_MIN_METERS;

    /**
     * Upper clamp of the tracking band applied to GPS accuracy.
     */
    @Builder.Default
    double trackingMaxMeters = DEFAULT_TRACKING_MAX_METERS;

    /**
     * Serviced area; {@code null} derives it from the graph extent padded by the snap distance.
     */
    BoundingBox bounds;

    @Builder.Default
    double gridCellDegrees = DEFAULT_GRID_CELL_DEGREES;

    public static SnapConfig defaults() {
        return SnapConfig.builder().build();
    }

    /**
     * Validates threshold invariants.
     *
     * @return this config.
     * @throws IllegalArgumentException when a threshold is non-positive or the band is inverted.
     */
    public SnapConfig validate() {
        if (!(maxSnapDistanceMeters > 0.0d) || !Double.isFinite(maxSnapDistanceMeters)) {
            throw new IllegalArgumentException("maxSnapDistanceMeters must be positive and finite");
        }
        if (!(trackingMinMeters > 0.0d) || !(trackingMaxMeters >= trackingMinMeters)
                || !Double.isFinite(trackingMaxMeters)) {
            throw new IllegalArgumentException("tracking band must satisfy 0 < min <= max < INF");
        }
        if (!(gridCellDegrees > 0.0d) || !Double.isFinite(gridCellDegrees)) {
            throw new IllegalArgumentException("gridCellDegrees must be positive and finite");
        }
        return this;
    }

    /**
     * Tracking snap threshold for a fix of the given accuracy: {@code clamp(accuracy, min, max)}.
     * Unknown accuracy gets the loosest band.
     */
    public double trackingSnapDistance(double accuracyMeters) {
        if (!Double.isFinite(accuracyMeters)) {
            return trackingMaxMeters;
        }
        return Math.max(trackingMinMeters, Math.min(trackingMaxMeters, accuracyMeters));
    }
}
