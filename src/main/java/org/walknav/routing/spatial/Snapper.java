package org.walknav.routing.spatial;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import lombok.Getter;
import lombok.experimental.Accessors;
import lombok.extern.slf4j.Slf4j;
import org.walknav.routing.error.Endpoint;
import org.walknav.routing.error.InvalidInputException;
import org.walknav.routing.error.OutOfBoundsException;
import org.walknav.routing.error.TooFarFromRoadException;
import org.walknav.routing.geo.BoundingBox;
import org.walknav.routing.geo.Coordinate;
import org.walknav.routing.geo.GeoUtils;
import org.walknav.routing.geo.SegmentProjection;
import org.walknav.routing.graph.RoadGraph;

import java.util.Objects;

/**
 * Resolves arbitrary coordinates onto the nearest point of the road graph.
 *
 * <p>Candidates come from an {@link EdgeSpatialIndex}; every candidate is projected exactly
 * and the global minimum wins, ties going to the lowest edge id. Instances are immutable and
 * safe for concurrent use.</p>
 */
@Slf4j
public final class Snapper {
    private final RoadGraph graph;
    @Getter
    @Accessors(fluent = true)
    private final SnapConfig config;
    @Getter
    @Accessors(fluent = true)
    private final BoundingBox bounds;
    private final EdgeSpatialIndex index;

    public Snapper(RoadGraph graph) {
        this(graph, SnapConfig.defaults());
    }

    public Snapper(RoadGraph graph, SnapConfig config) {
        this.graph = Objects.requireNonNull(graph, "graph");
        this.config = Objects.requireNonNull(config, "config").validate();
        this.bounds = config.getBounds() != null
                ? config.getBounds()
                : graph.extent().expandedBy(config.getMaxSnapDistanceMeters());
        this.index = EdgeSpatialIndex.build(graph, config.getGridCellDegrees());
        log.debug("Snapper ready: bounds={}, grid={}x{} cells of {} deg",
                bounds, index.columns(), index.rows(), index.cellDegrees());
    }

    /**
     * Snaps a query point with the strict snap distance.
     *
     * @throws OutOfBoundsException when the point is outside {@link #bounds()}.
     * @throws TooFarFromRoadException when no edge lies within the max snap distance.
     */
    public SnapResult snap(Coordinate point) {
        return snap(point, null);
    }

    /**
     * Same as {@link #snap(Coordinate)}, naming {@code endpoint} in any failure.
     */
    public SnapResult snap(Coordinate point, Endpoint endpoint) {
        return snapWithin(point, config.getMaxSnapDistanceMeters(), endpoint);
    }

    /**
     * Snaps a live position using the tracking band derived from its accuracy.
     */
    public SnapResult snapTracking(Coordinate point, double accuracyMeters) {
        return snapTracking(point, accuracyMeters, null);
    }

    public SnapResult snapTracking(Coordinate point, double accuracyMeters, Endpoint endpoint) {
        return snapWithin(point, config.trackingSnapDistance(accuracyMeters), endpoint);
    }

    private SnapResult snapWithin(Coordinate point, double maxDistanceMeters, Endpoint endpoint) {
        if (point == null || !point.isValid()) {
            throw new InvalidInputException(
                    InvalidInputException.REASON_MALFORMED_COORDINATE,
                    endpoint,
                    "coordinate " + point + " is not a valid WGS84 position"
            );
        }
        if (!bounds.contains(point)) {
            throw new OutOfBoundsException(endpoint, "point " + point + " is outside the serviced area " + bounds);
        }

        IntArrayList candidates = new IntArrayList();
        index.collectCandidates(point, maxDistanceMeters, candidates);
        SnapResult best = nearestAmong(point, candidates);
        if (best == null || best.distanceMeters() > maxDistanceMeters) {
            SnapResult nearest = best != null ? best : nearestOverall(point);
            throw new TooFarFromRoadException(endpoint, nearest.distanceMeters(), maxDistanceMeters);
        }
        return best;
    }

    private SnapResult nearestAmong(Coordinate point, IntArrayList candidates) {
        SnapResult best = null;
        for (int i = 0; i < candidates.size(); i++) {
            best = closer(point, candidates.getInt(i), best);
        }
        return best;
    }

    /**
     * Exhaustive scan, only used to report the nearest distance on failure.
     */
    private SnapResult nearestOverall(Coordinate point) {
        SnapResult best = null;
        for (int edgeId = 0; edgeId < graph.edgeCount(); edgeId++) {
            best = closer(point, edgeId, best);
        }
        return best;
    }

    // Strict comparison keeps the lowest edge id on ties as ids are visited in ascending order.
    private SnapResult closer(Coordinate point, int edgeId, SnapResult best) {
        int origin = graph.edgeOrigin(edgeId);
        int target = graph.edgeTarget(edgeId);
        SegmentProjection projection = GeoUtils.projectOntoSegment(
                point,
                graph.nodeCoordinate(origin),
                graph.nodeCoordinate(target)
        );
        if (best != null && !(projection.distanceMeters() < best.distanceMeters())) {
            return best;
        }
        return new SnapResult(
                point,
                projection.point(),
                projection.distanceMeters(),
                edgeId,
                projection.fraction(),
                origin,
                target
        );
    }
}
