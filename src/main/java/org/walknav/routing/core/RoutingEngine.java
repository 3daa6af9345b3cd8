package org.walknav.routing.core;

import it.unimi.dsi.fastutil.doubles.DoubleArrayList;
import lombok.Getter;
import lombok.experimental.Accessors;
import lombok.extern.slf4j.Slf4j;
import org.walknav.routing.error.Endpoint;
import org.walknav.routing.error.InvalidInputException;
import org.walknav.routing.error.NoPathException;
import org.walknav.routing.geo.Coordinate;
import org.walknav.routing.graph.RoadGraph;
import org.walknav.routing.instruction.InstructionGenerator;
import org.walknav.routing.instruction.InstructionSet;
import org.walknav.routing.instruction.RoutePath;
import org.walknav.routing.spatial.SnapResult;
import org.walknav.routing.spatial.Snapper;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Route facade: validation, endpoint snapping, shortest-path search and instruction synthesis.
 *
 * <p>The graph is injected and never mutated, so one engine serves concurrent queries.</p>
 */
@Slf4j
public final class RoutingEngine {
    @Getter
    @Accessors(fluent = true)
    private final RoadGraph graph;
    @Getter
    @Accessors(fluent = true)
    private final RoutingConfig config;
    @Getter
    @Accessors(fluent = true)
    private final Snapper snapper;
    private final RoutePlanner planner;
    private final InstructionGenerator instructionGenerator;

    public RoutingEngine(RoadGraph graph) {
        this(graph, RoutingConfig.defaults());
    }

    public RoutingEngine(RoadGraph graph, RoutingConfig config) {
        this(graph, config, new DijkstraRoutePlanner());
    }

    RoutingEngine(RoadGraph graph, RoutingConfig config, RoutePlanner planner) {
        this.graph = Objects.requireNonNull(graph, "graph");
        this.config = Objects.requireNonNull(config, "config").validate();
        this.planner = Objects.requireNonNull(planner, "planner");
        this.snapper = new Snapper(graph, config.getSnapConfig());
        this.instructionGenerator = new InstructionGenerator(config.getInstructionConfig());
    }

    /**
     * Computes a walking route.
     *
     * @param request route endpoints.
     * @return route with path, instructions, distance and time estimate.
     * @throws InvalidInputException when an endpoint is missing.
     * @throws org.walknav.routing.error.OutOfBoundsException when an endpoint is outside the area.
     * @throws org.walknav.routing.error.TooFarFromRoadException when an endpoint is too far from any road.
     * @throws NoPathException when the endpoints are not connected.
     */
    public Route calculateRoute(RouteRequest request) {
        if (request == null) {
            throw new InvalidInputException(InvalidInputException.REASON_MISSING_COORDINATE, null, "Missing route request");
        }
        Coordinate startPoint = requireEndpoint(request.getStart(), Endpoint.START);
        Coordinate endPoint = requireEndpoint(request.getEnd(), Endpoint.END);

        SnapResult start = request.getStartAccuracyMeters() != null
                ? snapper.snapTracking(startPoint, request.getStartAccuracyMeters(), Endpoint.START)
                : snapper.snap(startPoint, Endpoint.START);
        SnapResult end = snapper.snap(endPoint, Endpoint.END);

        int sourceNode = start.nearestNode();
        int targetNode = end.nearestNode();
        if (sourceNode == targetNode) {
            return sameNodeRoute(start, end, sourceNode);
        }

        InternalRoutePlan plan = planner.compute(graph, sourceNode, targetNode);
        if (!plan.reachable()) {
            throw new NoPathException(
                    "no walkable path from node " + sourceNode + " to node " + targetNode
                            + " (" + plan.settledNodes() + " nodes settled)");
        }

        int[] edges = plan.edgePath();
        List<Coordinate> path = new ArrayList<>(edges.length + 1);
        List<String> names = new ArrayList<>(edges.length);
        DoubleArrayList distances = new DoubleArrayList(edges.length);
        path.add(graph.nodeCoordinate(sourceNode));
        for (int edgeId : edges) {
            path.add(graph.nodeCoordinate(graph.edgeTarget(edgeId)));
            names.add(graph.edgeRoadName(edgeId));
            distances.add(graph.edgeWeight(edgeId));
        }
        log.debug("Route search settled {} nodes", plan.settledNodes());
        return assemble(new RoutePath(path, names, distances), plan.totalDistanceMeters(), start, end);
    }

    /**
     * Both endpoints resolve to one search node. When they lie on the same segment the route
     * runs along it between the two snapped points; otherwise the route is a zero-length stop
     * at the shared node.
     */
    private Route sameNodeRoute(SnapResult start, SnapResult end, int node) {
        int startEdge = start.edgeId();
        int origin = start.edgeOriginNode();
        int target = start.edgeTargetNode();
        double endFraction = Double.NaN;
        if (end.edgeOriginNode() == origin && end.edgeTargetNode() == target) {
            endFraction = end.fraction();
        } else if (end.edgeOriginNode() == target && end.edgeTargetNode() == origin) {
            endFraction = 1.0d - end.fraction();
        }

        if (!Double.isNaN(endFraction) && endFraction != start.fraction()) {
            int travelEdge = endFraction > start.fraction() ? startEdge : graph.findEdge(target, origin);
            if (travelEdge < 0) {
                throw new NoPathException(
                        "edge " + startEdge + " is one-way, cannot walk back from fraction "
                                + start.fraction() + " to " + endFraction);
            }
            RoutePath along = RoutePath.of(
                    List.of(start.snappedPoint(), end.snappedPoint()),
                    List.of(graph.edgeRoadName(travelEdge))
            );
            return assemble(along, along.totalDistanceMeters(), start, end);
        }

        Coordinate stop = graph.nodeCoordinate(node);
        DoubleArrayList zero = new DoubleArrayList(new double[]{0.0d});
        RoutePath stay = new RoutePath(List.of(stop, stop), List.of(graph.edgeRoadName(startEdge)), zero);
        return assemble(stay, 0.0d, start, end);
    }

    private Route assemble(RoutePath path, double total, SnapResult start, SnapResult end) {
        InstructionSet instructions = instructionGenerator.generate(path);
        long seconds = Math.round(total / config.getWalkingSpeedMetersPerSecond());
        log.info("Route {} -> {}: {} m over {} edges, {} instructions",
                start.query(), end.query(), Math.round(total), path.edgeCount(),
                instructions.instructions().size());

        return Route.builder()
                .path(path.coordinates())
                .edgeRoadNames(path.edgeRoadNames())
                .instructions(instructions.instructions())
                .totalDistanceMeters(total)
                .estimatedTimeSeconds(seconds)
                .start(start)
                .end(end)
                .build();
    }

    private static Coordinate requireEndpoint(Coordinate point, Endpoint endpoint) {
        if (point == null) {
            throw new InvalidInputException(
                    InvalidInputException.REASON_MISSING_COORDINATE,
                    endpoint,
                    "Missing " + endpoint.label() + " coordinates"
            );
        }
        return point;
    }
}
