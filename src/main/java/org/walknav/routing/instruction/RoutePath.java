package org.walknav.routing.instruction;

import it.unimi.dsi.fastutil.doubles.DoubleArrayList;
import it.unimi.dsi.fastutil.doubles.DoubleList;
import it.unimi.dsi.fastutil.doubles.DoubleLists;
import org.walknav.routing.geo.Coordinate;
import org.walknav.routing.geo.GeoUtils;

import java.util.List;
import java.util.Objects;

/**
 * Coordinate path with per-edge road names and lengths; input of {@link InstructionGenerator}.
 *
 * @param coordinates path vertices, at least two.
 * @param edgeRoadNames road name of edge {@code i -> i + 1}.
 * @param edgeDistances length in meters of edge {@code i -> i + 1}.
 */
public record RoutePath(List<Coordinate> coordinates, List<String> edgeRoadNames, DoubleList edgeDistances) {

    public RoutePath {
        coordinates = List.copyOf(Objects.requireNonNull(coordinates, "coordinates"));
        edgeRoadNames = List.copyOf(Objects.requireNonNull(edgeRoadNames, "edgeRoadNames"));
        edgeDistances = DoubleLists.unmodifiable(new DoubleArrayList(Objects.requireNonNull(edgeDistances, "edgeDistances")));
        if (coordinates.size() < 2) {
            throw new IllegalArgumentException("path needs at least two coordinates, got " + coordinates.size());
        }
        int edges = coordinates.size() - 1;
        if (edgeRoadNames.size() != edges || edgeDistances.size() != edges) {
            throw new IllegalArgumentException(
                    "expected " + edges + " edge names and distances, got "
                            + edgeRoadNames.size() + " and " + edgeDistances.size());
        }
    }

    /**
     * Builds a path whose edge distances are the haversine lengths of consecutive coordinates.
     */
    public static RoutePath of(List<Coordinate> coordinates, List<String> edgeRoadNames) {
        DoubleArrayList distances = new DoubleArrayList(Math.max(0, coordinates.size() - 1));
        for (int i = 0; i + 1 < coordinates.size(); i++) {
            distances.add(GeoUtils.distance(coordinates.get(i), coordinates.get(i + 1)));
        }
        return new RoutePath(coordinates, edgeRoadNames, distances);
    }

    public int edgeCount() {
        return coordinates.size() - 1;
    }

    public double totalDistanceMeters() {
        double total = 0.0d;
        for (int i = 0; i < edgeDistances.size(); i++) {
            total += edgeDistances.getDouble(i);
        }
        return total;
    }
}
