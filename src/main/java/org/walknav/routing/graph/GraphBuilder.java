package org.walknav.routing.graph;

import it.unimi.dsi.fastutil.doubles.DoubleArrayList;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import lombok.extern.slf4j.Slf4j;
import org.walknav.routing.geo.Coordinate;
import org.walknav.routing.geo.GeoUtils;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Builds an immutable {@link RoadGraph} from parsed road features.
 *
 * <p>Every consecutive coordinate pair of every part becomes one or two directed edges
 * (per the feature's {@link RoadDirection}) weighted by haversine length. Coordinates are
 * merged into nodes by exact equality; there is no snapping tolerance, so features only
 * connect where they share an identical vertex.</p>
 *
 * <p>Edges are finally counting-sorted by origin node into CSR order. The sort is stable,
 * so edges keep their insertion order within one node's range.</p>
 */
@Slf4j
public final class GraphBuilder {
    public static final String UNNAMED_ROAD = "Unnamed Road";

    /**
     * Builds a graph from the supplied features.
     *
     * @param roads parsed road features.
     * @return immutable graph.
     * @throws GraphDataException when the dataset is empty, malformed, or yields no edges.
     */
    public RoadGraph build(Collection<RoadSegment> roads) {
        if (roads == null || roads.isEmpty()) {
            throw new GraphDataException(GraphDataException.REASON_EMPTY_DATASET, "road dataset is empty");
        }

        Accumulator acc = new Accumulator();
        int featureIndex = 0;
        int skippedParts = 0;
        int skippedPairs = 0;
        for (RoadSegment road : roads) {
            if (road == null) {
                log.warn("Skipping road feature #{}: feature is null", featureIndex);
                featureIndex++;
                continue;
            }
            String name = normalizeName(road.getName());
            RoadDirection direction = road.getDirection() == null ? RoadDirection.BOTH : road.getDirection();
            int nameId = acc.internName(name);

            List<List<Coordinate>> parts = road.getParts();
            for (int partIndex = 0; partIndex < parts.size(); partIndex++) {
                List<Coordinate> part = parts.get(partIndex);
                if (part == null || part.size() < 2) {
                    log.warn("Skipping part {} of road feature #{} ('{}'): fewer than two coordinates",
                            partIndex, featureIndex, name);
                    skippedParts++;
                    continue;
                }
                for (int i = 0; i + 1 < part.size(); i++) {
                    Coordinate from = requireValid(part.get(i), featureIndex, name);
                    Coordinate to = requireValid(part.get(i + 1), featureIndex, name);
                    if (from.equals(to)) {
                        log.debug("Skipping zero-length pair at {} on road feature #{} ('{}')", from, featureIndex, name);
                        skippedPairs++;
                        continue;
                    }
                    double weight = GeoUtils.distance(from, to);
                    int fromNode = acc.nodeId(from);
                    int toNode = acc.nodeId(to);
                    if (direction.allowsForward()) {
                        acc.addEdge(fromNode, toNode, weight, nameId, direction);
                    }
                    if (direction.allowsBackward()) {
                        acc.addEdge(toNode, fromNode, weight, nameId, direction);
                    }
                }
            }
            featureIndex++;
        }

        if (acc.origins.isEmpty()) {
            throw new GraphDataException(
                    GraphDataException.REASON_NO_EDGES,
                    "road dataset of " + featureIndex + " features produced no edges"
            );
        }

        RoadGraph graph = acc.toGraph();
        log.info("Built road graph: {} nodes, {} directed edges from {} features ({} parts and {} zero-length pairs skipped)",
                graph.nodeCount(), graph.edgeCount(), featureIndex, skippedParts, skippedPairs);
        return graph;
    }

    static String normalizeName(String name) {
        if (name == null || name.isBlank()) {
            return UNNAMED_ROAD;
        }
        return name.trim();
    }

    private static Coordinate requireValid(Coordinate coordinate, int featureIndex, String name) {
        if (coordinate == null || !coordinate.isValid()) {
            throw new GraphDataException(
                    GraphDataException.REASON_MALFORMED_COORDINATE,
                    "road feature #" + featureIndex + " ('" + name + "') has malformed coordinate " + coordinate
            );
        }
        return coordinate;
    }

    /**
     * Growable build-time buffers, discarded once the CSR arrays are assembled.
     */
    private static final class Accumulator {
        private final Object2IntOpenHashMap<Coordinate> nodeIds = new Object2IntOpenHashMap<>();
        private final DoubleArrayList lons = new DoubleArrayList();
        private final DoubleArrayList lats = new DoubleArrayList();

        private final Object2IntOpenHashMap<String> nameIds = new Object2IntOpenHashMap<>();
        private final List<String> names = new ArrayList<>();

        private final IntArrayList origins = new IntArrayList();
        private final IntArrayList targets = new IntArrayList();
        private final DoubleArrayList weights = new DoubleArrayList();
        private final IntArrayList edgeNames = new IntArrayList();
        private final List<RoadDirection> directions = new ArrayList<>();

        Accumulator() {
            nodeIds.defaultReturnValue(-1);
            nameIds.defaultReturnValue(-1);
        }

        int nodeId(Coordinate coordinate) {
            int id = nodeIds.getInt(coordinate);
            if (id < 0) {
                id = lons.size();
                nodeIds.put(coordinate, id);
                lons.add(coordinate.lon());
                lats.add(coordinate.lat());
            }
            return id;
        }

        int internName(String name) {
            int id = nameIds.getInt(name);
            if (id < 0) {
                id = names.size();
                nameIds.put(name, id);
                names.add(name);
            }
            return id;
        }

        void addEdge(int from, int to, double weight, int nameId, RoadDirection direction) {
            origins.add(from);
            targets.add(to);
            weights.add(weight);
            edgeNames.add(nameId);
            directions.add(direction);
        }

        RoadGraph toGraph() {
            int nodeCount = lons.size();
            int edgeCount = origins.size();

            int[] firstEdge = new int[nodeCount + 1];
            for (int i = 0; i < edgeCount; i++) {
                firstEdge[origins.getInt(i) + 1]++;
            }
            for (int n = 0; n < nodeCount; n++) {
                firstEdge[n + 1] += firstEdge[n];
            }

            int[] cursor = new int[nodeCount];
            System.arraycopy(firstEdge, 0, cursor, 0, nodeCount);

            int[] edgeOrigin = new int[edgeCount];
            int[] edgeTarget = new int[edgeCount];
            double[] edgeWeight = new double[edgeCount];
            int[] edgeNameIndex = new int[edgeCount];
            RoadDirection[] edgeDirection = new RoadDirection[edgeCount];
            for (int i = 0; i < edgeCount; i++) {
                int origin = origins.getInt(i);
                int slot = cursor[origin]++;
                edgeOrigin[slot] = origin;
                edgeTarget[slot] = targets.getInt(i);
                edgeWeight[slot] = weights.getDouble(i);
                edgeNameIndex[slot] = edgeNames.getInt(i);
                edgeDirection[slot] = directions.get(i);
            }

            nodeIds.trim();
            return new RoadGraph(
                    lons.toDoubleArray(),
                    lats.toDoubleArray(),
                    firstEdge,
                    edgeOrigin,
                    edgeTarget,
                    edgeWeight,
                    edgeNameIndex,
                    edgeDirection,
                    names.toArray(new String[0]),
                    nodeIds
            );
        }
    }
}
