package org.walknav.routing.graph;

import it.unimi.dsi.fastutil.objects.Object2IntMap;
import org.walknav.routing.geo.BoundingBox;
import org.walknav.routing.geo.Coordinate;

import java.util.NoSuchElementException;
import java.util.function.IntConsumer;

/**
 * Immutable pedestrian road graph in CSR (Compressed Sparse Row) layout.
 * <p>
 * Nodes are the unique coordinates of the source polylines; edges are directed and sorted by
 * origin node, so {@code firstEdge[n] .. firstEdge[n + 1]} is the outgoing range of node
 * {@code n}. All arrays are private and never mutated after construction, so one instance
 * can be shared by any number of concurrent readers.
 * <p>
 * Layout:
 * - SoA (Structure of Arrays) node and edge properties.
 * - O(1) edge-to-origin lookup via {@code edgeOrigin}.
 * - Road names interned into a table, referenced per edge by index.
 */
public final class RoadGraph {

    // ========================================================================
    // DATA ARRAYS (SoA Layout)
    // ========================================================================

    private final double[] nodeLon;
    private final double[] nodeLat;

    // CSR Index: firstEdge[node] -> start index in edge arrays; length nodeCount + 1
    private final int[] firstEdge;

    private final int[] edgeOrigin;
    private final int[] edgeTarget;
    private final double[] edgeWeight;
    private final int[] edgeNameIndex;
    private final RoadDirection[] edgeDirection;
    private final String[] roadNames;

    private final Object2IntMap<Coordinate> nodeIndex;
    private final BoundingBox extent;

    RoadGraph(
            double[] nodeLon,
            double[] nodeLat,
            int[] firstEdge,
            int[] edgeOrigin,
            int[] edgeTarget,
            double[] edgeWeight,
            int[] edgeNameIndex,
            RoadDirection[] edgeDirection,
            String[] roadNames,
            Object2IntMap<Coordinate> nodeIndex
    ) {
        this.nodeLon = nodeLon;
        this.nodeLat = nodeLat;
        this.firstEdge = firstEdge;
        this.edgeOrigin = edgeOrigin;
        this.edgeTarget = edgeTarget;
        this.edgeWeight = edgeWeight;
        this.edgeNameIndex = edgeNameIndex;
        this.edgeDirection = edgeDirection;
        this.roadNames = roadNames;
        this.nodeIndex = nodeIndex;
        this.extent = computeExtent(nodeLon, nodeLat);
    }

    // ========================================================================
    // CORE ACCESSORS (O(1))
    // ========================================================================

    public int nodeCount() {
        return nodeLon.length;
    }

    public int edgeCount() {
        return edgeTarget.length;
    }

    public double nodeLon(int nodeId) {
        return nodeLon[nodeId];
    }

    public double nodeLat(int nodeId) {
        return nodeLat[nodeId];
    }

    public Coordinate nodeCoordinate(int nodeId) {
        return new Coordinate(nodeLon[nodeId], nodeLat[nodeId]);
    }

    /**
     * Returns the node id at exactly {@code coordinate}, or {@code -1} when none exists.
     */
    public int findNode(Coordinate coordinate) {
        return nodeIndex.getInt(coordinate);
    }

    public int edgeOrigin(int edgeId) {
        return edgeOrigin[edgeId];
    }

    public int edgeTarget(int edgeId) {
        return edgeTarget[edgeId];
    }

    /**
     * Edge length in meters.
     */
    public double edgeWeight(int edgeId) {
        return edgeWeight[edgeId];
    }

    public String edgeRoadName(int edgeId) {
        return roadNames[edgeNameIndex[edgeId]];
    }

    public RoadDirection edgeDirection(int edgeId) {
        return edgeDirection[edgeId];
    }

    public int outDegree(int nodeId) {
        return firstEdge[nodeId + 1] - firstEdge[nodeId];
    }

    /**
     * Smallest box containing every node.
     */
    public BoundingBox extent() {
        return extent;
    }

    /**
     * Returns the outgoing edge id from {@code from} to {@code to} with the smallest weight,
     * or {@code -1} when the nodes are not adjacent in that direction.
     */
    public int findEdge(int from, int to) {
        int best = -1;
        for (int edgeId = firstEdge[from]; edgeId < firstEdge[from + 1]; edgeId++) {
            if (edgeTarget[edgeId] == to && (best < 0 || edgeWeight[edgeId] < edgeWeight[best])) {
                best = edgeId;
            }
        }
        return best;
    }

    // ========================================================================
    // ITERATION
    // ========================================================================

    /**
     * Creates a reusable zero-allocation edge iterator.
     * Not thread-safe: use one iterator per thread.
     */
    public EdgeIterator iterator() {
        return new EdgeIterator(this);
    }

    public void forEachOutgoingEdge(int nodeId, IntConsumer action) {
        for (int edgeId = firstEdge[nodeId]; edgeId < firstEdge[nodeId + 1]; edgeId++) {
            action.accept(edgeId);
        }
    }

    public static final class EdgeIterator {
        private final RoadGraph graph;
        private int current;
        private int end;

        EdgeIterator(RoadGraph graph) {
            this.graph = graph;
        }

        /**
         * Resets iterator to traverse edges leaving the target of {@code edgeId}.
         */
        public EdgeIterator reset(int edgeId) {
            return resetForNode(graph.edgeTarget[edgeId]);
        }

        /**
         * Resets iterator to traverse edges leaving {@code nodeId}.
         */
        public EdgeIterator resetForNode(int nodeId) {
            this.current = graph.firstEdge[nodeId];
            this.end = graph.firstEdge[nodeId + 1];
            return this;
        }

        public boolean hasNext() {
            return current < end;
        }

        public int next() {
            if (current >= end) {
                throw new NoSuchElementException();
            }
            return current++;
        }
    }

    private static BoundingBox computeExtent(double[] lons, double[] lats) {
        double minLon = Double.POSITIVE_INFINITY;
        double minLat = Double.POSITIVE_INFINITY;
        double maxLon = Double.NEGATIVE_INFINITY;
        double maxLat = Double.NEGATIVE_INFINITY;
        for (int i = 0; i < lons.length; i++) {
            minLon = Math.min(minLon, lons[i]);
            maxLon = Math.max(maxLon, lons[i]);
            minLat = Math.min(minLat, lats[i]);
            maxLat = Math.max(maxLat, lats[i]);
        }
        return new BoundingBox(minLon, minLat, maxLon, maxLat);
    }

    @Override
    public String toString() {
        return String.format("RoadGraph[nodes=%d, edges=%d, roads=%d]", nodeCount(), edgeCount(), roadNames.length);
    }
}
