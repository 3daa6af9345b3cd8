package org.walknav.routing.core;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import org.walknav.routing.graph.RoadGraph;

import java.util.Arrays;
import java.util.PriorityQueue;

/**
 * Node-based Dijkstra over edge lengths.
 *
 * <p>Uses lazy deletion: stale frontier entries are skipped when polled instead of being
 * decreased in place. Directionality is implicit since only outgoing CSR edges are relaxed.</p>
 */
final class DijkstraRoutePlanner implements RoutePlanner {
    private static final double INF = Double.POSITIVE_INFINITY;
    private static final int NO_EDGE = -1;

    @Override
    public InternalRoutePlan compute(RoadGraph graph, int sourceNodeId, int targetNodeId) {
        if (sourceNodeId == targetNodeId) {
            return new InternalRoutePlan(true, 0.0d, 0, new int[0]);
        }

        int nodeCount = graph.nodeCount();
        double[] distance = new double[nodeCount];
        int[] predecessorEdge = new int[nodeCount];
        boolean[] settled = new boolean[nodeCount];
        Arrays.fill(distance, INF);
        Arrays.fill(predecessorEdge, NO_EDGE);

        PriorityQueue<FrontierState> frontier = new PriorityQueue<>();
        RoadGraph.EdgeIterator iterator = graph.iterator();
        distance[sourceNodeId] = 0.0d;
        frontier.add(new FrontierState(sourceNodeId, 0.0d));

        int settledNodes = 0;
        while (!frontier.isEmpty()) {
            FrontierState state = frontier.poll();
            int node = state.nodeId();
            if (settled[node]) {
                continue;
            }
            settled[node] = true;
            settledNodes++;
            if (node == targetNodeId) {
                return new InternalRoutePlan(true, distance[node], settledNodes, reconstruct(graph, predecessorEdge, targetNodeId));
            }

            iterator.resetForNode(node);
            while (iterator.hasNext()) {
                int edgeId = iterator.next();
                int next = graph.edgeTarget(edgeId);
                if (settled[next]) {
                    continue;
                }
                double candidate = distance[node] + graph.edgeWeight(edgeId);
                if (candidate < distance[next]) {
                    distance[next] = candidate;
                    predecessorEdge[next] = edgeId;
                    frontier.add(new FrontierState(next, candidate));
                }
            }
        }
        return InternalRoutePlan.unreachable(settledNodes);
    }

    private static int[] reconstruct(RoadGraph graph, int[] predecessorEdge, int targetNodeId) {
        IntArrayList reversed = new IntArrayList();
        int node = targetNodeId;
        while (predecessorEdge[node] != NO_EDGE) {
            int edgeId = predecessorEdge[node];
            reversed.add(edgeId);
            node = graph.edgeOrigin(edgeId);
        }
        int[] path = new int[reversed.size()];
        for (int i = 0; i < path.length; i++) {
            path[i] = reversed.getInt(path.length - 1 - i);
        }
        return path;
    }

    private record FrontierState(int nodeId, double distance) implements Comparable<FrontierState> {
        /**
         * Orders frontier by distance, then node id for stability.
         */
        @Override
        public int compareTo(FrontierState other) {
            int byDistance = Double.compare(this.distance, other.distance);
            if (byDistance != 0) {
                return byDistance;
            }
            return Integer.compare(this.nodeId, other.nodeId);
        }
    }
}
