package org.walknav.routing.core;

import org.walknav.routing.graph.RoadGraph;

/**
 * Internal planner abstraction behind {@link RoutingEngine}.
 */
interface RoutePlanner {
    /**
     * Computes one shortest path in node-id space.
     *
     * @param graph graph backing the search.
     * @param sourceNodeId search start node.
     * @param targetNodeId search goal node.
     * @return computed internal route plan.
     */
    InternalRoutePlan compute(RoadGraph graph, int sourceNodeId, int targetNodeId);
}
