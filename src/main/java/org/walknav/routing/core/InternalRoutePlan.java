package org.walknav.routing.core;

/**
 * Internal route planning output.
 *
 * @param reachable whether target is reachable from source.
 * @param totalDistanceMeters summed edge weights (or {@code +INF} when unreachable).
 * @param settledNodes count of settled nodes during search.
 * @param edgePath edge ids from source to target (empty when unreachable or source == target).
 */
record InternalRoutePlan(
        boolean reachable,
        double totalDistanceMeters,
        int settledNodes,
        int[] edgePath
) {
    static InternalRoutePlan unreachable(int settledNodes) {
        return new InternalRoutePlan(false, Double.POSITIVE_INFINITY, settledNodes, new int[0]);
    }
}
