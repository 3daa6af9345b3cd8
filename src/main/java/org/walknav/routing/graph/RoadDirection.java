package org.walknav.routing.graph;

/**
 * Traversal direction attribute of a road feature, relative to its coordinate order.
 */
public enum RoadDirection {
    /** Walkable only in coordinate order. */
    FORWARD,
    /** Walkable only against coordinate order. */
    BACKWARD,
    /** Walkable both ways. */
    BOTH;

    public boolean allowsForward() {
        return this != BACKWARD;
    }

    public boolean allowsBackward() {
        return this != FORWARD;
    }
}
