package org.walknav.routing.error;

/**
 * Failure categories surfaced at the route-query boundary. Kinds are never collapsed.
 */
public enum RoutingErrorKind {
    OUT_OF_BOUNDS,
    TOO_FAR_FROM_ROAD,
    NO_PATH,
    INVALID_INPUT
}
