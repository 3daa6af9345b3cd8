package org.walknav.routing.error;

/**
 * Snapped endpoints are not connected under the graph's directionality.
 */
public final class NoPathException extends RoutingException {
    public static final String REASON_NO_PATH = "H_ROUTE_NO_PATH";

    public NoPathException(String detail) {
        super(RoutingErrorKind.NO_PATH, REASON_NO_PATH, null, detail);
    }
}
