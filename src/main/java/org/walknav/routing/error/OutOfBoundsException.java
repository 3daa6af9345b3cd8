package org.walknav.routing.error;

/**
 * Query point lies outside the serviced area.
 */
public final class OutOfBoundsException extends RoutingException {
    public static final String REASON_OUT_OF_BOUNDS = "H_SNAP_OUT_OF_BOUNDS";

    public OutOfBoundsException(Endpoint endpoint, String detail) {
        super(RoutingErrorKind.OUT_OF_BOUNDS, REASON_OUT_OF_BOUNDS, endpoint, detail);
    }
}
