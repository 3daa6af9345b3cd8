package org.walknav.routing.error;

/**
 * Malformed or degenerate route request.
 */
public final class InvalidInputException extends RoutingException {
    public static final String REASON_MISSING_COORDINATE = "H_INPUT_MISSING_COORDINATE";
    public static final String REASON_MALFORMED_COORDINATE = "H_INPUT_MALFORMED_COORDINATE";
    public static final String REASON_COORDINATE_RANGE = "H_INPUT_COORDINATE_RANGE";

    public InvalidInputException(String reasonCode, Endpoint endpoint, String detail) {
        super(RoutingErrorKind.INVALID_INPUT, reasonCode, endpoint, detail);
    }

    public InvalidInputException(String reasonCode, Endpoint endpoint, String detail, Throwable cause) {
        super(RoutingErrorKind.INVALID_INPUT, reasonCode, endpoint, detail, cause);
    }
}
