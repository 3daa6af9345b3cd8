package org.walknav.routing.core;

import lombok.Builder;
import lombok.Value;
import org.walknav.routing.error.Endpoint;
import org.walknav.routing.error.RoutingErrorKind;

/**
 * Client-facing failure of one route query.
 */
@Value
@Builder
public class RouteError {
    RoutingErrorKind kind;
    /** Deterministic reason code of the underlying failure. */
    String reasonCode;
    /** Short message suitable for display. */
    String message;
    /** Failing endpoint, or {@code null} when the failure concerns the whole request. */
    Endpoint endpoint;
}
