package org.walknav.routing.core;

import lombok.extern.slf4j.Slf4j;
import org.walknav.routing.error.Endpoint;
import org.walknav.routing.error.RoutingException;

import java.util.Objects;

/**
 * Query boundary: turns route requests into results, translating routing failures into
 * kind-preserving user-facing errors. Unexpected runtime failures still propagate.
 */
@Slf4j
public final class RouteQueryService {
    private final RoutingEngine engine;

    public RouteQueryService(RoutingEngine engine) {
        this.engine = Objects.requireNonNull(engine, "engine");
    }

    /**
     * Runs a query from {@code "lon,lat"} strings.
     */
    public RouteQueryResult query(String start, String end) {
        try {
            return query(RouteRequest.parse(start, end));
        } catch (RoutingException ex) {
            return reject(ex);
        }
    }

    public RouteQueryResult query(RouteRequest request) {
        try {
            return RouteQueryResult.success(engine.calculateRoute(request));
        } catch (RoutingException ex) {
            return reject(ex);
        }
    }

    private RouteQueryResult reject(RoutingException ex) {
        log.info("Route query rejected: {}", ex.getMessage());
        Endpoint endpoint = ex.endpoint().orElse(null);
        return RouteQueryResult.failure(RouteError.builder()
                .kind(ex.getKind())
                .reasonCode(ex.getReasonCode())
                .message(userMessage(ex, endpoint))
                .endpoint(endpoint)
                .build());
    }

    static String userMessage(RoutingException ex, Endpoint endpoint) {
        String subject = endpoint == null ? "The selected location" : "The " + endpoint.label();
        return switch (ex.getKind()) {
            case OUT_OF_BOUNDS -> subject + " is outside the campus area.";
            case TOO_FAR_FROM_ROAD -> subject + " is too far from any walkable path. Please pick a point closer to a road.";
            case NO_PATH -> "No walking route connects these points.";
            case INVALID_INPUT -> ex.getDetail();
        };
    }
}
