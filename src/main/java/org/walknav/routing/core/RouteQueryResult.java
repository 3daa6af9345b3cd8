package org.walknav.routing.core;

import lombok.AccessLevel;
import lombok.RequiredArgsConstructor;

import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Either a {@link Route} or a {@link RouteError}, never both.
 */
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class RouteQueryResult {
    private final Route route;
    private final RouteError error;

    public static RouteQueryResult success(Route route) {
        return new RouteQueryResult(Objects.requireNonNull(route, "route"), null);
    }

    public static RouteQueryResult failure(RouteError error) {
        return new RouteQueryResult(null, Objects.requireNonNull(error, "error"));
    }

    public boolean isSuccess() {
        return route != null;
    }

    public Route route() {
        if (route == null) {
            throw new NoSuchElementException("query failed: " + error.getKind());
        }
        return route;
    }

    public RouteError error() {
        if (error == null) {
            throw new NoSuchElementException("query succeeded");
        }
        return error;
    }

    @Override
    public String toString() {
        return isSuccess()
                ? "RouteQueryResult[route " + Math.round(route.getTotalDistanceMeters()) + " m]"
                : "RouteQueryResult[" + error.getKind() + " " + error.getReasonCode() + "]";
    }
}
