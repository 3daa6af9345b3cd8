package org.walknav.routing.core;

import lombok.Builder;
import lombok.Value;
import org.walknav.routing.error.Endpoint;
import org.walknav.routing.geo.Coordinate;

/**
 * Point-to-point walking route request.
 */
@Value
@Builder(toBuilder = true)
public class RouteRequest {
    Coordinate start;
    Coordinate end;
    /**
     * GPS accuracy of {@link #start} when it is a live fix; switches the start to the
     * tracking snap band. {@code null} for picked points.
     */
    Double startAccuracyMeters;

    public static RouteRequest of(Coordinate start, Coordinate end) {
        return RouteRequest.builder().start(start).end(end).build();
    }

    /**
     * Parses {@code "lon,lat"} strings for both endpoints.
     */
    public static RouteRequest parse(String start, String end) {
        return of(CoordinateParser.parse(start, Endpoint.START), CoordinateParser.parse(end, Endpoint.END));
    }

    /**
     * Request for the way back. The accuracy hint does not carry over to the new start.
     */
    public RouteRequest reversed() {
        return RouteRequest.builder().start(end).end(start).build();
    }
}
