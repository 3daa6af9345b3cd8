package org.walknav.routing.error;

import lombok.Getter;

/**
 * Nearest walkable edge is beyond the allowed snap distance.
 */
@Getter
public final class TooFarFromRoadException extends RoutingException {
    public static final String REASON_TOO_FAR_FROM_ROAD = "H_SNAP_TOO_FAR_FROM_ROAD";

    private final double nearestDistanceMeters;
    private final double maxDistanceMeters;

    public TooFarFromRoadException(Endpoint endpoint, double nearestDistanceMeters, double maxDistanceMeters) {
        super(
                RoutingErrorKind.TOO_FAR_FROM_ROAD,
                REASON_TOO_FAR_FROM_ROAD,
                endpoint,
                String.format("nearest road is %.1f m away (limit %.1f m)", nearestDistanceMeters, maxDistanceMeters)
        );
        this.nearestDistanceMeters = nearestDistanceMeters;
        this.maxDistanceMeters = maxDistanceMeters;
    }
}
