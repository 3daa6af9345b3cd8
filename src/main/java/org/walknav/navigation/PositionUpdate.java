package org.walknav.navigation;

import lombok.Builder;
import lombok.Value;
import org.walknav.routing.geo.Coordinate;

/**
 * One fix from a {@link PositionSource}.
 */
@Value
@Builder
public class PositionUpdate {
    double lat;
    double lon;
    /** Horizontal accuracy radius in meters. */
    double accuracyMeters;
    /** Device heading in degrees, when known. */
    Double headingDegrees;

    public static PositionUpdate of(Coordinate coordinate, double accuracyMeters) {
        return PositionUpdate.builder()
                .lon(coordinate.lon())
                .lat(coordinate.lat())
                .accuracyMeters(accuracyMeters)
                .build();
    }

    public Coordinate coordinate() {
        return new Coordinate(lon, lat);
    }

    /**
     * Finite in-range coordinates and a finite non-negative accuracy.
     */
    public boolean isWellFormed() {
        return coordinate().isValid() && Double.isFinite(accuracyMeters) && accuracyMeters >= 0.0d;
    }
}
