package org.walknav.routing.core;

import lombok.experimental.UtilityClass;
import org.walknav.routing.error.Endpoint;
import org.walknav.routing.error.InvalidInputException;
import org.walknav.routing.geo.Coordinate;

/**
 * Parses {@code "lon,lat"} query values.
 */
@UtilityClass
public final class CoordinateParser {

    /**
     * @param raw value such as {@code "7.3986,9.0765"}.
     * @param endpoint side of the request, named in any failure.
     * @throws InvalidInputException when the value is missing, malformed, or out of range.
     */
    public static Coordinate parse(String raw, Endpoint endpoint) {
        String label = endpoint == null ? "query" : endpoint.label();
        if (raw == null || raw.isBlank()) {
            throw new InvalidInputException(
                    InvalidInputException.REASON_MISSING_COORDINATE,
                    endpoint,
                    "Missing " + label + " coordinates"
            );
        }
        String[] parts = raw.split(",", -1);
        if (parts.length != 2) {
            throw new InvalidInputException(
                    InvalidInputException.REASON_MALFORMED_COORDINATE,
                    endpoint,
                    "Invalid " + label + " coordinates: must contain exactly two comma-separated values"
            );
        }
        double lon;
        double lat;
        try {
            lon = Double.parseDouble(parts[0].trim());
            lat = Double.parseDouble(parts[1].trim());
        } catch (NumberFormatException ex) {
            throw new InvalidInputException(
                    InvalidInputException.REASON_MALFORMED_COORDINATE,
                    endpoint,
                    "Invalid " + label + " coordinate format",
                    ex
            );
        }
        Coordinate coordinate = new Coordinate(lon, lat);
        if (!coordinate.isValid()) {
            throw new InvalidInputException(
                    InvalidInputException.REASON_COORDINATE_RANGE,
                    endpoint,
                    "Invalid " + label + " coordinates: longitude must be within [-180, 180]"
                            + " and latitude within [-90, 90]"
            );
        }
        return coordinate;
    }
}
