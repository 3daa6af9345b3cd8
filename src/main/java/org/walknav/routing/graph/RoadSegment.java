package org.walknav.routing.graph;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.walknav.routing.geo.Coordinate;

import java.util.Arrays;
import java.util.List;

/**
 * One parsed road feature: a (multi-)polyline with a name and a direction attribute.
 */
@Value
@Builder
public class RoadSegment {
    /**
     * Road name; null or blank names are replaced with {@link GraphBuilder#UNNAMED_ROAD}.
     */
    String name;

    @Builder.Default
    RoadDirection direction = RoadDirection.BOTH;

    /**
     * Polyline parts. A plain LineString has exactly one part.
     */
    @Singular
    List<List<Coordinate>> parts;

    /**
     * Convenience factory for a single-part, two-way road.
     */
    public static RoadSegment of(String name, Coordinate... coordinates) {
        return of(name, RoadDirection.BOTH, coordinates);
    }

    public static RoadSegment of(String name, RoadDirection direction, Coordinate... coordinates) {
        return RoadSegment.builder()
                .name(name)
                .direction(direction)
                .part(Arrays.asList(coordinates))
                .build();
    }
}
