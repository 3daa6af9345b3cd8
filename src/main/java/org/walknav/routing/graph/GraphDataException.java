package org.walknav.routing.graph;

import lombok.Getter;

import java.util.Objects;

/**
 * Fatal road-data failure raised while building a {@link RoadGraph}.
 */
@Getter
public final class GraphDataException extends RuntimeException {
    public static final String REASON_EMPTY_DATASET = "H_GRAPH_EMPTY_DATASET";
    public static final String REASON_NO_EDGES = "H_GRAPH_NO_EDGES";
    public static final String REASON_MALFORMED_COORDINATE = "H_GRAPH_MALFORMED_COORDINATE";

    private final String reasonCode;

    public GraphDataException(String reasonCode, String message) {
        super("[" + Objects.requireNonNull(reasonCode, "reasonCode") + "] "
                + Objects.requireNonNull(message, "message"));
        this.reasonCode = reasonCode;
    }
}
