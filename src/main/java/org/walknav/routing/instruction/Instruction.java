package org.walknav.routing.instruction;

import lombok.Builder;
import lombok.Value;
import org.walknav.routing.geo.Coordinate;

/**
 * One turn-by-turn instruction anchored at a path vertex.
 */
@Value
@Builder
public class Instruction {
    /** Spoken and displayed text. */
    String text;
    /** Anchor coordinate; always one of the route path coordinates. */
    Coordinate location;
    /** Index of {@link #location} in the route path. */
    int pathIndex;
    TurnClassification turn;
    /** Path distance from the previous anchor to this one; 0 for the first instruction. */
    double segmentDistanceMeters;
    /** Road the user is on after this instruction. */
    String roadName;
}
