package org.walknav.routing.instruction;

import org.walknav.routing.geo.Coordinate;
import org.walknav.routing.geo.GeoUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Synthesizes turn-by-turn instructions from a walked path.
 *
 * <p>The walk keeps a running distance on the current road. At every interior vertex the
 * incoming and outgoing bearings are compared; a boundary fires on any non-continue turn or on
 * a road-name change, closing the running distance into the instruction anchored at that
 * vertex. Edges shorter than {@link InstructionConfig#getMinSegmentMeters()} never open a
 * decision and never replace the last reliable bearing, so densely sampled vertices do not
 * produce phantom turns.</p>
 *
 * <p>Stateless and thread-safe.</p>
 */
public final class InstructionGenerator {
    static final String ARRIVAL_SUFFIX = " to arrive at your destination";

    private final InstructionConfig config;
    private final TurnClassifier classifier;

    public InstructionGenerator() {
        this(InstructionConfig.defaults());
    }

    public InstructionGenerator(InstructionConfig config) {
        this.config = Objects.requireNonNull(config, "config").validate();
        this.classifier = new TurnClassifier(config);
    }

    /**
     * Generates head, boundary and arrival instructions for {@code path}.
     */
    public InstructionSet generate(RoutePath path) {
        Objects.requireNonNull(path, "path");
        List<Coordinate> coords = path.coordinates();
        List<String> names = path.edgeRoadNames();
        int last = coords.size() - 1;
        double minSegment = config.getMinSegmentMeters();

        List<Instruction> instructions = new ArrayList<>();
        String currentRoad = names.get(0);
        instructions.add(Instruction.builder()
                .text("Head " + GeoUtils.bearingToCardinal(headBearing(path)) + " on " + currentRoad)
                .location(coords.get(0))
                .pathIndex(0)
                .turn(TurnClassification.DEPART)
                .segmentDistanceMeters(0.0d)
                .roadName(currentRoad)
                .build());

        double running = 0.0d;
        double incomingBearing = Double.NaN;
        for (int vertex = 1; vertex < last; vertex++) {
            double inDistance = path.edgeDistances().getDouble(vertex - 1);
            running += inDistance;
            if (inDistance >= minSegment) {
                incomingBearing = GeoUtils.bearing(coords.get(vertex - 1), coords.get(vertex));
            }
            if (path.edgeDistances().getDouble(vertex) < minSegment) {
                continue;
            }

            double outgoingBearing = GeoUtils.bearing(coords.get(vertex), coords.get(vertex + 1));
            TurnClassification turn = Double.isNaN(incomingBearing)
                    ? TurnClassification.CONTINUE
                    : classifier.classify(GeoUtils.turnAngle(incomingBearing, outgoingBearing));
            String nextRoad = names.get(vertex);
            if (turn == TurnClassification.CONTINUE && nextRoad.equals(currentRoad)) {
                continue;
            }

            instructions.add(Instruction.builder()
                    .text("Continue on " + currentRoad + " for " + Math.round(running) + " meters, then "
                            + turn.phrase() + " onto " + nextRoad)
                    .location(coords.get(vertex))
                    .pathIndex(vertex)
                    .turn(turn)
                    .segmentDistanceMeters(running)
                    .roadName(nextRoad)
                    .build());
            currentRoad = nextRoad;
            running = 0.0d;
        }
        running += path.edgeDistances().getDouble(last - 1);

        long rounded = Math.round(running);
        String arrivalText = rounded == 0L
                ? "Continue on " + currentRoad + ARRIVAL_SUFFIX
                : "Continue on " + currentRoad + " for " + rounded + " meters" + ARRIVAL_SUFFIX;
        instructions.add(Instruction.builder()
                .text(arrivalText)
                .location(coords.get(last))
                .pathIndex(last)
                .turn(TurnClassification.ARRIVE)
                .segmentDistanceMeters(running)
                .roadName(currentRoad)
                .build());

        return new InstructionSet(instructions, path.totalDistanceMeters());
    }

    /**
     * Bearing of the first edge long enough to be reliable; falls back to the overall
     * start-to-end bearing, then north.
     */
    private double headBearing(RoutePath path) {
        List<Coordinate> coords = path.coordinates();
        for (int i = 0; i < path.edgeCount(); i++) {
            if (path.edgeDistances().getDouble(i) >= config.getMinSegmentMeters()) {
                return GeoUtils.bearing(coords.get(i), coords.get(i + 1));
            }
        }
        Coordinate first = coords.get(0);
        Coordinate last = coords.get(coords.size() - 1);
        return first.equals(last) ? 0.0d : GeoUtils.bearing(first, last);
    }
}
