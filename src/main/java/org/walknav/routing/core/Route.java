package org.walknav.routing.core;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.walknav.routing.geo.Coordinate;
import org.walknav.routing.instruction.Instruction;
import org.walknav.routing.spatial.SnapResult;

import java.util.List;

/**
 * Computed walking route.
 *
 * <p>Every instruction location is a coordinate of {@link #getPath()}; the last instruction
 * is the destination.</p>
 */
@Value
@Builder
public class Route {
    /** Path vertices from start node to end node. */
    @Singular("pathPoint")
    List<Coordinate> path;
    /** Road name of each path edge. */
    @Singular
    List<String> edgeRoadNames;
    @Singular
    List<Instruction> instructions;
    double totalDistanceMeters;
    long estimatedTimeSeconds;
    SnapResult start;
    SnapResult end;

    /**
     * Path index of every instruction anchor, in instruction order.
     */
    public int[] instructionPathIndices() {
        int[] indices = new int[instructions.size()];
        for (int i = 0; i < indices.length; i++) {
            indices[i] = instructions.get(i).getPathIndex();
        }
        return indices;
    }

    public Instruction finalInstruction() {
        return instructions.get(instructions.size() - 1);
    }

    public Coordinate destination() {
        return path.get(path.size() - 1);
    }
}
