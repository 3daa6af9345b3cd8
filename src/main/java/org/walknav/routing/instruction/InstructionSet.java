package org.walknav.routing.instruction;

import java.util.List;

/**
 * Generated instructions with the total path distance they cover.
 *
 * @param instructions ordered instructions, head first and arrival last.
 * @param totalDistanceMeters sum of all edge distances.
 */
public record InstructionSet(List<Instruction> instructions, double totalDistanceMeters) {
    public InstructionSet {
        instructions = List.copyOf(instructions);
    }
}
