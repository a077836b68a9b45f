package org.ippcode.compiler.api;

import java.util.List;

/**
 * A fully validated instruction.
 *
 * @param order The 1-based position among all instructions of the program.
 * @param opcode The canonical, upper-case opcode.
 * @param operands The classified operands, one per signature position.
 * @param sourceInfo The line the instruction was read from.
 */
public record Instruction(int order, String opcode, List<Operand> operands, SourceInfo sourceInfo) {

    public Instruction {
        if (order < 1) {
            throw new IllegalArgumentException("Instruction order must be positive: " + order);
        }
        operands = List.copyOf(operands);
    }
}
