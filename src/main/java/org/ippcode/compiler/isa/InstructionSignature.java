package org.ippcode.compiler.isa;

import java.util.List;

/**
 * Describes the expected signature of an instruction, i.e., the number
 * and categories of its operands.
 *
 * @param opcode The canonical, upper-case opcode.
 * @param operandCategories An unmodifiable list of the expected operand categories.
 */
public record InstructionSignature(String opcode, List<OperandCategory> operandCategories) {

    /**
     * Creates a signature and ensures that the list is unmodifiable.
     * @param opcode The canonical opcode.
     * @param operandCategories The list of operand categories.
     */
    public InstructionSignature {
        operandCategories = List.copyOf(operandCategories);
        if (operandCategories.size() > 3) {
            throw new IllegalArgumentException("An instruction takes at most three operands: " + opcode);
        }
    }

    /**
     * Returns the expected number of operands.
     * @return The number of operands.
     */
    public int getArity() {
        return operandCategories.size();
    }

    /**
     * @param index The 0-based operand position.
     * @return The category expected at that position.
     */
    public OperandCategory categoryAt(int index) {
        return operandCategories.get(index);
    }
}
