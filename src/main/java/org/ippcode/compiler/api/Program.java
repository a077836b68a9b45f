package org.ippcode.compiler.api;

import java.util.List;

/**
 * The result of a successful translation run: the accepted language and all instructions
 * in source order. A program only exists once its header has been accepted.
 *
 * @param language The language name written to the {@code language} attribute (e.g. IPPcode23).
 * @param instructions The instructions, ordered by {@link Instruction#order()}.
 */
public record Program(String language, List<Instruction> instructions) {

    public Program {
        instructions = List.copyOf(instructions);
    }

    /**
     * @return {@code true} if the program contains no instruction.
     */
    public boolean isEmpty() {
        return instructions.isEmpty();
    }
}
