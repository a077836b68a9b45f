package org.ippcode.compiler.isa;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.ippcode.compiler.isa.OperandCategory.LABEL;
import static org.ippcode.compiler.isa.OperandCategory.SYMBOL;
import static org.ippcode.compiler.isa.OperandCategory.TYPE;
import static org.ippcode.compiler.isa.OperandCategory.VARIABLE;

/**
 * The immutable table of all IPPcode23 instructions and their operand signatures.
 * It is the single source of truth for arity and operand category expectations.
 */
public final class InstructionSet {

    private static final InstructionSet IPPCODE23 = createIppCode23();

    private final Map<String, InstructionSignature> signatures;

    private InstructionSet(Map<String, InstructionSignature> signatures) {
        this.signatures = Collections.unmodifiableMap(signatures);
    }

    /**
     * @return The shared IPPcode23 instruction set.
     */
    public static InstructionSet ippCode23() {
        return IPPCODE23;
    }

    /**
     * Looks up the signature of an opcode, ignoring case.
     * @param opcode The opcode as written in the source.
     * @return The signature, or empty if the opcode is not part of the instruction set.
     */
    public Optional<InstructionSignature> lookup(String opcode) {
        if (opcode == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(signatures.get(opcode.toUpperCase(Locale.ROOT)));
    }

    /**
     * @param token Any token.
     * @return {@code true} if the token names an instruction, ignoring case.
     */
    public boolean isOpcode(String token) {
        return lookup(token).isPresent();
    }

    /**
     * @return All canonical opcodes in registration order.
     */
    public Set<String> opcodes() {
        return signatures.keySet();
    }

    /**
     * @return The number of instructions.
     */
    public int size() {
        return signatures.size();
    }

    private static InstructionSet createIppCode23() {
        Map<String, InstructionSignature> table = new LinkedHashMap<>();

        // <var> <symb>
        registerFamily(table, List.of("MOVE", "INT2CHAR", "STRLEN", "TYPE", "NOT"), VARIABLE, SYMBOL);
        // No operands: frame control, return and debugging
        registerFamily(table, List.of("CREATEFRAME", "PUSHFRAME", "POPFRAME", "RETURN", "BREAK"));
        registerFamily(table, List.of("DEFVAR", "POPS"), VARIABLE);
        registerFamily(table, List.of("CALL", "LABEL", "JUMP"), LABEL);

        // Data stack, output, exit and debugging
        registerFamily(table, List.of("PUSHS", "WRITE", "EXIT", "DPRINT"), SYMBOL);

        // Arithmetic, relational, boolean, conversion and string operations
        registerFamily(table, List.of("ADD", "SUB", "MUL", "IDIV", "LT", "GT", "EQ", "AND", "OR",
                "STRI2INT", "CONCAT", "GETCHAR", "SETCHAR"), VARIABLE, SYMBOL, SYMBOL);

        // Input
        registerFamily(table, List.of("READ"), VARIABLE, TYPE);

        // Conditional jumps
        registerFamily(table, List.of("JUMPIFEQ", "JUMPIFNEQ"), LABEL, SYMBOL, SYMBOL);

        return new InstructionSet(table);
    }

    private static void registerFamily(Map<String, InstructionSignature> table, List<String> opcodes, OperandCategory... categories) {
        for (String opcode : opcodes) {
            InstructionSignature previous = table.put(opcode, new InstructionSignature(opcode, List.of(categories)));
            if (previous != null) {
                throw new IllegalStateException("Duplicate instruction registration: " + opcode);
            }
        }
    }
}
