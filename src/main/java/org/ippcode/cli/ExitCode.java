package org.ippcode.cli;

import org.ippcode.compiler.api.ErrorKind;

import java.util.EnumMap;
import java.util.Map;

/**
 * Process exit codes of the {@code ippcode-parse} command.
 */
public enum ExitCode {
    SUCCESS(0),
    INVALID_PARAMETERS(10),
    INPUT_ERROR(11),
    OUTPUT_ERROR(12),
    HEADER(21),
    UNKNOWN_OPCODE(22),
    SYNTAX(23),
    INTERNAL(99);

    private static final Map<ErrorKind, ExitCode> BY_KIND = new EnumMap<>(ErrorKind.class);

    static {
        BY_KIND.put(ErrorKind.HEADER, HEADER);
        BY_KIND.put(ErrorKind.UNKNOWN_OPCODE, UNKNOWN_OPCODE);
        BY_KIND.put(ErrorKind.ARITY, SYNTAX);
        BY_KIND.put(ErrorKind.OPERAND_SYNTAX, SYNTAX);
        BY_KIND.put(ErrorKind.UNDECLARED_VARIABLE, SYNTAX);
        BY_KIND.put(ErrorKind.MULTIPLE_OPCODE, SYNTAX);
        BY_KIND.put(ErrorKind.INPUT, INPUT_ERROR);
        BY_KIND.put(ErrorKind.INTERNAL, INTERNAL);
    }

    private final int code;

    ExitCode(int code) {
        this.code = code;
    }

    /**
     * @return The numeric process exit code.
     */
    public int code() {
        return code;
    }

    /**
     * @param kind The kind of error that ended the run.
     * @return The exit code designated for that kind.
     */
    public static ExitCode forKind(ErrorKind kind) {
        return BY_KIND.getOrDefault(kind, INTERNAL);
    }
}
