package org.ippcode.compiler.api;

/**
 * Defines unique, testable error codes for all errors that can occur during translation.
 * This decouples the test logic from the wording of the error messages.
 */
public enum CompilerErrorCode {
    // region Header Errors
    /** The input contains no logical line at all. */
    MISSING_HEADER(ErrorKind.HEADER),
    /** The first logical line is not the language header. */
    INVALID_HEADER(ErrorKind.HEADER),
    // endregion

    // region Instruction Errors
    /** An unknown instruction mnemonic was used. */
    UNKNOWN_INSTRUCTION(ErrorKind.UNKNOWN_OPCODE),
    /** A line carries more than one opcode-like token. */
    MULTIPLE_OPCODES(ErrorKind.MULTIPLE_OPCODE),
    /** The operand count does not match the instruction signature. */
    INVALID_OPERAND_COUNT(ErrorKind.ARITY),
    // endregion

    // region Operand Errors
    /** A variable operand is not of the form FRAME@name. */
    INVALID_VARIABLE(ErrorKind.OPERAND_SYNTAX),
    /** A constant does not match the grammar of its type. */
    INVALID_LITERAL(ErrorKind.OPERAND_SYNTAX),
    /** A label operand is not a valid identifier. */
    INVALID_LABEL(ErrorKind.OPERAND_SYNTAX),
    /** A type operand is not one of int, bool or string. */
    INVALID_TYPE(ErrorKind.OPERAND_SYNTAX),
    /** A GF or LF variable was used before its DEFVAR. */
    UNDECLARED_VARIABLE(ErrorKind.UNDECLARED_VARIABLE),
    // endregion

    // region General Errors
    /** An I/O error occurred while reading the source. */
    IO_ERROR_READING_FILE(ErrorKind.INPUT),
    /** An unknown or unexpected error occurred. */
    UNKNOWN_ERROR(ErrorKind.INTERNAL);
    // endregion

    private final ErrorKind kind;

    CompilerErrorCode(ErrorKind kind) {
        this.kind = kind;
    }

    /**
     * @return The error kind this code belongs to.
     */
    public ErrorKind kind() {
        return kind;
    }
}
