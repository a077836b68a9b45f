package org.ippcode.compiler.api;

/**
 * The coarse classes of failure a translation run can end with.
 * Each {@link CompilerErrorCode} belongs to exactly one kind; the command line
 * maps kinds to process exit codes.
 */
public enum ErrorKind {
    /** The mandatory header line is missing or malformed. */
    HEADER,
    /** The opcode of a line is not part of the instruction set. */
    UNKNOWN_OPCODE,
    /** A known opcode was given the wrong number of operands. */
    ARITY,
    /** An operand does not match the grammar of its expected category. */
    OPERAND_SYNTAX,
    /** A variable was referenced before a matching DEFVAR in its frame. */
    UNDECLARED_VARIABLE,
    /** More than one opcode-like token appeared on a line. */
    MULTIPLE_OPCODE,
    /** The source could not be read. */
    INPUT,
    /** An unexpected fault inside the translator. */
    INTERNAL
}
