package org.ippcode.compiler.isa;

/**
 * The abstract operand categories an instruction signature can expect.
 * This is used by the instruction parser to pick the grammar an operand is checked against.
 */
public enum OperandCategory {
    /** A variable, e.g. {@code GF@counter}. */
    VARIABLE,
    /** A variable or a typed constant, e.g. {@code int@42} or {@code LF@x}. */
    SYMBOL,
    /** A label name, e.g. {@code loop}. */
    LABEL,
    /** A type name: {@code int}, {@code bool} or {@code string}. */
    TYPE
}
