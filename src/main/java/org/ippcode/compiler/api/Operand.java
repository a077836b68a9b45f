package org.ippcode.compiler.api;

import org.ippcode.compiler.util.Literals;

import java.math.BigInteger;
import java.util.Objects;

/**
 * A classified instruction operand.
 * <p>
 * Operands are only created by the operand classifier after the token has been validated
 * against its expected category, so the kind always fits the position it occupies.
 *
 * @param kind The concrete operand kind.
 * @param value The payload: {@code FRAME@name} for variables, the decoded text for strings,
 *              the literal text as written for the other constants, labels and types.
 */
public record Operand(OperandKind kind, String value) {

    public Operand {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(value, "value");
    }

    /**
     * @return The frame of a variable operand.
     * @throws IllegalStateException if this operand is not a variable.
     */
    public Frame frame() {
        requireKind(OperandKind.VAR);
        return Frame.valueOf(value.substring(0, value.indexOf('@')));
    }

    /**
     * @return The bare name of a variable operand, without its frame prefix.
     * @throws IllegalStateException if this operand is not a variable.
     */
    public String variableName() {
        requireKind(OperandKind.VAR);
        return value.substring(value.indexOf('@') + 1);
    }

    /**
     * Decodes an integer constant written in decimal, octal ({@code 0o}) or hexadecimal ({@code 0x}).
     * @return The numeric value of an integer operand.
     * @throws IllegalStateException if this operand is not an integer constant.
     */
    public BigInteger intValue() {
        requireKind(OperandKind.INT);
        return Literals.decodeInteger(value);
    }

    private void requireKind(OperandKind expected) {
        if (kind != expected) {
            throw new IllegalStateException("Operand " + this + " is not of kind " + expected);
        }
    }

    @Override
    public String toString() {
        return kind.typeName() + ":" + value;
    }
}
