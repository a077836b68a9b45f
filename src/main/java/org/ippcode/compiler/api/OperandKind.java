package org.ippcode.compiler.api;

/**
 * The concrete type of an operand after classification.
 * The lowercase {@link #typeName()} is the value of the XML {@code type} attribute.
 */
public enum OperandKind {
    VAR("var"),
    INT("int"),
    BOOL("bool"),
    STRING("string"),
    NIL("nil"),
    LABEL("label"),
    TYPE("type");

    private final String typeName;

    OperandKind(String typeName) {
        this.typeName = typeName;
    }

    /**
     * @return The name used in the XML representation.
     */
    public String typeName() {
        return typeName;
    }
}
