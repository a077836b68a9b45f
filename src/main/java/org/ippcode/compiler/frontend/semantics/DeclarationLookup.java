package org.ippcode.compiler.frontend.semantics;

import org.ippcode.compiler.api.Frame;

/**
 * Read-only view on the variables declared so far.
 */
@FunctionalInterface
public interface DeclarationLookup {

    /** A lookup that treats every variable as declared. Used for the operand of DEFVAR. */
    DeclarationLookup UNCHECKED = (frame, name) -> true;

    /**
     * @param frame The frame of the variable reference.
     * @param name The bare variable name.
     * @return {@code true} if the reference may be used at this point of the program.
     */
    boolean isDeclared(Frame frame, String name);
}
