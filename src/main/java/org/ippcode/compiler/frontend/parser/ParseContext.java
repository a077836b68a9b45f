package org.ippcode.compiler.frontend.parser;

import org.ippcode.compiler.frontend.semantics.DeclaredVariables;

/**
 * The mutable state of one parse pass: the variables declared so far and the
 * order number of the next instruction. A new context is created for every run.
 */
public class ParseContext {

    private final DeclaredVariables declaredVariables = new DeclaredVariables();
    private int nextOrder = 1;

    /**
     * @return The variables declared so far.
     */
    public DeclaredVariables getDeclaredVariables() {
        return declaredVariables;
    }

    /**
     * Consumes an order number. Only called once a line has been fully validated.
     * @return The allocated order number.
     */
    int allocateOrder() {
        return nextOrder++;
    }
}
