package org.ippcode.compiler.frontend.semantics;

import org.ippcode.compiler.api.Frame;

import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

/**
 * Tracks the variables declared by DEFVAR during one parse pass.
 * <p>
 * Global declarations and local/temporary declarations are kept in separate namespaces.
 * A temporary frame becomes the local frame after PUSHFRAME, so {@code TF} declarations are
 * recorded in the local set. References into {@code TF} are never checked.
 */
public class DeclaredVariables implements DeclarationLookup {

    private final Set<String> globals = new HashSet<>();
    private final Set<String> locals = new HashSet<>();

    /**
     * Records a declaration. Redeclaring a name is accepted.
     * @param frame The frame named by the DEFVAR operand.
     * @param name The bare variable name.
     * @return {@code true} if the name was not declared in that namespace before.
     */
    public boolean declare(Frame frame, String name) {
        return namespaceOf(frame).add(name);
    }

    @Override
    public boolean isDeclared(Frame frame, String name) {
        if (frame == Frame.TF) {
            return true;
        }
        return namespaceOf(frame).contains(name);
    }

    /**
     * @return The names declared in the global frame.
     */
    public Set<String> globals() {
        return Collections.unmodifiableSet(globals);
    }

    /**
     * @return The names declared in the local or temporary frame.
     */
    public Set<String> locals() {
        return Collections.unmodifiableSet(locals);
    }

    private Set<String> namespaceOf(Frame frame) {
        return frame == Frame.GF ? globals : locals;
    }
}
