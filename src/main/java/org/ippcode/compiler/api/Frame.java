package org.ippcode.compiler.api;

import java.util.Optional;

/**
 * The three variable storage scopes a variable operand can name.
 */
public enum Frame {
    /** The global frame. */
    GF,
    /** The local frame, i.e. the top of the frame stack. */
    LF,
    /** The temporary frame, not yet pushed. */
    TF;

    /**
     * Resolves a frame prefix exactly as written (case-sensitive).
     * @param prefix The text in front of the '@'.
     * @return The frame, or empty if the prefix names no frame.
     */
    public static Optional<Frame> fromPrefix(String prefix) {
        for (Frame frame : values()) {
            if (frame.name().equals(prefix)) {
                return Optional.of(frame);
            }
        }
        return Optional.empty();
    }
}
