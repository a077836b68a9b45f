package org.ippcode.compiler.backend.emit;

/**
 * Thrown when a program cannot be serialized or written.
 */
public class EmissionException extends Exception {

    /**
     * @param message The detail message.
     * @param cause The cause.
     */
    public EmissionException(String message, Throwable cause) {
        super(message, cause);
    }
}
