package org.ippcode.compiler.api;

import org.ippcode.compiler.diagnostics.Diagnostic;

/**
 * An exception that is thrown when the translation stops at an error.
 * <p>
 * It is part of the public API and carries the {@link Diagnostic} that ended the run, so
 * callers can tell an unknown opcode from a malformed operand by its {@link CompilerErrorCode}.
 */
public class CompilationException extends Exception {

    private final transient Diagnostic diagnostic;

    /**
     * Constructs a new compilation exception from the diagnostic that caused it.
     * @param diagnostic The error diagnostic.
     */
    public CompilationException(Diagnostic diagnostic) {
        super(diagnostic.toString(), null);
        this.diagnostic = diagnostic;
    }

    /**
     * Constructs a new compilation exception with the specified diagnostic and cause.
     * @param diagnostic The error diagnostic.
     * @param cause The cause.
     */
    public CompilationException(Diagnostic diagnostic, Throwable cause) {
        super(diagnostic.toString(), cause);
        this.diagnostic = diagnostic;
    }

    /**
     * @return The diagnostic that ended the run.
     */
    public Diagnostic getDiagnostic() {
        return diagnostic;
    }

    /**
     * @return The error code of the diagnostic.
     */
    public CompilerErrorCode getErrorCode() {
        return diagnostic.code();
    }

    /**
     * @return The error kind of the diagnostic.
     */
    public ErrorKind getKind() {
        return diagnostic.code().kind();
    }
}
