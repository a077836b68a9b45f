package org.ippcode.compiler.diagnostics;

import org.ippcode.compiler.api.CompilerErrorCode;
import org.ippcode.compiler.api.SourceInfo;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * An engine for collecting the errors
 * that occur during the translation.
 * <p>
 * This decouples error reporting from the phases that detect the errors.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Reports an error that concerns the input as a whole.
     *
     * @param code The error code.
     * @param message The error message.
     * @param fileName The source in which the error occurred.
     */
    public void reportError(CompilerErrorCode code, String message, String fileName) {
        diagnostics.add(new Diagnostic(code, message, fileName, 0));
    }

    /**
     * Reports an error at a source position.
     *
     * @param code The error code.
     * @param message The error message.
     * @param source The position of the error.
     */
    public void reportError(CompilerErrorCode code, String message, SourceInfo source) {
        diagnostics.add(new Diagnostic(code, message, source.fileName(), source.lineNumber()));
    }

    /**
     * Checks if errors have been reported.
     *
     * @return {@code true} if at least one error exists, otherwise {@code false}.
     */
    public boolean hasErrors() {
        return !diagnostics.isEmpty();
    }

    /**
     * @return The first reported error, if any.
     */
    public Optional<Diagnostic> firstError() {
        return diagnostics.stream().findFirst();
    }

    /**
     * Returns an unmodifiable list of all collected diagnostics.
     *
     * @return An unmodifiable list of diagnostics.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * Returns all collected diagnostics as a single, formatted string.
     *
     * @return A formatted string summary of all diagnostics.
     */
    public String summary() {
        return diagnostics.stream()
                .map(Diagnostic::toString)
                .collect(Collectors.joining("\n"));
    }
}
