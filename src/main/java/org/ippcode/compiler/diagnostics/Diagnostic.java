package org.ippcode.compiler.diagnostics;

import org.ippcode.compiler.api.CompilerErrorCode;

/**
 * Represents a single error that occurred during the translation.
 *
 * @param code The testable error code.
 * @param message The diagnostic message.
 * @param fileName The name of the source where the issue occurred.
 * @param lineNumber The physical line number of the issue, or 0 if it concerns the whole input.
 */
public record Diagnostic(
        CompilerErrorCode code,
        String message,
        String fileName,
        int lineNumber
) {
    @Override
    public String toString() {
        return String.format("[%s] %s:%d: %s", code, fileName, lineNumber, message);
    }
}
