package org.ippcode.compiler.api;

/**
 * A pure data class representing a position in the source code.
 * It is part of the public compiler API and free of implementation details.
 *
 * @param fileName The logical name of the source (e.g. {@code <stdin>}).
 * @param lineNumber The physical, 1-based line number.
 * @param lineContent The raw content of the line.
 */
public record SourceInfo(String fileName, int lineNumber, String lineContent) {

    @Override
    public String toString() {
        return fileName + ":" + lineNumber;
    }
}
