package org.ippcode.compiler.api;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Defines the public interface of the IPPcode translator.
 */
public interface ICompiler {

    /**
     * Translates the given source code.
     *
     * @param sourceLines The physical lines of the source, without line terminators.
     * @param programName A name for the source, used in diagnostics.
     * @return The validated {@link Program}.
     * @throws CompilationException on the first header, syntax or semantic error.
     */
    Program compile(List<String> sourceLines, String programName) throws CompilationException;

    /**
     * Translates the source code from a file.
     * @param programPath The path to the source file.
     * @return The validated {@link Program}.
     * @throws CompilationException if the source is invalid.
     * @throws IOException if the file cannot be read.
     */
    default Program compile(Path programPath) throws CompilationException, IOException {
        return compile(Files.readAllLines(programPath, StandardCharsets.UTF_8), programPath.toString());
    }
}
