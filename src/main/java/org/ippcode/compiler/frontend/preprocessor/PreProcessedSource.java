package org.ippcode.compiler.frontend.preprocessor;

import java.util.List;

/**
 * The output of the {@link PreProcessor}.
 *
 * @param headerAccepted Whether the first logical line is the expected language header.
 * @param header The first logical line, or {@code null} if the input has none.
 * @param lines The logical lines following the header.
 */
public record PreProcessedSource(boolean headerAccepted, LogicalLine header, List<LogicalLine> lines) {

    public PreProcessedSource {
        lines = List.copyOf(lines);
    }
}
