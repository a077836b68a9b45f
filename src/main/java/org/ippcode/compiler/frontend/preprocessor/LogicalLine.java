package org.ippcode.compiler.frontend.preprocessor;

import org.ippcode.compiler.api.SourceInfo;

/**
 * A source line after comment stripping and trimming. Never empty.
 *
 * @param source The physical line it was derived from.
 * @param content The remaining text.
 */
public record LogicalLine(SourceInfo source, String content) {
}
