package org.ippcode.compiler.frontend.preprocessor;

import org.ippcode.compiler.api.SourceInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Turns physical source lines into logical lines: everything from the first {@code #} on is
 * a comment, surrounding whitespace is trimmed and lines left empty are dropped.
 * <p>
 * The first logical line is reserved for the language header. It is compared after comment
 * stripping, so comment-only lines and comments behind the header are allowed.
 */
public class PreProcessor {

    private static final Logger LOG = LoggerFactory.getLogger(PreProcessor.class);
    private static final char COMMENT_MARKER = '#';
    private static final String BYTE_ORDER_MARK = "\uFEFF";
    private static final Pattern SURROUNDING_WHITESPACE = Pattern.compile("^\\s+|\\s+$", Pattern.UNICODE_CHARACTER_CLASS);

    private final String headerToken;
    private final boolean caseSensitiveHeader;
    private final String fileName;

    /**
     * Creates a new PreProcessor.
     * @param headerToken The exact header line, e.g. {@code .IPPcode23}.
     * @param caseSensitiveHeader Whether the header comparison respects case.
     * @param fileName The logical name of the source, for source positions.
     */
    public PreProcessor(String headerToken, boolean caseSensitiveHeader, String fileName) {
        this.headerToken = headerToken;
        this.caseSensitiveHeader = caseSensitiveHeader;
        this.fileName = fileName;
    }

    /**
     * Preprocesses the whole source.
     * @param rawLines The physical lines, without line terminators.
     * @return The header verdict and the logical lines after the header.
     */
    public PreProcessedSource process(List<String> rawLines) {
        LogicalLine header = null;
        List<LogicalLine> lines = new ArrayList<>();

        for (int i = 0; i < rawLines.size(); i++) {
            String raw = rawLines.get(i);
            if (i == 0 && raw.startsWith(BYTE_ORDER_MARK)) {
                raw = raw.substring(BYTE_ORDER_MARK.length());
            }
            String content = SURROUNDING_WHITESPACE.matcher(stripComment(raw)).replaceAll("");
            if (content.isEmpty()) {
                continue;
            }
            LogicalLine line = new LogicalLine(new SourceInfo(fileName, i + 1, raw), content);
            if (header == null) {
                header = line;
            } else {
                lines.add(line);
            }
        }

        boolean accepted = header != null && isHeader(header.content());
        LOG.debug("Preprocessed {} physical lines into {} logical lines, header accepted: {}",
                rawLines.size(), lines.size(), accepted);
        return new PreProcessedSource(accepted, header, lines);
    }

    private boolean isHeader(String content) {
        return caseSensitiveHeader ? headerToken.equals(content) : headerToken.equalsIgnoreCase(content);
    }

    static String stripComment(String line) {
        int marker = line.indexOf(COMMENT_MARKER);
        return marker < 0 ? line : line.substring(0, marker);
    }
}
