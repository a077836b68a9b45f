package org.ippcode.compiler.frontend.preprocessor;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for the {@link PreProcessor}: comment stripping, blank line removal
 * and the header check.
 */
public class PreProcessorTest {

    private final PreProcessor preProcessor = new PreProcessor(".IPPcode23", true, "test.ippc");

    @Test
    @Tag("unit")
    void testStripsCommentsAndBlankLines() {
        // Arrange
        List<String> source = List.of(
                ".IPPcode23",
                "",
                "   # only a comment",
                "  DEFVAR GF@x   # declare",
                "\tWRITE GF@x\t",
                "#");

        // Act
        PreProcessedSource result = preProcessor.process(source);

        // Assert
        assertThat(result.headerAccepted()).isTrue();
        assertThat(result.lines()).extracting(LogicalLine::content)
                .containsExactly("DEFVAR GF@x", "WRITE GF@x");
        assertThat(result.lines()).extracting(line -> line.source().lineNumber())
                .containsExactly(4, 5);
        assertThat(result.lines().get(0).source().fileName()).isEqualTo("test.ippc");
        assertThat(result.lines().get(0).source().lineContent()).isEqualTo("  DEFVAR GF@x   # declare");
    }

    /**
     * Verifies that the header is the first line left after comment stripping, so leading
     * comments and a comment behind the header are allowed.
     */
    @Test
    @Tag("unit")
    void testHeaderIsCheckedAfterCommentStripping() {
        PreProcessedSource result = preProcessor.process(List.of(
                "# program header follows",
                "   ",
                "  .IPPcode23   # header",
                "BREAK"));

        assertThat(result.headerAccepted()).isTrue();
        assertThat(result.header().source().lineNumber()).isEqualTo(3);
        assertThat(result.lines()).extracting(LogicalLine::content).containsExactly("BREAK");
    }

    @Test
    @Tag("unit")
    void testWrongHeaderIsNotAccepted() {
        PreProcessedSource result = preProcessor.process(List.of(".IPPcode22", "BREAK"));

        assertThat(result.headerAccepted()).isFalse();
        assertThat(result.header().content()).isEqualTo(".IPPcode22");
    }

    @Test
    @Tag("unit")
    void testHeaderMustBeAloneOnItsLine() {
        assertThat(preProcessor.process(List.of(".IPPcode23 BREAK")).headerAccepted()).isFalse();
    }

    @Test
    @Tag("unit")
    void testHeaderComparisonIsCaseSensitiveByDefault() {
        assertThat(preProcessor.process(List.of(".ippcode23")).headerAccepted()).isFalse();

        PreProcessor lenient = new PreProcessor(".IPPcode23", false, "test.ippc");
        assertThat(lenient.process(List.of(".ippCODE23")).headerAccepted()).isTrue();
    }

    @Test
    @Tag("unit")
    void testEmptyInputHasNoHeader() {
        PreProcessedSource result = preProcessor.process(List.of("", "# nothing here"));

        assertThat(result.headerAccepted()).isFalse();
        assertThat(result.header()).isNull();
        assertThat(result.lines()).isEmpty();
    }

    @Test
    @Tag("unit")
    void testByteOrderMarkBeforeHeaderIsIgnored() {
        assertThat(preProcessor.process(List.of("\uFEFF.IPPcode23")).headerAccepted()).isTrue();
    }

    @Test
    @Tag("unit")
    void testStripCommentCutsAtFirstMarker() {
        assertThat(PreProcessor.stripComment("WRITE string@a#b#c")).isEqualTo("WRITE string@a");
        assertThat(PreProcessor.stripComment("no comment")).isEqualTo("no comment");
    }
}
