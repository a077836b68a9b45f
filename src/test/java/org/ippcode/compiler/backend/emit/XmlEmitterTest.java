package org.ippcode.compiler.backend.emit;

import org.ippcode.compiler.api.Instruction;
import org.ippcode.compiler.api.Operand;
import org.ippcode.compiler.api.OperandKind;
import org.ippcode.compiler.api.Program;
import org.ippcode.compiler.api.SourceInfo;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NodeList;
import org.xml.sax.InputSource;

import javax.xml.parsers.DocumentBuilderFactory;
import java.io.IOException;
import java.io.StringReader;
import java.io.Writer;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for the {@link XmlEmitter}. The output is parsed back, so the
 * assertions do not depend on attribute order or whitespace.
 */
public class XmlEmitterTest {

    private static final SourceInfo SOURCE = new SourceInfo("test.ippc", 2, "");

    @Test
    @Tag("unit")
    void testEmitsProgramStructure() throws Exception {
        // Arrange
        Program program = new Program("IPPcode23", List.of(
                new Instruction(1, "DEFVAR", List.of(new Operand(OperandKind.VAR, "GF@x")), SOURCE),
                new Instruction(2, "MOVE", List.of(
                        new Operand(OperandKind.VAR, "GF@x"),
                        new Operand(OperandKind.INT, "-7")), SOURCE),
                new Instruction(3, "CREATEFRAME", List.of(), SOURCE)));

        // Act
        String xml = new XmlEmitter().emitToString(program);

        // Assert
        assertThat(xml).startsWith("<?xml version=\"1.0\" encoding=\"UTF-8\"");
        Element root = parse(xml).getDocumentElement();
        assertThat(root.getTagName()).isEqualTo("program");
        assertThat(root.getAttribute("language")).isEqualTo("IPPcode23");

        NodeList instructions = root.getElementsByTagName("instruction");
        assertThat(instructions.getLength()).isEqualTo(3);
        Element move = (Element) instructions.item(1);
        assertThat(move.getAttribute("order")).isEqualTo("2");
        assertThat(move.getAttribute("opcode")).isEqualTo("MOVE");
        Element arg2 = (Element) move.getElementsByTagName("arg2").item(0);
        assertThat(arg2.getAttribute("type")).isEqualTo("int");
        assertThat(arg2.getTextContent()).isEqualTo("-7");
        assertThat(((Element) instructions.item(2)).getElementsByTagName("*").getLength()).isZero();
    }

    @Test
    @Tag("unit")
    void testEscapesMarkupInValues() throws Exception {
        Program program = new Program("IPPcode23", List.of(
                new Instruction(1, "WRITE", List.of(new Operand(OperandKind.STRING, "<a&b>")), SOURCE)));

        String xml = new XmlEmitter().emitToString(program);

        assertThat(xml).contains("&lt;a&amp;b&gt;");
        Element arg1 = (Element) parse(xml).getElementsByTagName("arg1").item(0);
        assertThat(arg1.getTextContent()).isEqualTo("<a&b>");
        assertThat(arg1.getAttribute("type")).isEqualTo("string");
    }

    /**
     * Verifies that decoded characters XML 1.0 cannot carry are written back in their escaped
     * source form, so the document stays well-formed.
     */
    @Test
    @Tag("unit")
    void testControlCharactersAreWrittenAsEscapes() throws Exception {
        // Arrange
        Program program = new Program("IPPcode23", List.of(
                new Instruction(1, "WRITE", List.of(new Operand(OperandKind.STRING, "a\u0000b")), SOURCE),
                new Instruction(2, "WRITE", List.of(new Operand(OperandKind.STRING, "a\u000Bb")), SOURCE),
                new Instruction(3, "WRITE", List.of(new Operand(OperandKind.STRING, "tab\there")), SOURCE)));

        // Act
        Document document = parse(new XmlEmitter().emitToString(program));

        // Assert
        NodeList args = document.getElementsByTagName("arg1");
        assertThat(args.item(0).getTextContent()).isEqualTo("a\\000b");
        assertThat(args.item(1).getTextContent()).isEqualTo("a\\011b");
        assertThat(args.item(2).getTextContent()).isEqualTo("tab\there");
    }

    @Test
    @Tag("unit")
    void testXmlTextLeavesPrintableTextUntouched() {
        String text = "<a&b> \u010D";

        assertThat(XmlEmitter.toXmlText(text)).isSameAs(text);
        assertThat(XmlEmitter.toXmlText("\u0001\u001F")).isEqualTo("\\001\\031");
    }

    @Test
    @Tag("unit")
    void testTypeNamesOfAllOperandKinds() throws Exception {
        Program program = new Program("IPPcode23", List.of(
                new Instruction(1, "JUMPIFEQ", List.of(
                        new Operand(OperandKind.LABEL, "end"),
                        new Operand(OperandKind.BOOL, "true"),
                        new Operand(OperandKind.NIL, "nil")), SOURCE),
                new Instruction(2, "READ", List.of(
                        new Operand(OperandKind.VAR, "LF@y"),
                        new Operand(OperandKind.TYPE, "bool")), SOURCE)));

        Document document = parse(new XmlEmitter().emitToString(program));

        assertThat(typeOf(document, "arg1", 0)).isEqualTo("label");
        assertThat(typeOf(document, "arg2", 0)).isEqualTo("bool");
        assertThat(typeOf(document, "arg3", 0)).isEqualTo("nil");
        assertThat(typeOf(document, "arg1", 1)).isEqualTo("var");
        assertThat(typeOf(document, "arg2", 1)).isEqualTo("type");
    }

    @Test
    @Tag("unit")
    void testIndentation() throws Exception {
        Program program = new Program("IPPcode23", List.of(new Instruction(1, "BREAK", List.of(), SOURCE)));

        assertThat(new XmlEmitter().emitToString(program)).contains("\n    <instruction ");
        assertThat(new XmlEmitter(2).emitToString(program)).contains("\n  <instruction ");
        assertThat(new XmlEmitter(0).emitToString(program)).doesNotContain("\n<instruction", "\n <instruction");
    }

    @Test
    @Tag("unit")
    void testEmptyProgram() throws Exception {
        Element root = parse(new XmlEmitter().emitToString(new Program("IPPcode23", List.of()))).getDocumentElement();

        assertThat(root.getTagName()).isEqualTo("program");
        assertThat(root.getChildNodes().getLength()).isZero();
    }

    @Test
    @Tag("unit")
    void testNegativeIndentIsRejected() {
        assertThatThrownBy(() -> new XmlEmitter(-1)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @Tag("unit")
    void testWriteFailureIsReported() {
        Writer broken = new Writer() {
            @Override
            public void write(char[] cbuf, int off, int len) throws IOException {
                throw new IOException("disk full");
            }

            @Override
            public void flush() throws IOException {
                throw new IOException("disk full");
            }

            @Override
            public void close() {
            }
        };
        Program program = new Program("IPPcode23", List.of());

        assertThatThrownBy(() -> new XmlEmitter().emit(program, broken))
                .isInstanceOf(EmissionException.class);
    }

    private static Document parse(String xml) throws Exception {
        return DocumentBuilderFactory.newInstance().newDocumentBuilder().parse(new InputSource(new StringReader(xml)));
    }

    private static String typeOf(Document document, String tag, int index) {
        return ((Element) document.getElementsByTagName(tag).item(index)).getAttribute("type");
    }
}
