package org.ippcode.compiler.backend.emit;

import org.ippcode.compiler.api.Instruction;
import org.ippcode.compiler.api.Operand;
import org.ippcode.compiler.api.Program;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;
import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Serializes a {@link Program} into its XML representation:
 * <pre>
 * &lt;program language="IPPcode23"&gt;
 *     &lt;instruction order="1" opcode="WRITE"&gt;
 *         &lt;arg1 type="string"&gt;hello&lt;/arg1&gt;
 *     &lt;/instruction&gt;
 * &lt;/program&gt;
 * </pre>
 */
public class XmlEmitter {

    private static final Logger LOG = LoggerFactory.getLogger(XmlEmitter.class);
    private static final String INDENT_AMOUNT = "{http://xml.apache.org/xslt}indent-amount";

    private final int indent;

    /**
     * Creates an emitter with four spaces of indentation.
     */
    public XmlEmitter() {
        this(4);
    }

    /**
     * @param indent The number of spaces per nesting level; 0 writes everything on one line.
     */
    public XmlEmitter(int indent) {
        if (indent < 0) {
            throw new IllegalArgumentException("Indentation must not be negative: " + indent);
        }
        this.indent = indent;
    }

    /**
     * Writes the program as an XML document.
     * @param program The program to serialize.
     * @param out The destination. It is flushed, not closed.
     * @throws EmissionException if the document cannot be built or written.
     */
    public void emit(Program program, Writer out) throws EmissionException {
        try {
            Document document = toDocument(program);
            Transformer transformer = TransformerFactory.newInstance().newTransformer();
            transformer.setOutputProperty(OutputKeys.ENCODING, StandardCharsets.UTF_8.name());
            transformer.setOutputProperty(OutputKeys.METHOD, "xml");
            if (indent > 0) {
                transformer.setOutputProperty(OutputKeys.INDENT, "yes");
                transformer.setOutputProperty(INDENT_AMOUNT, Integer.toString(indent));
            }
            transformer.transform(new DOMSource(document), new StreamResult(out));
            out.flush();
            LOG.debug("Emitted {} instruction(s) as XML", program.instructions().size());
        } catch (ParserConfigurationException | TransformerException | IOException e) {
            throw new EmissionException("Failed to write the XML representation", e);
        }
    }

    /**
     * Serializes the program into a string.
     * @param program The program to serialize.
     * @return The XML document.
     * @throws EmissionException if the document cannot be built.
     */
    public String emitToString(Program program) throws EmissionException {
        StringWriter out = new StringWriter();
        emit(program, out);
        return out.toString();
    }

    private Document toDocument(Program program) throws ParserConfigurationException {
        Document document = DocumentBuilderFactory.newInstance().newDocumentBuilder().newDocument();
        document.setXmlStandalone(true);

        Element root = document.createElement("program");
        root.setAttribute("language", program.language());
        document.appendChild(root);

        for (Instruction instruction : program.instructions()) {
            Element element = document.createElement("instruction");
            element.setAttribute("order", Integer.toString(instruction.order()));
            element.setAttribute("opcode", instruction.opcode());

            List<Operand> operands = instruction.operands();
            for (int i = 0; i < operands.size(); i++) {
                Operand operand = operands.get(i);
                Element arg = document.createElement("arg" + (i + 1));
                arg.setAttribute("type", operand.kind().typeName());
                arg.setTextContent(toXmlText(operand.value()));
                element.appendChild(arg);
            }
            root.appendChild(element);
        }
        return document;
    }

    /**
     * Writes characters that XML 1.0 cannot represent back as their {@code \DDD} escape.
     */
    static String toXmlText(String value) {
        StringBuilder text = null;
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (isXmlChar(c)) {
                if (text != null) {
                    text.append(c);
                }
                continue;
            }
            if (text == null) {
                text = new StringBuilder(value.length() + 8).append(value, 0, i);
            }
            text.append(String.format("\\%03d", (int) c));
        }
        return text == null ? value : text.toString();
    }

    private static boolean isXmlChar(char c) {
        return c == '\t' || c == '\n' || c == '\r' || (c >= 0x20 && c != 0xFFFE && c != 0xFFFF);
    }
}
