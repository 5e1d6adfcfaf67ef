package com.q2galaxy.writer;

import com.q2galaxy.tooltree.ToolNode;
import com.q2galaxy.tooltree.order.CanonicalOrder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.xml.stream.XMLOutputFactory;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamWriter;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.Map;
import java.util.Objects;

/**
 * Turns a tool tree into the bytes of a Galaxy tool XML file.
 * <p>
 * The tree is canonicalized with {@link CanonicalOrder}, the root receives {@code profile} and {@code license},
 * and the document is written as: XML declaration, copyright comment, provenance comment, root element, one
 * element per line indented by {@link #getIndent()} spaces. Elements holding only text stay on one line; elements
 * with neither text nor children are self-closed. Text followed by children keeps the first child on the same line
 * as the text; whitespace-only text in front of children is replaced by the indentation.
 * <p>
 * Text, attribute values and comments are checked against the XML 1.0 character set before writing, and comment
 * bodies may not contain {@code --}; violations raise {@link ToolWriteException}.
 */
public final class ToolDocumentAssembler {

    private static final Logger log = LoggerFactory.getLogger(ToolDocumentAssembler.class);

    public static final int DEFAULT_INDENT = 4;

    private static final String ENCODING = StandardCharsets.UTF_8.name();
    private static final String XML_VERSION = "1.0";
    private static final String NEWLINE = "\n";

    private final CanonicalOrder order;
    private final Clock clock;
    private final int indent;

    public ToolDocumentAssembler() {
        this(CanonicalOrder.TOOL, Clock.systemDefaultZone(), DEFAULT_INDENT);
    }

    /**
     * @param order  canonical ordering applied before writing
     * @param clock  source of the copyright year
     * @param indent spaces per nesting level
     */
    public ToolDocumentAssembler(CanonicalOrder order, Clock clock, int indent) {
        this.order = Objects.requireNonNull(order, "order");
        this.clock = Objects.requireNonNull(clock, "clock");
        if (indent < 0) {
            throw new IllegalArgumentException("indent must be >= 0: " + indent);
        }
        this.indent = indent;
    }

    public int getIndent() {
        return indent;
    }

    /**
     * Canonicalizes {@code tool}, sets {@code profile} and {@code license} on the root (replacing existing values in
     * place) and returns the finished tree.
     */
    public ToolNode decorate(ToolNode tool, ToolMetadata metadata) {
        return order.apply(tool)
                .withAttribute("profile", metadata.profile())
                .withAttribute("license", metadata.license());
    }

    /**
     * Serializes {@code tool} as a complete UTF-8 document.
     *
     * @throws com.q2galaxy.tooltree.order.UnknownSectionException if a top-level section is not a known Galaxy section
     * @throws ToolWriteException if the XML writer fails
     */
    public byte[] assemble(ToolNode tool, ToolMetadata metadata) {
        Objects.requireNonNull(tool, "tool");
        Objects.requireNonNull(metadata, "metadata");
        ToolNode root = decorate(tool, metadata);

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try {
            XMLStreamWriter w = XMLOutputFactory.newInstance().createXMLStreamWriter(out, ENCODING);
            w.writeStartDocument(ENCODING, XML_VERSION);
            w.writeCharacters(NEWLINE);
            w.writeComment(XmlChars.requireComment(CopyrightNotice.current(clock), "copyright notice"));
            w.writeCharacters(NEWLINE);
            w.writeComment(XmlChars.requireComment(metadata.provenanceComment(), "provenance comment"));
            w.writeCharacters(NEWLINE);
            writeElement(w, root, 0);
            w.writeCharacters(NEWLINE);
            w.writeEndDocument();
            w.flush();
            w.close();
        } catch (XMLStreamException e) {
            throw new ToolWriteException("Failed to serialize tool <" + tool.getTag() + ">", e);
        }
        byte[] bytes = out.toByteArray();
        log.debug("Assembled tool {} ({} bytes)", root.getAttribute("id"), bytes.length);
        return bytes;
    }

    private void writeElement(XMLStreamWriter w, ToolNode node, int depth) throws XMLStreamException {
        String text = node.getText();
        boolean hasChildren = !node.getChildren().isEmpty();
        boolean empty = !hasChildren && text == null;
        if (empty) {
            w.writeEmptyElement(node.getTag());
        } else {
            w.writeStartElement(node.getTag());
        }
        for (Map.Entry<String, String> attr : node.getAttributes().entrySet()) {
            String where = "attribute " + attr.getKey() + " of <" + node.getTag() + ">";
            w.writeAttribute(attr.getKey(), XmlChars.requireText(attr.getValue(), where));
        }
        if (empty) {
            return;
        }
        // blank text before children gives way to indentation
        boolean inlineText = text != null && (!hasChildren || !text.isBlank());
        if (inlineText) {
            w.writeCharacters(XmlChars.requireText(text, "text of <" + node.getTag() + ">"));
        }
        boolean first = true;
        for (ToolNode child : node.getChildren()) {
            if (!(first && inlineText)) {
                w.writeCharacters(NEWLINE + " ".repeat(indent * (depth + 1)));
            }
            first = false;
            writeElement(w, child, depth + 1);
        }
        if (hasChildren) {
            w.writeCharacters(NEWLINE + " ".repeat(indent * depth));
        }
        w.writeEndElement();
    }
}
