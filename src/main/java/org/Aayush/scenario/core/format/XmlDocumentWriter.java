package org.Aayush.scenario.core.format;

import javax.xml.stream.XMLOutputFactory;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamWriter;
import java.io.StringWriter;
import java.util.Objects;

/**
 * Small indenting facade over {@link XMLStreamWriter} for SUMO input documents.
 * <p>
 * Attributes are written in the order given, one element per line, four spaces per
 * nesting level. Documents are rendered fully in memory; nothing reaches disk until
 * {@link #finish()} returns.
 * <p>
 * Not thread-safe; one instance renders one document.
 */
public final class XmlDocumentWriter {
    public static final String XSI_NAMESPACE = "http://www.w3.org/2001/XMLSchema-instance";

    private static final String INDENT = "    ";

    private final StringWriter buffer = new StringWriter();
    private final XMLStreamWriter writer;
    private int depth;

    private XmlDocumentWriter() throws XMLStreamException {
        this.writer = XMLOutputFactory.newInstance().createXMLStreamWriter(buffer);
    }

    /**
     * Starts a document and opens its root element.
     *
     * @param rootName root element name.
     * @param schemaLocation value for {@code xsi:noNamespaceSchemaLocation}, or {@code null} for none.
     * @param rootAttributes alternating attribute names and values.
     */
    public static XmlDocumentWriter begin(String rootName, String schemaLocation, String... rootAttributes)
            throws XMLStreamException {
        XmlDocumentWriter document = new XmlDocumentWriter();
        document.writer.writeStartDocument("UTF-8", "1.0");
        document.writer.writeCharacters("\n");
        document.writer.writeStartElement(Objects.requireNonNull(rootName, "rootName"));
        document.writeAttributes(rootAttributes);
        if (schemaLocation != null) {
            document.writer.writeNamespace("xsi", XSI_NAMESPACE);
            document.writer.writeAttribute("xsi", XSI_NAMESPACE, "noNamespaceSchemaLocation", schemaLocation);
        }
        document.depth = 1;
        return document;
    }

    /**
     * Writes {@code <name a="..." b="..."/>} on its own line.
     */
    public XmlDocumentWriter emptyElement(String name, String... attributes) throws XMLStreamException {
        newLine();
        writer.writeEmptyElement(name);
        writeAttributes(attributes);
        return this;
    }

    /**
     * Opens a nested element; close it with {@link #endElement()}.
     */
    public XmlDocumentWriter startElement(String name, String... attributes) throws XMLStreamException {
        newLine();
        writer.writeStartElement(name);
        writeAttributes(attributes);
        depth++;
        return this;
    }

    public XmlDocumentWriter endElement() throws XMLStreamException {
        if (depth <= 1) {
            throw new IllegalStateException("No nested element is open");
        }
        depth--;
        newLine();
        writer.writeEndElement();
        return this;
    }

    /**
     * Closes the root element and returns the rendered document, newline-terminated.
     */
    public String finish() throws XMLStreamException {
        while (depth > 1) {
            endElement();
        }
        depth = 0;
        newLine();
        writer.writeEndElement();
        writer.writeEndDocument();
        writer.flush();
        writer.close();
        return buffer.append('\n').toString();
    }

    private void writeAttributes(String... attributes) throws XMLStreamException {
        if (attributes.length % 2 != 0) {
            throw new IllegalArgumentException("attributes must be name/value pairs");
        }
        for (int i = 0; i < attributes.length; i += 2) {
            writer.writeAttribute(
                    Objects.requireNonNull(attributes[i], "attribute name"),
                    Objects.requireNonNull(attributes[i + 1], "attribute " + attributes[i])
            );
        }
    }

    private void newLine() throws XMLStreamException {
        writer.writeCharacters("\n" + INDENT.repeat(Math.max(0, depth)));
    }
}
