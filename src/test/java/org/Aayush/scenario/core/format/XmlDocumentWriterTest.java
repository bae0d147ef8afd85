package org.Aayush.scenario.core.format;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import javax.xml.stream.XMLStreamException;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("XML Document Writer Tests")
class XmlDocumentWriterTest {

    @Test
    @DisplayName("Writes declaration, schema location and indented children")
    void testLayout() throws XMLStreamException {
        String xml = XmlDocumentWriter.begin("nodes", "http://example.org/nodes.xsd")
                .emptyElement("node", "id", "a", "x", "1")
                .startElement("group")
                .emptyElement("node", "id", "b")
                .endElement()
                .finish();

        String expected = "<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n"
                + "<nodes xmlns:xsi=\"http://www.w3.org/2001/XMLSchema-instance\""
                + " xsi:noNamespaceSchemaLocation=\"http://example.org/nodes.xsd\">\n"
                + "    <node id=\"a\" x=\"1\"/>\n"
                + "    <group>\n"
                + "        <node id=\"b\"/>\n"
                + "    </group>\n"
                + "</nodes>\n";
        assertEquals(expected, xml);
    }

    @Test
    @DisplayName("Root attributes precede the schema declaration and values are escaped")
    void testRootAttributesAndEscaping() throws XMLStreamException {
        String xml = XmlDocumentWriter.begin("net", null, "version", "1.16")
                .emptyElement("edge", "id", "a<b&\"c\"")
                .finish();

        assertTrue(xml.contains("<net version=\"1.16\">"), xml);
        assertTrue(xml.contains("id=\"a&lt;b&amp;&quot;c&quot;\""), xml);
        assertFalse(xml.contains("xsi"), xml);
    }

    @Test
    @DisplayName("Unbalanced usage is rejected")
    void testInvalidUsage() throws XMLStreamException {
        XmlDocumentWriter writer = XmlDocumentWriter.begin("routes", null);
        assertThrows(IllegalStateException.class, writer::endElement);
        assertThrows(IllegalArgumentException.class, () -> writer.emptyElement("vType", "id"));
    }
}
