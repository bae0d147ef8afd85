package org.Aayush.scenario.network;

import org.Aayush.scenario.core.MalformedInputException;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NodeList;
import org.xml.sax.SAXException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;

/**
 * Parses SUMO-style XML network descriptions ({@code .net.xml} or plain node/edge files).
 * <p>
 * Accepted elements, in any nesting:
 * <ul>
 * <li>{@code <node id x y [lat] [lon] [type]/>}</li>
 * <li>{@code <junction id x y [type]/>} (junctions of type {@code internal} are ignored)</li>
 * <li>{@code <edge id from to [numLanes] [speed] [length]>} with optional {@code <lane>} children;
 * edges with {@code function="internal"} are ignored</li>
 * </ul>
 * When an edge has no {@code numLanes}, the number of {@code <lane>} children is used, and
 * missing speed/length are read from the first lane.
 */
public final class XmlNetworkParser implements NetworkParser {
    public static final String REASON_UNREADABLE_DOCUMENT = "NET_XML_UNREADABLE_DOCUMENT";

    private static final String INTERNAL = "internal";

    private final EdgeDefaults defaults;

    public XmlNetworkParser() {
        this(EdgeDefaults.standard());
    }

    public XmlNetworkParser(EdgeDefaults defaults) {
        this.defaults = Objects.requireNonNull(defaults, "defaults");
    }

    @Override
    public ParseResult parse(InputStream input) {
        Objects.requireNonNull(input, "input");
        Document document = readDocument(input);
        GraphAssembler assembler = new GraphAssembler(defaults, "xml-network");

        NodeList all = document.getDocumentElement().getElementsByTagName("*");
        for (int i = 0; i < all.getLength(); i++) {
            Element element = (Element) all.item(i);
            switch (element.getTagName()) {
                case "node":
                    addNode(assembler, element);
                    break;
                case "junction":
                    if (!INTERNAL.equals(element.getAttribute("type"))) {
                        addNode(assembler, element);
                    }
                    break;
                case "edge":
                    if (!INTERNAL.equals(element.getAttribute("function"))) {
                        addEdge(assembler, element);
                    }
                    break;
                default:
                    break;
            }
        }
        return assembler.build();
    }

    private static void addNode(GraphAssembler assembler, Element element) {
        assembler.addNode(
                attribute(element, "id"),
                NumericField.decode(attribute(element, "x")),
                NumericField.decode(attribute(element, "y")),
                NumericField.decode(attribute(element, "lat")),
                NumericField.decode(attribute(element, "lon")),
                attribute(element, "type")
        );
    }

    private static void addEdge(GraphAssembler assembler, Element element) {
        NodeList lanes = element.getElementsByTagName("lane");
        Element firstLane = lanes.getLength() > 0 ? (Element) lanes.item(0) : null;

        NumericField laneCount = NumericField.decode(attribute(element, "numLanes"));
        if (!laneCount.isPresent() && lanes.getLength() > 0) {
            laneCount = NumericField.of(lanes.getLength());
        }
        NumericField speed = NumericField.decode(attribute(element, "speed"));
        NumericField length = NumericField.decode(attribute(element, "length"));
        if (firstLane != null) {
            if (!speed.isPresent()) {
                speed = NumericField.decode(attribute(firstLane, "speed"));
            }
            if (!length.isPresent()) {
                length = NumericField.decode(attribute(firstLane, "length"));
            }
        }
        assembler.addEdge(
                attribute(element, "id"),
                attribute(element, "from"),
                attribute(element, "to"),
                laneCount,
                speed,
                length
        );
    }

    /**
     * DOM returns "" for absent attributes; normalize that to {@code null}.
     */
    private static String attribute(Element element, String name) {
        return element.hasAttribute(name) ? element.getAttribute(name) : null;
    }

    private static Document readDocument(InputStream input) {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setXIncludeAware(false);
            factory.setExpandEntityReferences(false);
            DocumentBuilder builder = factory.newDocumentBuilder();
            return builder.parse(input);
        } catch (ParserConfigurationException ex) {
            throw new IllegalStateException("XML parser configuration rejected", ex);
        } catch (SAXException | IOException ex) {
            throw new MalformedInputException(
                    REASON_UNREADABLE_DOCUMENT,
                    "Error parsing network XML: " + ex.getMessage(),
                    ex
            );
        }
    }
}
