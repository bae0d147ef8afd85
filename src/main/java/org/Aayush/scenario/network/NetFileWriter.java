package org.Aayush.scenario.network;

import org.Aayush.scenario.core.ScenarioSerializationException;
import org.Aayush.scenario.core.format.SumoNumbers;
import org.Aayush.scenario.core.format.XmlDocumentWriter;

import javax.xml.stream.XMLStreamException;
import java.util.Objects;

/**
 * Renders a {@link Graph} as a simplified {@code .net.xml} document.
 * <p>
 * Only {@code <nodes>} and {@code <edges>} sections are written; connections are left
 * for the network compiler to derive from topology. {@link XmlNetworkParser} reads the
 * output back into an equal graph (shapes are re-derived from the nodes).
 */
public final class NetFileWriter {
    public static final String REASON_NET_RENDER_FAILED = "NET_RENDER_FAILED";

    static final String NET_VERSION = "1.16";
    static final String NET_SCHEMA = "http://sumo.dlr.de/xsd/net_file.xsd";

    public String render(Graph graph) {
        Objects.requireNonNull(graph, "graph");
        try {
            XmlDocumentWriter document = XmlDocumentWriter.begin(
                    "net",
                    NET_SCHEMA,
                    "version", NET_VERSION,
                    "junctionCornerDetail", "5",
                    "limitTurnSpeed", "5.50"
            );
            document.startElement("nodes");
            for (Node node : graph.nodes()) {
                if (node.hasGeographic()) {
                    document.emptyElement("node",
                            "id", node.getId(),
                            "x", SumoNumbers.format(node.getX()),
                            "y", SumoNumbers.format(node.getY()),
                            "lat", SumoNumbers.format(node.getLat()),
                            "lon", SumoNumbers.format(node.getLon()),
                            "type", node.getKind().wireValue());
                } else {
                    document.emptyElement("node",
                            "id", node.getId(),
                            "x", SumoNumbers.format(node.getX()),
                            "y", SumoNumbers.format(node.getY()),
                            "type", node.getKind().wireValue());
                }
            }
            document.endElement();
            document.startElement("edges");
            for (Edge edge : graph.edges()) {
                document.emptyElement("edge",
                        "id", edge.getId(),
                        "from", edge.getFrom(),
                        "to", edge.getTo(),
                        "numLanes", SumoNumbers.format(edge.getLaneCount()),
                        "speed", SumoNumbers.format(edge.getSpeed()),
                        "length", SumoNumbers.format(edge.getLength()));
            }
            document.endElement();
            return document.finish();
        } catch (XMLStreamException ex) {
            throw new ScenarioSerializationException(REASON_NET_RENDER_FAILED, "Error creating SUMO network: " + ex.getMessage(), ex);
        }
    }
}
