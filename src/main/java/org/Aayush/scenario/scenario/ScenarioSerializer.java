package org.Aayush.scenario.scenario;

import org.Aayush.scenario.core.ScenarioSerializationException;
import org.Aayush.scenario.core.format.SumoNumbers;
import org.Aayush.scenario.core.format.XmlDocumentWriter;
import org.Aayush.scenario.network.Edge;
import org.Aayush.scenario.network.Graph;
import org.Aayush.scenario.network.Node;
import org.Aayush.scenario.routing.RouteAssignment;
import org.Aayush.scenario.scenario.metadata.ScenarioMetadataCodec;
import org.Aayush.scenario.scenario.metadata.ScenarioMetadataMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.xml.stream.XMLStreamException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Renders a {@link Scenario} into the five bundle documents.
 * <p>
 * All documents are rendered in memory before the bundle is created; any rendering
 * failure raises {@link ScenarioSerializationException} and no bundle is returned.
 * Output depends only on the scenario and the injected clock, which only feeds the
 * metadata creation timestamp.
 * <p>
 * Vehicles are emitted in ascending departure order (stable for equal departures),
 * each with exactly {@code id}, {@code type}, {@code route}, {@code depart} and {@code color}.
 */
public final class ScenarioSerializer {
    private static final Logger LOG = LoggerFactory.getLogger(ScenarioSerializer.class);

    public static final String REASON_RENDER_FAILED = "SCENARIO_RENDER_FAILED";

    static final String NODES_SCHEMA = "http://sumo.dlr.de/xsd/nodes_file.xsd";
    static final String EDGES_SCHEMA = "http://sumo.dlr.de/xsd/edges_file.xsd";
    static final String ROUTES_SCHEMA = "http://sumo.dlr.de/xsd/routes_file.xsd";
    static final String CONFIG_SCHEMA = "http://sumo.dlr.de/xsd/sumoConfiguration.xsd";
    static final String ROUTE_ID_PREFIX = "route_";

    private static final Comparator<RouteAssignment> BY_DEPARTURE =
            Comparator.comparingDouble(RouteAssignment::getDepartTime);

    private final VehicleTypeCatalog vehicleTypes;
    private final ScenarioMetadataMapper metadataMapper;
    private final ScenarioMetadataCodec metadataCodec;
    private final Clock clock;

    public ScenarioSerializer() {
        this(VehicleTypeCatalog.standard(), new ScenarioMetadataMapper(), new ScenarioMetadataCodec(), Clock.systemUTC());
    }

    public ScenarioSerializer(Clock clock) {
        this(VehicleTypeCatalog.standard(), new ScenarioMetadataMapper(), new ScenarioMetadataCodec(), clock);
    }

    public ScenarioSerializer(
            VehicleTypeCatalog vehicleTypes,
            ScenarioMetadataMapper metadataMapper,
            ScenarioMetadataCodec metadataCodec,
            Clock clock
    ) {
        this.vehicleTypes = Objects.requireNonNull(vehicleTypes, "vehicleTypes");
        this.metadataMapper = Objects.requireNonNull(metadataMapper, "metadataMapper");
        this.metadataCodec = Objects.requireNonNull(metadataCodec, "metadataCodec");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public ScenarioBundle serialize(Scenario scenario) {
        Objects.requireNonNull(scenario, "scenario");
        Map<String, String> files = new LinkedHashMap<>();
        try {
            files.put(ScenarioFiles.NODES, renderNodes(scenario.getGraph()));
            files.put(ScenarioFiles.EDGES, renderEdges(scenario.getGraph()));
            files.put(ScenarioFiles.ROUTES, renderRoutes(scenario.getRoutes()));
            files.put(ScenarioFiles.RUN_CONFIG, renderRunConfig(scenario.getConfig().getHorizon()));
        } catch (XMLStreamException ex) {
            throw new ScenarioSerializationException(
                    REASON_RENDER_FAILED,
                    "Error rendering scenario documents: " + ex.getMessage(),
                    ex
            );
        }
        files.put(ScenarioFiles.METADATA, metadataCodec.write(metadataMapper.toMetadata(scenario, clock.instant())));

        ScenarioBundle bundle = new ScenarioBundle(files);
        LOG.info("Serialized scenario '{}': {} nodes, {} edges, {} vehicles -> {}",
                scenario.getConfig().getName(),
                scenario.getGraph().nodeCount(),
                scenario.getGraph().edgeCount(),
                scenario.getRoutes().size(),
                bundle.fileNames());
        return bundle;
    }

    String renderNodes(Graph graph) throws XMLStreamException {
        XmlDocumentWriter document = XmlDocumentWriter.begin("nodes", NODES_SCHEMA);
        for (Node node : graph.nodes()) {
            document.emptyElement("node",
                    "id", node.getId(),
                    "x", SumoNumbers.format(node.getX()),
                    "y", SumoNumbers.format(node.getY()),
                    "type", node.getKind().wireValue());
        }
        return document.finish();
    }

    /**
     * Edges whose endpoints are not in the graph are left out; the rest of the document is unaffected.
     */
    String renderEdges(Graph graph) throws XMLStreamException {
        XmlDocumentWriter document = XmlDocumentWriter.begin("edges", EDGES_SCHEMA);
        for (Edge edge : graph.edges()) {
            if (!graph.containsNode(edge.getFrom()) || !graph.containsNode(edge.getTo())) {
                LOG.warn("Edge {} references a missing node ({} -> {}), not written", edge.getId(), edge.getFrom(), edge.getTo());
                continue;
            }
            document.emptyElement("edge",
                    "id", edge.getId(),
                    "from", edge.getFrom(),
                    "to", edge.getTo(),
                    "numLanes", SumoNumbers.format(edge.getLaneCount()),
                    "speed", SumoNumbers.format(edge.getSpeed()));
        }
        return document.finish();
    }

    String renderRoutes(List<RouteAssignment> routes) throws XMLStreamException {
        XmlDocumentWriter document = XmlDocumentWriter.begin("routes", ROUTES_SCHEMA);
        for (VehicleType type : vehicleTypes.types()) {
            document.emptyElement("vType",
                    "id", type.getId(),
                    "accel", SumoNumbers.format(type.getAccel()),
                    "decel", SumoNumbers.format(type.getDecel()),
                    "sigma", SumoNumbers.format(type.getSigma()),
                    "length", SumoNumbers.format(type.getLength()),
                    "minGap", SumoNumbers.format(type.getMinGap()),
                    "maxSpeed", SumoNumbers.format(type.getMaxSpeed()),
                    "guiShape", type.getGuiShape());
        }

        List<RouteAssignment> ordered = new ArrayList<>(routes);
        ordered.sort(BY_DEPARTURE);
        for (RouteAssignment route : ordered) {
            if (!vehicleTypes.contains(route.getVehicleType())) {
                LOG.warn("Vehicle {} uses undeclared vehicle type {}", route.getId(), route.getVehicleType());
            }
            String routeId = ROUTE_ID_PREFIX + route.getId();
            document.emptyElement("route",
                    "id", routeId,
                    "edges", String.join(" ", route.getEdges()));
            document.emptyElement("vehicle",
                    "id", route.getId(),
                    "type", route.getVehicleType(),
                    "route", routeId,
                    "depart", SumoNumbers.format(route.getDepartTime()),
                    "color", route.getColor());
        }
        return document.finish();
    }

    String renderRunConfig(double horizon) throws XMLStreamException {
        XmlDocumentWriter document = XmlDocumentWriter.begin("configuration", CONFIG_SCHEMA);
        document.startElement("input")
                .emptyElement("net-file", "value", ScenarioFiles.COMPILED_NETWORK)
                .emptyElement("route-files", "value", ScenarioFiles.ROUTES)
                .endElement();
        document.startElement("time")
                .emptyElement("begin", "value", "0")
                .emptyElement("end", "value", SumoNumbers.format(horizon))
                .endElement();
        document.startElement("processing")
                .emptyElement("ignore-route-errors", "value", "true")
                .emptyElement("collision.action", "value", "warn")
                .endElement();
        document.startElement("report")
                .emptyElement("verbose", "value", "true")
                .emptyElement("no-step-log", "value", "true")
                .endElement();
        return document.finish();
    }
}
