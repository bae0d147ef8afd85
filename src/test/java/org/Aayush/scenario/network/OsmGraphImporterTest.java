package org.Aayush.scenario.network;

import org.Aayush.scenario.core.MalformedInputException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.Aayush.scenario.testutil.ScenarioFixtures.utf8;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("OSM Graph Importer Tests")
class OsmGraphImporterTest {

    private final OsmGraphImporter importer = new OsmGraphImporter();

    private static final String GRAPH = "{"
            + "\"nodes\": ["
            + "  {\"id\": 1, \"x\": -3.0, \"y\": 40.0, \"traffic_signals\": true},"
            + "  {\"id\": 2, \"x\": -3.001, \"y\": 40.001},"
            + "  {\"id\": 3, \"y\": 40.002}"
            + "],"
            + "\"edges\": ["
            + "  {\"u\": 1, \"v\": 2, \"lanes\": [\"2\", \"3\"], \"speed\": 3, \"length\": 5},"
            + "  {\"source\": 2, \"target\": 1},"
            + "  {\"u\": 1, \"v\": 3}"
            + "]}";

    @Test
    @DisplayName("Projects nodes around the mean coordinate in meters")
    void testProjection() {
        ParseResult result = importer.importGraph(utf8(GRAPH));
        Graph graph = result.getGraph();

        assertEquals(2, graph.nodeCount());
        Node first = graph.node("1").orElseThrow();
        Node second = graph.node("2").orElseThrow();
        assertEquals(-55.5d, first.getY(), 1e-9);
        assertEquals(55.5d, second.getY(), 1e-9);
        assertTrue(first.getX() > 42.0d && first.getX() < 43.0d, "x=" + first.getX());
        assertEquals(-first.getX(), second.getX(), 0.011d);
        assertEquals(40.0d, first.getLat());
        assertEquals(-3.0d, first.getLon());
        assertEquals(NodeKind.TRAFFIC_LIGHT, first.getKind());
        assertEquals(NodeKind.PRIORITY, second.getKind());
    }

    @Test
    @DisplayName("Builds numbered edges with floors and defaults and skips dangling edges")
    void testEdges() {
        ParseResult result = importer.importGraph(utf8(GRAPH));
        Graph graph = result.getGraph();

        assertEquals(
                List.of("edge_0_1_2", "edge_1_2_1"),
                graph.edges().stream().map(Edge::getId).toList()
        );
        Edge first = graph.edge("edge_0_1_2").orElseThrow();
        assertEquals(2, first.getLaneCount());
        assertEquals(OsmGraphImporter.MIN_SPEED, first.getSpeed());
        assertEquals(OsmGraphImporter.MIN_LENGTH, first.getLength());
        assertEquals(List.of(new Coordinate(40.0d, -3.0d), new Coordinate(40.001d, -3.001d)), first.getShape());

        Edge second = graph.edge("edge_1_2_1").orElseThrow();
        assertEquals(2, second.getLaneCount());
        assertEquals(13.89d, second.getSpeed());
        assertEquals(100.0d, second.getLength());

        assertEquals(2, result.getWarnings().size());
    }

    @Test
    @DisplayName("Reads link lists as edges")
    void testLinks() {
        String json = "{\"nodes\": [{\"id\": \"a\", \"x\": 1, \"y\": 1}, {\"id\": \"b\", \"x\": 1.001, \"y\": 1}],"
                + "\"links\": [{\"source\": \"a\", \"target\": \"b\"}]}";

        Graph graph = importer.importGraph(utf8(json)).getGraph();

        assertTrue(graph.containsEdge("edge_0_a_b"));
    }

    @Test
    @DisplayName("Graphs without usable nodes or edges are rejected")
    void testRejectsEmptyGraphs() {
        MalformedInputException noNodes = assertThrows(
                MalformedInputException.class,
                () -> importer.importGraph(utf8("{\"nodes\": [{\"id\": 1}], \"edges\": []}"))
        );
        assertEquals(OsmGraphImporter.REASON_NO_NODES, noNodes.getReasonCode());

        MalformedInputException noEdges = assertThrows(
                MalformedInputException.class,
                () -> importer.importGraph(utf8("{\"nodes\": [{\"id\": 1, \"x\": 0, \"y\": 0}], \"edges\": []}"))
        );
        assertEquals(OsmGraphImporter.REASON_NO_EDGES, noEdges.getReasonCode());

        MalformedInputException unreadable = assertThrows(
                MalformedInputException.class,
                () -> importer.importGraph(utf8("not json"))
        );
        assertEquals(OsmGraphImporter.REASON_UNREADABLE_DOCUMENT, unreadable.getReasonCode());
    }
}
