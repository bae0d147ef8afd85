package org.Aayush.scenario.geometry;

import org.Aayush.scenario.network.Edge;
import org.Aayush.scenario.network.Graph;
import org.Aayush.scenario.network.Node;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.Aayush.scenario.testutil.ScenarioFixtures.edge;
import static org.Aayush.scenario.testutil.ScenarioFixtures.geoNode;
import static org.Aayush.scenario.testutil.ScenarioFixtures.node;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Bounding Box Filter Tests")
class BoundingBoxFilterTest {

    @Test
    @DisplayName("Keeps nodes inside the box and edges whose both endpoints survive")
    void testFilter() {
        Graph graph = Graph.of(
                List.of(
                        geoNode("in1", 0, 0, 40.41d, -3.70d),
                        geoNode("in2", 1, 1, 40.42d, -3.69d),
                        geoNode("edgeOfBox", 2, 2, 40.45d, -3.65d),
                        geoNode("out", 3, 3, 40.50d, -3.70d),
                        node("planarOnly", 4, 4)
                ),
                List.of(
                        edge("a", "in1", "in2"),
                        edge("b", "in2", "out"),
                        edge("c", "in2", "edgeOfBox"),
                        edge("d", "planarOnly", "in1")
                )
        );
        GeoBounds box = GeoBounds.of(40.40d, 40.45d, -3.65d, -3.75d);

        Graph filtered = BoundingBoxFilter.filter(graph, box);

        assertEquals(List.of("in1", "in2", "edgeOfBox"), filtered.nodes().stream().map(Node::getId).toList());
        assertEquals(List.of("a", "c"), filtered.edges().stream().map(Edge::getId).toList());
    }
}
