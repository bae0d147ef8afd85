package org.Aayush.scenario.boundary;

import org.Aayush.scenario.network.Graph;
import org.Aayush.scenario.testutil.ScenarioFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.Aayush.scenario.testutil.ScenarioFixtures.edge;
import static org.Aayush.scenario.testutil.ScenarioFixtures.node;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Boundary Classifier Tests")
class BoundaryClassifierTest {

    private final BoundaryClassifier classifier = new BoundaryClassifier();

    @Test
    @DisplayName("A single directed path has one entry and one exit; the middle edge is neither")
    void testLinePath() {
        BoundaryClassification classification = classifier.classify(ScenarioFixtures.linePath());

        assertEquals(List.of(new BoundaryPoint("e1", 0.0d, 0.0d)), classification.getEntryPoints());
        assertEquals(List.of(new BoundaryPoint("e2", 200.0d, 50.0d)), classification.getExitPoints());
        assertEquals("e1", classification.getEntryPoints().get(0).name());
        assertEquals("e2", classification.getExitPoints().get(0).name());
    }

    @Test
    @DisplayName("An isolated segment is both entry and exit; a cycle contributes neither")
    void testIsolatedSegmentAndCycle() {
        Graph graph = Graph.of(
                List.of(node("A", 0, 0), node("B", 1, 0), node("C", 5, 5), node("D", 6, 6)),
                List.of(edge("solo", "A", "B"), edge("cd", "C", "D"), edge("dc", "D", "C"))
        );

        BoundaryClassification classification = classifier.classify(graph);

        assertEquals(List.of("solo"), classification.entryEdgeIds());
        assertEquals(List.of("solo"), classification.exitEdgeIds());
    }

    @Test
    @DisplayName("Points whose dangling node is unknown are emitted at the origin")
    void testMissingNode() {
        Graph graph = Graph.of(
                List.of(node("B", 3, 4)),
                List.of(edge("ghost", "nowhere", "B"), edge("lost", "B", "void"))
        );

        BoundaryClassification classification = classifier.classify(graph);

        assertEquals(List.of(new BoundaryPoint("ghost", 0.0d, 0.0d)), classification.getEntryPoints());
        assertEquals(List.of(new BoundaryPoint("lost", 0.0d, 0.0d)), classification.getExitPoints());
    }
}
