package org.Aayush.scenario.geometry;

import org.Aayush.scenario.network.Graph;
import org.Aayush.scenario.network.Node;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.Aayush.scenario.testutil.ScenarioFixtures.edge;
import static org.Aayush.scenario.testutil.ScenarioFixtures.node;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Geometry Normalizer Tests")
class GeometryNormalizerTest {
    private static final double EPS = 1e-9;

    private final GeometryNormalizer normalizer = new GeometryNormalizer();

    @Test
    @DisplayName("Rescales into the square viewport preserving aspect ratio")
    void testRescale() {
        Graph graph = Graph.of(
                List.of(node("A", 100.0d, 50.0d), node("B", 500.0d, 250.0d), node("C", 300.0d, 150.0d)),
                List.of(edge("ab", "A", "B"))
        );

        NormalizedGraph normalized = normalizer.normalize(graph);

        assertTrue(normalized.isScaled());
        assertEquals(new PlanarBounds(-100.0d, -100.0d, 100.0d, 100.0d), normalized.getBounds());
        Node a = normalized.getGraph().node("A").orElseThrow();
        Node b = normalized.getGraph().node("B").orElseThrow();
        Node c = normalized.getGraph().node("C").orElseThrow();
        // width 400, height 200 -> scale min(0.5, 1.0)
        assertEquals(-100.0d, a.getX(), EPS);
        assertEquals(-50.0d, a.getY(), EPS);
        assertEquals(100.0d, b.getX(), EPS);
        assertEquals(50.0d, b.getY(), EPS);
        assertEquals(0.0d, c.getX(), EPS);
        assertEquals(0.0d, c.getY(), EPS);
        assertEquals(graph.edges(), normalized.getGraph().edges());
    }

    @Test
    @DisplayName("Input graph is never modified")
    void testCopyOnNormalize() {
        Graph graph = Graph.of(List.of(node("A", 0.0d, 0.0d), node("B", 10.0d, 10.0d)), List.of());

        normalizer.normalize(graph);

        assertEquals(10.0d, graph.node("B").orElseThrow().getX());
    }

    @Test
    @DisplayName("A single node keeps its coordinates and declares zero bounds")
    void testSingleNode() {
        Graph graph = Graph.of(List.of(node("only", 0.0d, 0.0d)), List.of());

        NormalizedGraph normalized = normalizer.normalize(graph);

        assertFalse(normalized.isScaled());
        assertEquals(new PlanarBounds(0.0d, 0.0d, 0.0d, 0.0d), normalized.getBounds());
        assertSame(graph, normalized.getGraph());
    }

    @Test
    @DisplayName("Degenerate boxes keep raw coordinates and raw bounds")
    void testDegenerateLine() {
        Graph graph = Graph.of(List.of(node("A", 5.0d, 7.0d), node("B", 25.0d, 7.0d)), List.of());

        NormalizedGraph normalized = normalizer.normalize(graph);

        assertFalse(normalized.isScaled());
        assertEquals(new PlanarBounds(5.0d, 7.0d, 25.0d, 7.0d), normalized.getBounds());
        assertEquals(25.0d, normalized.getGraph().node("B").orElseThrow().getX());
    }

    @Test
    @DisplayName("Empty graphs declare zero bounds")
    void testEmpty() {
        NormalizedGraph normalized = normalizer.normalize(Graph.empty());
        assertEquals(PlanarBounds.ZERO, normalized.getBounds());
    }

    @Test
    @DisplayName("Custom half-width sets the viewport size")
    void testCustomHalfWidth() {
        Graph graph = Graph.of(List.of(node("A", 0.0d, 0.0d), node("B", 10.0d, 10.0d)), List.of());

        NormalizedGraph normalized = new GeometryNormalizer(50.0d).normalize(graph);

        assertEquals(PlanarBounds.viewport(50.0d), normalized.getBounds());
        assertEquals(50.0d, normalized.getGraph().node("B").orElseThrow().getX(), EPS);
        assertThrows(IllegalArgumentException.class, () -> new GeometryNormalizer(0.0d));
    }
}
