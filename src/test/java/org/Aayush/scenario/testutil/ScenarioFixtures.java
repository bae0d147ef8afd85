package org.Aayush.scenario.testutil;

import org.Aayush.scenario.network.Edge;
import org.Aayush.scenario.network.Graph;
import org.Aayush.scenario.network.Node;
import org.Aayush.scenario.routing.VehicleDistribution;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Shared in-code fixtures for scenario engine tests.
 */
public final class ScenarioFixtures {
    private ScenarioFixtures() {
    }

    public static Node node(String id, double x, double y) {
        return Node.builder().id(id).x(x).y(y).build();
    }

    public static Node geoNode(String id, double x, double y, double lat, double lon) {
        return Node.builder().id(id).x(x).y(y).lat(lat).lon(lon).build();
    }

    public static Edge edge(String id, String from, String to) {
        return Edge.builder()
                .id(id)
                .from(from)
                .to(to)
                .laneCount(2)
                .speed(13.89d)
                .length(100.0d)
                .build();
    }

    /**
     * A -> B -> C with edges e1 (A->B) and e2 (B->C).
     */
    public static Graph linePath() {
        return Graph.of(
                List.of(node("A", 0.0d, 0.0d), node("B", 100.0d, 0.0d), node("C", 200.0d, 50.0d)),
                List.of(edge("e1", "A", "B"), edge("e2", "B", "C"))
        );
    }

    /**
     * Two disconnected segments: e1 (A->B) and e3 (C->D).
     */
    public static Graph disconnected() {
        return Graph.of(
                List.of(node("A", 0.0d, 0.0d), node("B", 10.0d, 0.0d), node("C", 20.0d, 10.0d), node("D", 30.0d, 10.0d)),
                List.of(edge("e1", "A", "B"), edge("e3", "C", "D"))
        );
    }

    /**
     * Diamond with two equal-hop paths S->L->T and S->R->T, plus a long detour S->X->Y->T.
     */
    public static Graph diamond() {
        return Graph.of(
                List.of(
                        node("S", 0.0d, 0.0d),
                        node("L", 1.0d, 1.0d),
                        node("R", 1.0d, -1.0d),
                        node("X", 1.0d, 3.0d),
                        node("Y", 2.0d, 3.0d),
                        node("T", 2.0d, 0.0d),
                        node("Z", 3.0d, 0.0d)
                ),
                List.of(
                        edge("in", "Z", "S"),
                        edge("sx", "S", "X"),
                        edge("xy", "X", "Y"),
                        edge("yt", "Y", "T"),
                        edge("sl", "S", "L"),
                        edge("sr", "S", "R"),
                        edge("lt", "L", "T"),
                        edge("rt", "R", "T"),
                        edge("out", "T", "W")
                )
        );
    }

    public static VehicleDistribution share(String type, double percentage) {
        return VehicleDistribution.builder().vehicleType(type).percentage(percentage).build();
    }

    public static List<VehicleDistribution> allCars() {
        return List.of(share("car", 100.0d));
    }

    public static InputStream utf8(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }
}
