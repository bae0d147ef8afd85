package org.Aayush.scenario.scenario;

import lombok.experimental.UtilityClass;

import java.util.List;

/**
 * File names of a scenario bundle. Documents cross-reference each other by these names.
 */
@UtilityClass
public class ScenarioFiles {
    public static final String NODES = "nodes.nod.xml";
    public static final String EDGES = "edges.edg.xml";
    public static final String ROUTES = "routes.rou.xml";
    public static final String RUN_CONFIG = "simulation.sumocfg";
    public static final String METADATA = "simulation_metadata.json";

    /** Compiled network produced from {@link #NODES} and {@link #EDGES} by the network compiler. */
    public static final String COMPILED_NETWORK = "network.net.xml";

    /** Bundle order. */
    public static final List<String> ALL = List.of(NODES, EDGES, ROUTES, RUN_CONFIG, METADATA);
}
