package org.Aayush.scenario.engine;

import org.Aayush.scenario.network.Graph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Process-local cache of immutable {@link Graph} snapshots keyed by network id.
 * <p>
 * A published graph is never replaced in place; {@link #evict(String)} followed by a
 * new load is the only way to refresh one. Readers that need different coordinates
 * derive a new graph instead of touching the cached one.
 */
public final class GraphArena {
    private static final Logger LOG = LoggerFactory.getLogger(GraphArena.class);

    private final ConcurrentHashMap<String, Graph> graphs = new ConcurrentHashMap<>();

    /**
     * Returns the cached graph, loading and publishing it on first access.
     * <p>
     * The loader runs at most once per id while the entry is absent.
     */
    public Graph computeIfAbsent(String networkId, Function<String, Graph> loader) {
        Objects.requireNonNull(networkId, "networkId");
        Objects.requireNonNull(loader, "loader");
        return graphs.computeIfAbsent(networkId, id -> {
            Graph graph = Objects.requireNonNull(loader.apply(id), "loader returned null graph");
            LOG.debug("Published network {} ({})", id, graph);
            return graph;
        });
    }

    /**
     * Publishes {@code graph} unless a graph is already cached for the id.
     *
     * @return the graph cached for the id after the call.
     */
    public Graph publish(String networkId, Graph graph) {
        Objects.requireNonNull(networkId, "networkId");
        Objects.requireNonNull(graph, "graph");
        Graph existing = graphs.putIfAbsent(networkId, graph);
        return existing == null ? graph : existing;
    }

    public Optional<Graph> get(String networkId) {
        return Optional.ofNullable(graphs.get(networkId));
    }

    public boolean evict(String networkId) {
        return graphs.remove(networkId) != null;
    }

    public int size() {
        return graphs.size();
    }
}
