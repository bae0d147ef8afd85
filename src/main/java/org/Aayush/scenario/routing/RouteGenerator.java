package org.Aayush.scenario.routing;

import org.Aayush.scenario.core.ScenarioEngineException;
import org.Aayush.scenario.core.UnresolvedReferenceException;
import org.Aayush.scenario.network.Edge;
import org.Aayush.scenario.network.Graph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;

/**
 * Generates one routed vehicle per population slot.
 *
 * <p>Slots are visited type by type in distribution order. For every slot an entry and
 * an exit edge are drawn uniformly (with replacement) and a minimum-hop path is searched
 * from the entry's {@code from} node to the exit's {@code to} node. Slots without a path
 * are dropped and not retried.</p>
 *
 * <p>Departures advance by {@code horizon / max(1, totalVehicles)} per attempted slot,
 * starting at 0, so routed vehicles keep strictly increasing departures in generation
 * order even when some slots are dropped.</p>
 *
 * <p>Each call uses its own {@link Random}; concurrent calls never share one.</p>
 */
public final class RouteGenerator {
    private static final Logger LOG = LoggerFactory.getLogger(RouteGenerator.class);

    public static final String REASON_INVALID_VEHICLE_COUNT = "ROUTE_INVALID_VEHICLE_COUNT";
    public static final String REASON_INVALID_HORIZON = "ROUTE_INVALID_HORIZON";
    public static final String REASON_NO_ENTRY_POINTS = "ROUTE_NO_ENTRY_POINTS";
    public static final String REASON_NO_EXIT_POINTS = "ROUTE_NO_EXIT_POINTS";
    public static final String REASON_UNKNOWN_EDGE = "ROUTE_UNKNOWN_EDGE";

    static final String VEHICLE_ID_PREFIX = "vehicle_";

    private final DistributionAllocator allocator;

    public RouteGenerator() {
        this(new DistributionAllocator());
    }

    public RouteGenerator(DistributionAllocator allocator) {
        this.allocator = Objects.requireNonNull(allocator, "allocator");
    }

    /**
     * Generates routes with a fresh random source, seeded when the request carries a seed.
     */
    public RouteGenerationResult generate(RouteGenerationRequest request) {
        Objects.requireNonNull(request, "request");
        Random random = request.getSeed() == null ? new Random() : new Random(request.getSeed());
        return generate(request, random);
    }

    /**
     * Generates routes drawing every random choice from {@code random}.
     */
    public RouteGenerationResult generate(RouteGenerationRequest request, Random random) {
        Objects.requireNonNull(request, "request");
        Objects.requireNonNull(random, "random");

        List<VehicleQuota> quotas = validate(request);
        Graph graph = request.getGraph();
        List<Edge> entries = resolve(graph, request.getEntryEdges(), "entry");
        List<Edge> exits = resolve(graph, request.getExitEdges(), "exit");
        HopCountPathFinder pathFinder = new HopCountPathFinder(graph);

        double step = request.getHorizon() / Math.max(1, request.getTotalVehicles());
        List<RouteAssignment> assignments = new ArrayList<>(request.getTotalVehicles());
        int attempt = 0;
        for (VehicleQuota quota : quotas) {
            VehicleDistribution type = quota.distribution();
            for (int i = 0; i < quota.count(); i++) {
                Edge entry = entries.get(random.nextInt(entries.size()));
                Edge exit = exits.get(random.nextInt(exits.size()));
                Optional<List<String>> path = pathFinder.findPath(entry.getFrom(), exit.getTo());
                if (path.isPresent()) {
                    assignments.add(RouteAssignment.builder()
                            .id(VEHICLE_ID_PREFIX + attempt)
                            .edges(path.get())
                            .vehicleType(type.getVehicleType())
                            .departTime(attempt * step)
                            .color(type.getColor())
                            .build());
                } else {
                    LOG.debug("No path from {} ({}) to {} ({}); slot {} dropped",
                            entry.getId(), entry.getFrom(), exit.getId(), exit.getTo(), attempt);
                }
                attempt++;
            }
        }

        int skipped = attempt - assignments.size();
        if (skipped > 0) {
            LOG.warn("Skipped {} of {} vehicles without a path between selected entry and exit points",
                    skipped, attempt);
        }
        LOG.info("Generated {} routes for {} requested vehicles", assignments.size(), attempt);
        return new RouteGenerationResult(List.copyOf(assignments), attempt, skipped);
    }

    private List<VehicleQuota> validate(RouteGenerationRequest request) {
        allocator.validate(request.getDistributions());
        if (request.getTotalVehicles() < 1) {
            throw new ScenarioEngineException(
                    REASON_INVALID_VEHICLE_COUNT,
                    "totalVehicles must be >= 1, got " + request.getTotalVehicles()
            );
        }
        if (!(request.getHorizon() > 0.0d) || !Double.isFinite(request.getHorizon())) {
            throw new ScenarioEngineException(
                    REASON_INVALID_HORIZON,
                    "horizon must be a positive number of seconds, got " + request.getHorizon()
            );
        }
        List<VehicleQuota> quotas = allocator.allocate(request.getDistributions(), request.getTotalVehicles());
        int allocated = quotas.stream().mapToInt(VehicleQuota::count).sum();
        if (allocated != request.getTotalVehicles()) {
            throw new IllegalStateException(
                    "Allocated " + allocated + " vehicles for a request of " + request.getTotalVehicles());
        }
        if (request.getEntryEdges().isEmpty()) {
            throw new ScenarioEngineException(REASON_NO_ENTRY_POINTS, "At least one entry point must be selected");
        }
        if (request.getExitEdges().isEmpty()) {
            throw new ScenarioEngineException(REASON_NO_EXIT_POINTS, "At least one exit point must be selected");
        }
        return quotas;
    }

    private static List<Edge> resolve(Graph graph, List<String> edgeIds, String role) {
        List<Edge> edges = new ArrayList<>(edgeIds.size());
        for (String edgeId : edgeIds) {
            Edge edge = graph.edge(edgeId).orElseThrow(() -> new UnresolvedReferenceException(
                    REASON_UNKNOWN_EDGE,
                    "Selected " + role + " edge " + edgeId + " is not part of the network"
            ));
            edges.add(edge);
        }
        return edges;
    }
}
