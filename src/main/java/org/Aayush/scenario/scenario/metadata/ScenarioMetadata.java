package org.Aayush.scenario.scenario.metadata;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * Reconstruction document: a self-contained snapshot of one exported scenario.
 * <p>
 * Every other bundle file can be regenerated from this document alone.
 */
@JsonPropertyOrder({
        "simulation_info",
        "network_data",
        "nodes",
        "edges",
        "simulation_config",
        "selected_points",
        "routes",
        "reconstruction_instructions"
})
public record ScenarioMetadata(
        @JsonProperty("simulation_info") SimulationInfo simulationInfo,
        @JsonProperty("network_data") NetworkData networkData,
        @JsonProperty("nodes") List<NodeRecord> nodes,
        @JsonProperty("edges") List<EdgeRecord> edges,
        @JsonProperty("simulation_config") SimulationConfig simulationConfig,
        @JsonProperty("selected_points") SelectedPoints selectedPoints,
        @JsonProperty("routes") List<RouteRecord> routes,
        @JsonProperty("reconstruction_instructions") ReconstructionInstructions reconstructionInstructions
) {

    public record SimulationInfo(
            @JsonProperty("name") String name,
            @JsonProperty("created_at") String createdAt,
            @JsonProperty("format_version") String formatVersion,
            @JsonProperty("generator") String generator,
            @JsonProperty("total_vehicles") int totalVehicles,
            @JsonProperty("routed_vehicles") int routedVehicles,
            @JsonProperty("simulation_time") double simulationTime
    ) {
    }

    public record NetworkData(
            @JsonProperty("node_count") int nodeCount,
            @JsonProperty("edge_count") int edgeCount,
            @JsonProperty("total_length") double totalLength,
            @JsonProperty("average_speed") double averageSpeed,
            @JsonProperty("density") double density,
            @JsonProperty("bounds") Bounds bounds
    ) {
    }

    public record Bounds(
            @JsonProperty("xmin") double xmin,
            @JsonProperty("ymin") double ymin,
            @JsonProperty("xmax") double xmax,
            @JsonProperty("ymax") double ymax
    ) {
    }

    public record NodeRecord(
            @JsonProperty("id") String id,
            @JsonProperty("x") double x,
            @JsonProperty("y") double y,
            @JsonProperty("lat") Double lat,
            @JsonProperty("lon") Double lon,
            @JsonProperty("type") String type,
            @JsonProperty("is_entry_point") boolean entryPoint,
            @JsonProperty("is_exit_point") boolean exitPoint
    ) {
    }

    public record EdgeRecord(
            @JsonProperty("id") String id,
            @JsonProperty("from") String from,
            @JsonProperty("to") String to,
            @JsonProperty("num_lanes") int numLanes,
            @JsonProperty("speed") double speed,
            @JsonProperty("length") double length,
            @JsonProperty("shape") List<List<Double>> shape,
            @JsonProperty("is_entry_point") boolean entryPoint,
            @JsonProperty("is_exit_point") boolean exitPoint
    ) {
    }

    public record SimulationConfig(
            @JsonProperty("name") String name,
            @JsonProperty("simulation_time") double simulationTime,
            @JsonProperty("total_vehicles") int totalVehicles,
            @JsonProperty("seed") Long seed,
            @JsonProperty("vehicle_distribution") List<DistributionRecord> vehicleDistribution
    ) {
    }

    public record DistributionRecord(
            @JsonProperty("vehicle_type") String vehicleType,
            @JsonProperty("percentage") double percentage,
            @JsonProperty("color") String color,
            @JsonProperty("period") double period,
            @JsonProperty("attributes") String attributes
    ) {
    }

    public record SelectedPoints(
            @JsonProperty("entry_points") List<String> entryPoints,
            @JsonProperty("exit_points") List<String> exitPoints
    ) {
    }

    public record RouteRecord(
            @JsonProperty("id") String id,
            @JsonProperty("vehicle_type") String vehicleType,
            @JsonProperty("depart_time") double departTime,
            @JsonProperty("color") String color,
            @JsonProperty("edges") List<String> edges
    ) {
    }

    public record ReconstructionInstructions(
            @JsonProperty("description") String description,
            @JsonProperty("files") List<String> files,
            @JsonProperty("steps") List<String> steps
    ) {
    }
}
