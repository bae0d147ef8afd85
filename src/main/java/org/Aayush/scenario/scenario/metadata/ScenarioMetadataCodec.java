package org.Aayush.scenario.scenario.metadata;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.Aayush.scenario.core.MalformedInputException;
import org.Aayush.scenario.core.ScenarioSerializationException;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * JSON codec for {@link ScenarioMetadata}.
 *
 * <p>Output is pretty-printed, with null fields omitted and a fixed property order,
 * so identical metadata always renders to identical text.</p>
 */
public final class ScenarioMetadataCodec {
    public static final String REASON_WRITE_FAILED = "METADATA_WRITE_FAILED";
    public static final String REASON_UNREADABLE = "METADATA_UNREADABLE";
    public static final String REASON_INCOMPLETE = "METADATA_INCOMPLETE";

    private final ObjectMapper mapper;

    public ScenarioMetadataCodec() {
        this(defaultMapper());
    }

    public ScenarioMetadataCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    static ObjectMapper defaultMapper() {
        return new ObjectMapper()
                .enable(SerializationFeature.INDENT_OUTPUT)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    public String write(ScenarioMetadata metadata) {
        Objects.requireNonNull(metadata, "metadata");
        try {
            return mapper.writeValueAsString(metadata) + "\n";
        } catch (JsonProcessingException ex) {
            throw new ScenarioSerializationException(
                    REASON_WRITE_FAILED,
                    "Error rendering simulation metadata: " + ex.getOriginalMessage(),
                    ex
            );
        }
    }

    /**
     * Parses a metadata document and checks that every top-level section is present.
     *
     * @throws MalformedInputException when the text is not valid metadata JSON or a section is missing.
     */
    public ScenarioMetadata read(String json) {
        Objects.requireNonNull(json, "json");
        ScenarioMetadata metadata;
        try {
            metadata = mapper.readValue(json, ScenarioMetadata.class);
        } catch (JsonProcessingException ex) {
            throw new MalformedInputException(
                    REASON_UNREADABLE,
                    "Error parsing simulation metadata: " + ex.getOriginalMessage(),
                    ex
            );
        }
        if (metadata == null) {
            throw new MalformedInputException(REASON_UNREADABLE, "Simulation metadata document is empty");
        }
        List<String> missing = new ArrayList<>();
        if (metadata.simulationInfo() == null) {
            missing.add("simulation_info");
        }
        if (metadata.networkData() == null) {
            missing.add("network_data");
        }
        if (metadata.nodes() == null) {
            missing.add("nodes");
        }
        if (metadata.edges() == null) {
            missing.add("edges");
        }
        if (metadata.simulationConfig() == null) {
            missing.add("simulation_config");
        }
        if (metadata.selectedPoints() == null) {
            missing.add("selected_points");
        }
        if (metadata.routes() == null) {
            missing.add("routes");
        }
        if (!missing.isEmpty()) {
            throw new MalformedInputException(REASON_INCOMPLETE, "Simulation metadata is missing sections " + missing);
        }
        return metadata;
    }
}
