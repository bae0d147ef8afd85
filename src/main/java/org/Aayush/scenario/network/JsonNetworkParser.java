package org.Aayush.scenario.network;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.Aayush.scenario.core.MalformedInputException;

import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;

/**
 * Parses the JSON network-data shape exchanged with the visualization layer:
 * <pre>
 * {"nodes": [{"id", "x", "y", "lat"?, "lon"?, "type"?}],
 *  "edges": [{"id", "from", "to", "numLanes"|"lanes"?, "speed"?, "length"?}]}
 * </pre>
 * Ids may be strings or numbers. Numeric fields go through {@link NumericField}, so
 * scalars, numeric strings and single-element lists are all accepted.
 */
public final class JsonNetworkParser implements NetworkParser {
    public static final String REASON_UNREADABLE_DOCUMENT = "NET_JSON_UNREADABLE_DOCUMENT";
    public static final String REASON_NOT_AN_OBJECT = "NET_JSON_NOT_AN_OBJECT";

    private final ObjectMapper mapper;
    private final EdgeDefaults defaults;

    public JsonNetworkParser() {
        this(new ObjectMapper(), EdgeDefaults.standard());
    }

    public JsonNetworkParser(ObjectMapper mapper, EdgeDefaults defaults) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.defaults = Objects.requireNonNull(defaults, "defaults");
    }

    @Override
    public ParseResult parse(InputStream input) {
        Objects.requireNonNull(input, "input");
        JsonNode root;
        try {
            root = mapper.readTree(input);
        } catch (IOException ex) {
            throw new MalformedInputException(
                    REASON_UNREADABLE_DOCUMENT,
                    "Error parsing network JSON: " + ex.getMessage(),
                    ex
            );
        }
        return parse(root);
    }

    /**
     * Parses an already-decoded JSON tree.
     */
    public ParseResult parse(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new MalformedInputException(REASON_NOT_AN_OBJECT, "Network JSON root must be an object");
        }
        GraphAssembler assembler = new GraphAssembler(defaults, "json-network");

        for (JsonNode node : root.path("nodes")) {
            assembler.addNode(
                    text(node.get("id")),
                    NumericField.decode(node.get("x")),
                    NumericField.decode(node.get("y")),
                    NumericField.decode(node.get("lat")),
                    NumericField.decode(node.get("lon")),
                    text(node.get("type"))
            );
        }
        for (JsonNode edge : root.path("edges")) {
            JsonNode lanes = edge.has("numLanes") ? edge.get("numLanes") : edge.get("lanes");
            assembler.addEdge(
                    text(edge.get("id")),
                    text(edge.get("from")),
                    text(edge.get("to")),
                    NumericField.decode(lanes),
                    NumericField.decode(edge.get("speed")),
                    NumericField.decode(edge.get("length"))
            );
        }
        return assembler.build();
    }

    static String text(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode() || node.isContainerNode()) {
            return null;
        }
        return node.asText();
    }
}
