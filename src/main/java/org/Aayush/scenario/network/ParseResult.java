package org.Aayush.scenario.network;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Parser output: the usable graph plus one warning per dropped record.
 */
@Value
@Builder
public class ParseResult {
    Graph graph;
    @Singular
    List<String> warnings;

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
