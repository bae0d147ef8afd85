package org.Aayush.scenario.network;

import java.io.InputStream;

/**
 * Reads a serialized network description into a {@link Graph}.
 *
 * <p>Implementations are liberal: malformed nodes and edges are dropped and
 * reported through {@link ParseResult#getWarnings()}. Only a document that cannot
 * be read at all fails, with {@link org.Aayush.scenario.core.MalformedInputException}.</p>
 */
public interface NetworkParser {

    /**
     * Parses one document. The stream is consumed but not closed.
     *
     * @param input serialized network description.
     * @return graph and per-record warnings.
     */
    ParseResult parse(InputStream input);
}
