package org.Aayush.scenario.core;

/**
 * A network description (or one of its records) could not be decoded.
 *
 * <p>Parsers raise this for the document as a whole only. Individual malformed
 * nodes and edges are dropped with a warning instead.</p>
 */
public class MalformedInputException extends ScenarioEngineException {

    public MalformedInputException(String reasonCode, String message) {
        super(reasonCode, message);
    }

    public MalformedInputException(String reasonCode, String message, Throwable cause) {
        super(reasonCode, message, cause);
    }
}
