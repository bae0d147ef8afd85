package org.Aayush.scenario.core;

/**
 * An id (node or edge) was referenced but is not part of the graph.
 */
public class UnresolvedReferenceException extends ScenarioEngineException {

    public UnresolvedReferenceException(String reasonCode, String message) {
        super(reasonCode, message);
    }
}
