package org.Aayush.scenario.core;

/**
 * One of the scenario documents could not be rendered or written.
 *
 * <p>When this is thrown no bundle is returned, so callers never observe a partial set of files.</p>
 */
public class ScenarioSerializationException extends ScenarioEngineException {

    public ScenarioSerializationException(String reasonCode, String message, Throwable cause) {
        super(reasonCode, message, cause);
    }
}
