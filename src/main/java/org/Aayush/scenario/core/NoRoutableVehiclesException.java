package org.Aayush.scenario.core;

/**
 * Every attempted vehicle failed to find a path between its entry and exit edge.
 */
public class NoRoutableVehiclesException extends ScenarioEngineException {

    public NoRoutableVehiclesException(String reasonCode, String message) {
        super(reasonCode, message);
    }
}
