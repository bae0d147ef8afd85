package org.Aayush.scenario.core;

/**
 * Vehicle distribution percentages are out of range or do not sum to 100.
 */
public class InvalidDistributionException extends ScenarioEngineException {

    public InvalidDistributionException(String reasonCode, String message) {
        super(reasonCode, message);
    }
}
