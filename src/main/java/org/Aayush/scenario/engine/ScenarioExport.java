package org.Aayush.scenario.engine;

import lombok.Value;
import org.Aayush.scenario.scenario.Scenario;
import org.Aayush.scenario.scenario.ScenarioBundle;

/**
 * Result of {@link ScenarioEngine#export(ExportRequest)}.
 */
@Value
public class ScenarioExport {
    Scenario scenario;
    ScenarioBundle bundle;
    int attemptedVehicles;
    int skippedVehicles;
}
