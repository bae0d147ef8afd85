package org.Aayush.scenario.routing;

/**
 * Integer vehicle count allocated to one distribution entry.
 */
public record VehicleQuota(VehicleDistribution distribution, int count) {
}
