package org.Aayush.scenario.routing;

import org.Aayush.scenario.core.InvalidDistributionException;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Validates a vehicle distribution and turns percentages into integer counts.
 *
 * <p>Counts are {@code floor(percentage / 100 * total)}; the rounding remainder goes
 * entirely to the first entry. When a sum within tolerance above 100 floors to more than
 * the total, the excess is taken from the last entries instead. Counts are never negative
 * and always sum to {@code total}.</p>
 */
public final class DistributionAllocator {
    public static final String REASON_EMPTY_DISTRIBUTION = "DISTRIBUTION_EMPTY";
    public static final String REASON_PERCENTAGE_OUT_OF_RANGE = "DISTRIBUTION_PERCENTAGE_OUT_OF_RANGE";
    public static final String REASON_SUM_MISMATCH = "DISTRIBUTION_SUM_NOT_100";

    public static final double DEFAULT_TOLERANCE = 0.01d;

    private final double tolerance;

    public DistributionAllocator() {
        this(DEFAULT_TOLERANCE);
    }

    public DistributionAllocator(double tolerance) {
        if (!(tolerance >= 0.0d) || !Double.isFinite(tolerance)) {
            throw new IllegalArgumentException("tolerance must be finite and >= 0: " + tolerance);
        }
        this.tolerance = tolerance;
    }

    /**
     * @throws InvalidDistributionException when the list is empty, a percentage is outside
     *                                      {@code [0, 100]}, or the sum is not 100 within tolerance.
     */
    public void validate(List<VehicleDistribution> distribution) {
        Objects.requireNonNull(distribution, "distribution");
        if (distribution.isEmpty()) {
            throw new InvalidDistributionException(REASON_EMPTY_DISTRIBUTION, "Vehicle distribution must not be empty");
        }
        double sum = 0.0d;
        for (VehicleDistribution entry : distribution) {
            double percentage = entry.getPercentage();
            if (!Double.isFinite(percentage) || percentage < 0.0d || percentage > 100.0d) {
                throw new InvalidDistributionException(
                        REASON_PERCENTAGE_OUT_OF_RANGE,
                        "Percentage for " + entry.getVehicleType() + " must be within [0, 100], got " + percentage
                );
            }
            sum += percentage;
        }
        if (Math.abs(sum - 100.0d) > tolerance) {
            throw new InvalidDistributionException(
                    REASON_SUM_MISMATCH,
                    "Vehicle distribution percentages must sum to 100%, got " + sum + "%"
            );
        }
    }

    public List<VehicleQuota> allocate(List<VehicleDistribution> distribution, int totalVehicles) {
        validate(distribution);
        if (totalVehicles < 0) {
            throw new IllegalArgumentException("totalVehicles must be >= 0: " + totalVehicles);
        }
        int[] counts = new int[distribution.size()];
        int assigned = 0;
        for (int i = 0; i < counts.length; i++) {
            counts[i] = (int) Math.floor(distribution.get(i).getPercentage() / 100.0d * totalVehicles);
            assigned += counts[i];
        }
        int remainder = totalVehicles - assigned;
        if (remainder >= 0) {
            counts[0] += remainder;
        } else {
            // Sums just above 100 can floor to more than the total; trim from the back, never below zero.
            for (int i = counts.length - 1; i >= 0 && remainder < 0; i--) {
                int taken = Math.min(counts[i], -remainder);
                counts[i] -= taken;
                remainder += taken;
            }
        }

        List<VehicleQuota> quotas = new ArrayList<>(counts.length);
        for (int i = 0; i < counts.length; i++) {
            quotas.add(new VehicleQuota(distribution.get(i), counts[i]));
        }
        return List.copyOf(quotas);
    }
}
