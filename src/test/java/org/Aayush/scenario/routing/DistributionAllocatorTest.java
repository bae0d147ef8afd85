package org.Aayush.scenario.routing;

import org.Aayush.scenario.core.InvalidDistributionException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.Aayush.scenario.testutil.ScenarioFixtures.share;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Distribution Allocator Tests")
class DistributionAllocatorTest {

    private final DistributionAllocator allocator = new DistributionAllocator();

    @Test
    @DisplayName("Floors each share and gives the remainder to the first entry")
    void testRemainderToFirst() {
        List<VehicleQuota> quotas = allocator.allocate(
                List.of(share("car", 33.34d), share("bus", 33.33d), share("truck", 33.33d)),
                10
        );

        assertEquals(4, quotas.get(0).count());
        assertEquals(3, quotas.get(1).count());
        assertEquals(3, quotas.get(2).count());
    }

    @ParameterizedTest(name = "total={0}")
    @ValueSource(ints = {1, 2, 3, 7, 10, 99, 101, 1000})
    @DisplayName("Counts always sum to the requested total")
    void testCountsSumToTotal(int total) {
        List<VehicleQuota> quotas = allocator.allocate(
                List.of(share("car", 60.005d), share("motorcycle", 14.995d), share("bus", 25.0d)),
                total
        );

        assertEquals(total, quotas.stream().mapToInt(VehicleQuota::count).sum());
        assertTrue(quotas.stream().allMatch(quota -> quota.count() >= 0));
    }

    @ParameterizedTest(name = "[{0}, {1}, {2}] of {3}")
    @CsvSource({
            "0.0, 50.0049, 50.0049, 100000",
            "0.001, 50.004, 50.004, 100000",
            "0.0, 33.3366, 66.6733, 30000",
            "1.0, 49.5049, 49.5049, 100000",
            "0.0, 0.0049, 100.0, 100000"
    })
    @DisplayName("Sums just above 100 never produce negative counts or extra vehicles")
    void testOvershootWithinTolerance(double first, double second, double third, int total) {
        List<VehicleQuota> quotas = allocator.allocate(
                List.of(share("car", first), share("bus", second), share("truck", third)),
                total
        );

        assertEquals(total, quotas.stream().mapToInt(VehicleQuota::count).sum());
        assertTrue(quotas.stream().allMatch(quota -> quota.count() >= 0), quotas.toString());
    }

    @Test
    @DisplayName("Excess from an overshooting sum is taken from the last entries")
    void testExcessTakenFromBack() {
        List<VehicleQuota> quotas = allocator.allocate(
                List.of(share("car", 0.0d), share("bus", 50.0049d), share("truck", 50.0049d)),
                100000
        );

        assertEquals(0, quotas.get(0).count());
        assertEquals(50004, quotas.get(1).count());
        assertEquals(49996, quotas.get(2).count());
    }

    @Test
    @DisplayName("Sums within tolerance are accepted")
    void testTolerance() {
        assertDoesNotThrow(() -> allocator.validate(List.of(share("car", 50.004d), share("bus", 50.0d))));
        assertDoesNotThrow(() -> allocator.validate(List.of(share("car", 100.0d), share("bus", 0.0d))));
    }

    @Test
    @DisplayName("Sums outside tolerance, out-of-range shares and empty lists are rejected")
    void testRejections() {
        InvalidDistributionException sum = assertThrows(
                InvalidDistributionException.class,
                () -> allocator.validate(List.of(share("car", 50.0d), share("bus", 49.98d)))
        );
        assertEquals(DistributionAllocator.REASON_SUM_MISMATCH, sum.getReasonCode());

        InvalidDistributionException range = assertThrows(
                InvalidDistributionException.class,
                () -> allocator.validate(List.of(share("car", 120.0d), share("bus", -20.0d)))
        );
        assertEquals(DistributionAllocator.REASON_PERCENTAGE_OUT_OF_RANGE, range.getReasonCode());

        InvalidDistributionException empty = assertThrows(
                InvalidDistributionException.class,
                () -> allocator.validate(List.of())
        );
        assertEquals(DistributionAllocator.REASON_EMPTY_DISTRIBUTION, empty.getReasonCode());
    }
}
