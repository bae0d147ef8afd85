package org.Aayush.scenario.core.format;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SUMO Number Formatting Tests")
class SumoNumbersTest {

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource({
            "50.0, 50",
            "13.89, 13.89",
            "-12.5, -12.5",
            "0.0, 0",
            "-0.0, 0",
            "0.0000001, 0.0000001",
            "100000000000000000000.0, 100000000000000000000"
    })
    @DisplayName("Doubles render as shortest plain decimal")
    void testPlainDecimal(double value, String expected) {
        assertEquals(expected, SumoNumbers.format(value));
    }

    @Test
    @DisplayName("Integers render without decimals")
    void testIntegers() {
        assertEquals("3", SumoNumbers.format(3));
        assertEquals("-1", SumoNumbers.format(-1));
    }

    @Test
    @DisplayName("Non-finite values are rejected")
    void testNonFinite() {
        assertThrows(IllegalArgumentException.class, () -> SumoNumbers.format(Double.NaN));
        assertThrows(IllegalArgumentException.class, () -> SumoNumbers.format(Double.POSITIVE_INFINITY));
    }
}
