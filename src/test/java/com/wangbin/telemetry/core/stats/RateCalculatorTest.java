package com.wangbin.telemetry.core.stats;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class RateCalculatorTest {

    @Test
    void rateIsDeltaOverInterval() {
        assertEquals(100.0, RateCalculator.calculateRate(1000, 500, 5), 1e-9);
        assertEquals(0.0, RateCalculator.calculateRate(500, 500, 5), 1e-9);
    }

    @Test
    void counterResetNeverProducesNegativeRate() {
        assertEquals(0.0, RateCalculator.calculateRate(100, 9000, 5), 1e-9);
    }

    @Test
    void nonPositiveIntervalYieldsZero() {
        assertEquals(0.0, RateCalculator.calculateRate(1000, 500, 0), 1e-9);
        assertEquals(0.0, RateCalculator.calculateRate(9000, 100, 0), 1e-9);
        assertEquals(0.0, RateCalculator.calculateRate(1000, 500, -3), 1e-9);
        assertEquals(0.0, RateCalculator.calculateRate(1000, 500, Double.NaN), 1e-9);
    }

    @Test
    void elapsedSecondsConvertsMillis() {
        assertEquals(2.5, RateCalculator.elapsedSeconds(12_500, 10_000), 1e-9);
    }
}
