package com.wangbin.telemetry.core.health;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class HealthVerdictTest {

    @Test
    void aggregationFollowsReachableRatio() {
        assertEquals(HealthVerdict.HEALTHY, HealthVerdict.aggregate(3, 3));
        assertEquals(HealthVerdict.DEGRADED, HealthVerdict.aggregate(2, 3));
        assertEquals(HealthVerdict.DEGRADED, HealthVerdict.aggregate(1, 3));
        assertEquals(HealthVerdict.DOWN, HealthVerdict.aggregate(0, 3));
        assertEquals(HealthVerdict.UNKNOWN, HealthVerdict.aggregate(0, 0));
    }

    @Test
    void singleTargetIsEitherHealthyOrDown() {
        assertEquals(HealthVerdict.HEALTHY, HealthVerdict.aggregate(1, 1));
        assertEquals(HealthVerdict.DOWN, HealthVerdict.aggregate(0, 1));
    }
}
