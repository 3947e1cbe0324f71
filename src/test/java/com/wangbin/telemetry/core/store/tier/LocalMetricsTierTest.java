package com.wangbin.telemetry.core.store.tier;

import com.wangbin.telemetry.core.store.TierLevel;
import com.wangbin.telemetry.core.store.TrafficPoint;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class LocalMetricsTierTest {

    private static final long T0 = 1_714_564_800_000L; // 2024-05-01T12:00:00Z, 整小时

    @Test
    void rawTierKeepsEveryPointAndLeavesGapsAbsent() {
        LocalMetricsTier tier = new LocalMetricsTier(TierLevel.HOT, Duration.ofHours(2), 100);
        tier.write("r1:*1", point(T0, 10));
        tier.write("r1:*1", point(T0 + 5_000, 20));
        // T0 + 10s 采集失败
        tier.write("r1:*1", point(T0 + 15_000, 40));

        List<TrafficPoint> points = tier.query("r1:*1", T0, T0 + 60_000, Duration.ofSeconds(5));

        assertEquals(3, points.size());
        assertEquals(T0 + 15_000, points.get(2).getTimestamp());
        assertTrue(tier.query("r1:*2", T0, T0 + 60_000, Duration.ofSeconds(5)).isEmpty());
    }

    @Test
    void coarserIntervalAveragesIntoAlignedBuckets() {
        LocalMetricsTier tier = new LocalMetricsTier(TierLevel.HOT, Duration.ofHours(2), 100);
        for (int i = 0; i < 24; i++) {
            tier.write("r1:*1", point(T0 + i * 5_000L, i));
        }

        List<TrafficPoint> perMinute = tier.query("r1:*1", T0, T0 + 120_000, Duration.ofMinutes(1));

        assertEquals(2, perMinute.size());
        assertEquals(T0, perMinute.get(0).getTimestamp());
        assertEquals(5.5, perMinute.get(0).getTxBytesPerSec(), 1e-9);
        assertEquals(T0 + 60_000, perMinute.get(1).getTimestamp());
        assertEquals(17.5, perMinute.get(1).getTxBytesPerSec(), 1e-9);
    }

    @Test
    void warmTierRollsUpFiveMinuteBuckets() {
        LocalMetricsTier tier = new LocalMetricsTier(TierLevel.WARM, Duration.ofHours(25), 100);
        // 两个完整的 5 分钟桶加一个未封口的桶
        for (int i = 0; i < 150; i++) {
            tier.write("r1:*1", point(T0 + i * 5_000L, i < 60 ? 10 : 30));
        }

        List<TrafficPoint> points = tier.query("r1:*1", T0, T0 + Duration.ofHours(1).toMillis(), Duration.ofMinutes(5));

        assertEquals(3, points.size());
        assertEquals(T0, points.get(0).getTimestamp());
        assertEquals(10.0, points.get(0).getTxBytesPerSec(), 1e-9);
        assertEquals(T0 + 300_000, points.get(1).getTimestamp());
        assertEquals(30.0, points.get(1).getTxBytesPerSec(), 1e-9);
        assertEquals(T0 + 600_000, points.get(2).getTimestamp());
    }

    @Test
    void lateSamplesForClosedBucketsAreIgnored() {
        LocalMetricsTier tier = new LocalMetricsTier(TierLevel.WARM, Duration.ofHours(25), 100);
        tier.write("r1:*1", point(T0 + 400_000, 1));
        tier.write("r1:*1", point(T0 + 10_000, 99));

        List<TrafficPoint> points = tier.query("r1:*1", T0, T0 + 600_000, Duration.ofMinutes(5));

        assertEquals(1, points.size());
        assertEquals(1.0, points.get(0).getTxBytesPerSec(), 1e-9);
        assertEquals(1L, tier.getStatistics().get("totalLateSamples"));
    }

    @Test
    void idleResourcesDoNotKeepOpenBuckets() {
        LocalMetricsTier tier = new LocalMetricsTier(TierLevel.WARM, Duration.ofHours(25), 100);
        tier.write("r1:*1", point(T0 + 10_000, 7));
        tier.write("r1:*2", point(T0 + 20_000, 1));
        assertEquals(2, tier.getStatistics().get("openBuckets"));

        // r1:*1 停止上报，r1:*2 继续上报到两个桶之后
        tier.write("r1:*2", point(T0 + 300_000, 2));
        tier.write("r1:*2", point(T0 + 600_000, 3));

        assertEquals(1, tier.getStatistics().get("openBuckets"));
        List<TrafficPoint> idle = tier.query("r1:*1", T0, T0 + 900_000, Duration.ofMinutes(5));
        assertEquals(1, idle.size());
        assertEquals(T0, idle.get(0).getTimestamp());
        assertEquals(7.0, idle.get(0).getTxBytesPerSec(), 1e-9);
        assertEquals(3, tier.query("r1:*2", T0, T0 + 900_000, Duration.ofMinutes(5)).size());
    }

    @Test
    void retentionTrimsOldPoints() {
        LocalMetricsTier tier = new LocalMetricsTier(TierLevel.HOT, Duration.ofMinutes(10), 100);
        tier.write("r1:*1", point(T0, 1));
        tier.write("r1:*1", point(T0 + Duration.ofMinutes(11).toMillis(), 2));

        List<TrafficPoint> points = tier.query("r1:*1", 0, Long.MAX_VALUE, Duration.ofSeconds(1));

        assertEquals(1, points.size());
        assertEquals(2.0, points.get(0).getTxBytesPerSec(), 1e-9);
    }

    @Test
    void statisticsDescribeTheTier() {
        LocalMetricsTier tier = new LocalMetricsTier(TierLevel.COLD, Duration.ofDays(30), 100);
        tier.write("r1:*1", point(T0, 1));

        Map<String, Object> stats = tier.getStatistics();

        assertEquals("COLD", stats.get("tier"));
        assertEquals(1L, stats.get("totalWrites"));
        assertEquals(1, stats.get("openBuckets"));
    }

    private static TrafficPoint point(long timestamp, double rate) {
        return TrafficPoint.builder()
                .timestamp(timestamp)
                .txBytes((long) rate * 100)
                .txBytesPerSec(rate)
                .rxBytesPerSec(rate * 2)
                .build();
    }
}
