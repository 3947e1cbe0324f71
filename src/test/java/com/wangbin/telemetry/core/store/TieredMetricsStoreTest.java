package com.wangbin.telemetry.core.store;

import com.wangbin.telemetry.common.exception.TelemetryException;
import com.wangbin.telemetry.common.web.result.ResultCode;
import com.wangbin.telemetry.core.store.tier.LocalMetricsTier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TieredMetricsStoreTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");
    private static final String RESOURCE = "r1:*1";

    private RecordingTier hot;
    private RecordingTier warm;
    private RecordingTier cold;
    private TieredMetricsStore store;

    @BeforeEach
    void setUp() {
        hot = new RecordingTier(TierLevel.HOT);
        warm = new RecordingTier(TierLevel.WARM);
        cold = new RecordingTier(TierLevel.COLD);
        store = new TieredMetricsStore(List.of(hot, warm, cold), Clock.fixed(NOW, ZoneOffset.UTC), 500);
    }

    @Test
    void startAgeSelectsExactlyOneTier() {
        assertEquals(TierLevel.HOT, store.getHistory(RESOURCE, NOW.minus(Duration.ofMinutes(30)), NOW, "10s").getTier());
        assertEquals(TierLevel.WARM, store.getHistory(RESOURCE, NOW.minus(Duration.ofHours(6)), NOW, "5m").getTier());
        assertEquals(TierLevel.COLD, store.getHistory(RESOURCE, NOW.minus(Duration.ofDays(7)), NOW, "1h").getTier());

        assertEquals(1, hot.queries);
        assertEquals(1, warm.queries);
        assertEquals(1, cold.queries);
    }

    @Test
    void boundariesBelongToTheWarmerTier() {
        assertEquals(TierLevel.HOT, store.selectTier(NOW.minus(Duration.ofHours(1))));
        assertEquals(TierLevel.WARM, store.selectTier(NOW.minus(Duration.ofHours(1)).minusMillis(1)));
        assertEquals(TierLevel.WARM, store.selectTier(NOW.minus(Duration.ofHours(24))));
        assertEquals(TierLevel.COLD, store.selectTier(NOW.minus(Duration.ofHours(24)).minusMillis(1)));
        assertEquals(TierLevel.HOT, store.selectTier(NOW.plusSeconds(60)));
    }

    @Test
    void spanningQueryIsNotMerged() {
        store.getHistory(RESOURCE, NOW.minus(Duration.ofHours(2)), NOW, "1m");

        assertEquals(0, hot.queries);
        assertEquals(1, warm.queries);
    }

    @Test
    void largeResultIsDownsampled() {
        hot.result = DownsamplerTest.series(1200);

        HistorySeries series = store.getHistory(RESOURCE, NOW.minus(Duration.ofMinutes(10)), NOW, "1s");

        assertTrue(series.isDownsampled());
        assertTrue(series.size() <= 500);
        assertEquals(1000, series.getIntervalMillis());
    }

    @Test
    void smallResultIsReturnedAsIs() {
        hot.result = DownsamplerTest.series(20);

        HistorySeries series = store.getHistory(RESOURCE, NOW.minus(Duration.ofMinutes(10)), NOW, "5s");

        assertFalse(series.isDownsampled());
        assertEquals(hot.result, series.getPoints());
        assertEquals(Duration.ofSeconds(5), hot.lastInterval);
    }

    @Test
    void invalidArgumentsAreTypedErrors() {
        TelemetryException interval = assertThrows(TelemetryException.class,
                () -> store.getHistory(RESOURCE, NOW.minusSeconds(60), NOW, "soon"));
        assertEquals(ResultCode.INVALID_INTERVAL, interval.getResultCode());

        assertThrows(TelemetryException.class, () -> store.getHistory(RESOURCE, NOW.minusSeconds(60), NOW, "0s"));

        TelemetryException range = assertThrows(TelemetryException.class,
                () -> store.getHistory(RESOURCE, NOW, NOW.minusSeconds(60), "10s"));
        assertEquals(ResultCode.INVALID_TIME_RANGE, range.getResultCode());
        assertEquals(0, hot.queries);
    }

    @Test
    void storageFailureIsWrapped() {
        hot.failure = new IllegalStateException("redis down");

        TelemetryException e = assertThrows(TelemetryException.class,
                () -> store.getHistory(RESOURCE, NOW.minusSeconds(60), NOW, "10s"));
        assertEquals(ResultCode.STORAGE_ERROR, e.getResultCode());
        assertEquals(RESOURCE, e.getResourceKey());
    }

    @Test
    void recordWritesEveryTier() {
        TrafficPoint point = TrafficPoint.builder().timestamp(NOW.toEpochMilli()).txBytes(1).build();

        store.record(RESOURCE, point);

        assertEquals(List.of(point), hot.written);
        assertEquals(List.of(point), warm.written);
        assertEquals(List.of(point), cold.written);
    }

    @Test
    void allTiersAreRequired() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        assertThrows(IllegalArgumentException.class, () -> new TieredMetricsStore(List.of(hot, warm), clock, 500));
        assertThrows(IllegalArgumentException.class,
                () -> new TieredMetricsStore(List.of(hot, warm, cold, new RecordingTier(TierLevel.HOT)), clock, 500));
    }

    @Test
    void endToEndWithLocalTiers() {
        List<MetricsTier> tiers = List.of(
                new LocalMetricsTier(TierLevel.HOT, Duration.ofHours(2), 100),
                new LocalMetricsTier(TierLevel.WARM, Duration.ofHours(25), 100),
                new LocalMetricsTier(TierLevel.COLD, Duration.ofDays(30), 100));
        TieredMetricsStore local = new TieredMetricsStore(tiers, Clock.fixed(NOW, ZoneOffset.UTC), 500);

        long base = NOW.minus(Duration.ofMinutes(20)).toEpochMilli();
        for (int i = 0; i < 240; i++) {
            local.record(RESOURCE, TrafficPoint.builder().timestamp(base + i * 5_000L).txBytesPerSec(i).build());
        }

        HistorySeries raw = local.getHistory(RESOURCE, NOW.minus(Duration.ofMinutes(30)), NOW, "5s");
        assertEquals(TierLevel.HOT, raw.getTier());
        assertEquals(240, raw.size());
        for (int i = 1; i < raw.size(); i++) {
            assertTrue(raw.getPoints().get(i - 1).getTimestamp() < raw.getPoints().get(i).getTimestamp());
        }

        HistorySeries perMinute = local.getHistory(RESOURCE, NOW.minus(Duration.ofMinutes(30)), NOW, "1m");
        assertEquals(20, perMinute.size());
    }

    static class RecordingTier implements MetricsTier {

        private final TierLevel level;
        final List<TrafficPoint> written = new ArrayList<>();
        List<TrafficPoint> result = List.of();
        RuntimeException failure;
        Duration lastInterval;
        int queries;

        RecordingTier(TierLevel level) {
            this.level = level;
        }

        @Override
        public TierLevel getLevel() {
            return level;
        }

        @Override
        public void write(String resourceId, TrafficPoint point) {
            written.add(point);
        }

        @Override
        public List<TrafficPoint> query(String resourceId, long start, long end, Duration interval) {
            queries++;
            lastInterval = interval;
            if (failure != null) {
                throw failure;
            }
            return result;
        }

        @Override
        public Map<String, Object> getStatistics() {
            return Map.of("tier", level.name());
        }
    }
}
