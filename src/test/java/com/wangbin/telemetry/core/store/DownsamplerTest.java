package com.wangbin.telemetry.core.store;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DownsamplerTest {

    @Test
    void shortSeriesIsReturnedUnchanged() {
        List<TrafficPoint> points = series(100);

        assertSame(points, Downsampler.downsample(points, 100));
        assertSame(points, Downsampler.downsample(points, 500));
    }

    @Test
    void thousandPointsBecomeHundredBucketMeans() {
        List<TrafficPoint> points = series(1000);

        List<TrafficPoint> result = Downsampler.downsample(points, 100);

        assertEquals(100, result.size());
        for (int b = 0; b < result.size(); b++) {
            List<TrafficPoint> bucket = points.subList(b * 10, b * 10 + 10);
            TrafficPoint averaged = result.get(b);
            assertEquals(mean(bucket, true), averaged.getTxBytesPerSec(), 0.01);
            assertEquals(mean(bucket, false), averaged.getRxBytesPerSec(), 0.01);
            assertEquals(bucket.get(5).getTimestamp(), averaged.getTimestamp(), "timestamp of the middle sample");
        }
    }

    @Test
    void resultNeverExceedsMaxPoints() {
        for (int n : new int[]{101, 333, 999, 1001, 4567}) {
            for (int max : new int[]{1, 7, 100, 250}) {
                List<TrafficPoint> result = Downsampler.downsample(series(n), max);
                assertTrue(result.size() <= max, n + " -> " + max + " gave " + result.size());
            }
        }
    }

    @Test
    void unevenTailBucketUsesItsOwnMiddle() {
        List<TrafficPoint> points = series(7);

        List<TrafficPoint> result = Downsampler.downsample(points, 3);

        // 桶大小 ceil(7/3) = 3：[0..2] [3..5] [6]
        assertEquals(3, result.size());
        assertEquals(points.get(1).getTimestamp(), result.get(0).getTimestamp());
        assertEquals(points.get(4).getTimestamp(), result.get(1).getTimestamp());
        assertEquals(points.get(6).getTimestamp(), result.get(2).getTimestamp());
        assertEquals(points.get(6).getTxBytesPerSec(), result.get(2).getTxBytesPerSec(), 1e-9);
    }

    @Test
    void nonPositiveMaxIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> Downsampler.downsample(series(3), 0));
    }

    static List<TrafficPoint> series(int n) {
        List<TrafficPoint> points = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            points.add(TrafficPoint.builder()
                    .timestamp(1_700_000_000_000L + i * 5_000L)
                    .txBytes(i * 1000L)
                    .rxBytes(i * 3000L)
                    .txBytesPerSec((i * 37) % 101 + 0.25)
                    .rxBytesPerSec((i * 53) % 89 * 1.5)
                    .build());
        }
        return points;
    }

    private static double mean(List<TrafficPoint> bucket, boolean tx) {
        return bucket.stream()
                .mapToDouble(p -> tx ? p.getTxBytesPerSec() : p.getRxBytesPerSec())
                .average()
                .orElseThrow();
    }
}
