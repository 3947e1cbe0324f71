package com.wangbin.telemetry.core.store;

/**
 * 按桶累加数据点，输出桶内各字段的平均值
 */
final class RollupAccumulator {

    private final long bucketStart;
    private int count;

    private double txBytes;
    private double rxBytes;
    private double txPackets;
    private double rxPackets;
    private double txErrors;
    private double rxErrors;
    private double txBytesPerSec;
    private double rxBytesPerSec;
    private double txPacketsPerSec;
    private double rxPacketsPerSec;

    RollupAccumulator(long bucketStart) {
        this.bucketStart = bucketStart;
    }

    long getBucketStart() {
        return bucketStart;
    }

    int getCount() {
        return count;
    }

    void add(TrafficPoint point) {
        count++;
        txBytes += point.getTxBytes();
        rxBytes += point.getRxBytes();
        txPackets += point.getTxPackets();
        rxPackets += point.getRxPackets();
        txErrors += point.getTxErrors();
        rxErrors += point.getRxErrors();
        txBytesPerSec += point.getTxBytesPerSec();
        rxBytesPerSec += point.getRxBytesPerSec();
        txPacketsPerSec += point.getTxPacketsPerSec();
        rxPacketsPerSec += point.getRxPacketsPerSec();
    }

    TrafficPoint toPoint() {
        return toPoint(bucketStart);
    }

    TrafficPoint toPoint(long timestamp) {
        if (count == 0) {
            throw new IllegalStateException("empty bucket");
        }
        return TrafficPoint.builder()
                .timestamp(timestamp)
                .txBytes(Math.round(txBytes / count))
                .rxBytes(Math.round(rxBytes / count))
                .txPackets(Math.round(txPackets / count))
                .rxPackets(Math.round(rxPackets / count))
                .txErrors(Math.round(txErrors / count))
                .rxErrors(Math.round(rxErrors / count))
                .txBytesPerSec(txBytesPerSec / count)
                .rxBytesPerSec(rxBytesPerSec / count)
                .txPacketsPerSec(txPacketsPerSec / count)
                .rxPacketsPerSec(rxPacketsPerSec / count)
                .build();
    }
}
