package com.wangbin.telemetry.core.stats;

import java.util.Map;

/**
 * 设备返回记录的字段解析
 * <p>
 * 计数器按无符号 64 位解析，超过 {@link Long#MAX_VALUE} 的值按上限截断。
 */
final class RecordValues {

    private RecordValues() {
    }

    /**
     * 解析可选计数器，缺失或非法时返回 0
     */
    static long parseCounter(Map<String, String> record, String field) {
        String value = record.get(field);
        if (value == null || value.isBlank()) {
            return 0L;
        }
        try {
            return parseUnsigned(value);
        } catch (NumberFormatException e) {
            return 0L;
        }
    }

    /**
     * 解析速率计算依赖的计数器
     *
     * @throws IllegalArgumentException 字段缺失或非法时抛出，本次采样作废
     */
    static long requireCounter(Map<String, String> record, String field) {
        String value = record.get(field);
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("缺少计数器字段: " + field);
        }
        try {
            return parseUnsigned(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("计数器字段非法: " + field + "=" + value);
        }
    }

    /**
     * 解析形如 {@code upload/download} 的成对计数器，两个值都必须存在
     *
     * @throws IllegalArgumentException 字段缺失或非法时抛出，本次采样作废
     */
    static long[] requireCounterPair(Map<String, String> record, String field) {
        String value = record.get(field);
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("缺少计数器字段: " + field);
        }
        String[] parts = value.split("/", 2);
        if (parts.length != 2) {
            throw new IllegalArgumentException("计数器字段非法: " + field + "=" + value);
        }
        try {
            return new long[]{parseUnsigned(parts[0]), parseUnsigned(parts[1])};
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("计数器字段非法: " + field + "=" + value);
        }
    }

    private static long parseUnsigned(String text) {
        long value = Long.parseUnsignedLong(text.trim());
        return value < 0 ? Long.MAX_VALUE : value;
    }
}
