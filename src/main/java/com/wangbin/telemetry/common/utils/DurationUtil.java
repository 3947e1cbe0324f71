package com.wangbin.telemetry.common.utils;

import com.wangbin.telemetry.common.exception.TelemetryException;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 时长解析工具类
 * <p>
 * 支持紧凑写法（{@code 500ms}、{@code 30s}、{@code 5m}、{@code 1h30m}、{@code 1d}、{@code 2w}）
 * 以及 ISO-8601 写法（{@code PT5M}）。
 */
public class DurationUtil {

    private static final Pattern SEGMENT = Pattern.compile("(\\d+)(ms|w|d|h|m|s)");

    private DurationUtil() {
        // 工具类，防止实例化
    }

    /**
     * 解析时长字符串，结果必须为正
     *
     * @throws TelemetryException 无法解析或结果不为正时抛出 INVALID_INTERVAL
     */
    public static Duration parsePositive(String text) {
        Duration duration = parse(text);
        if (duration.isZero() || duration.isNegative()) {
            throw TelemetryException.invalidInterval(text);
        }
        return duration;
    }

    /**
     * 解析时长字符串
     *
     * @throws TelemetryException 无法解析时抛出 INVALID_INTERVAL
     */
    public static Duration parse(String text) {
        if (text == null || text.isBlank()) {
            throw TelemetryException.invalidInterval(text);
        }
        String value = text.trim().toLowerCase(Locale.ROOT);

        if (value.startsWith("p")) {
            try {
                Duration duration = Duration.parse(value.toUpperCase(Locale.ROOT));
                duration.toMillis();
                return duration;
            } catch (DateTimeParseException | ArithmeticException e) {
                throw TelemetryException.invalidInterval(text);
            }
        }

        Matcher matcher = SEGMENT.matcher(value);
        Duration total = Duration.ZERO;
        int position = 0;
        try {
            while (matcher.find()) {
                if (matcher.start() != position) {
                    throw TelemetryException.invalidInterval(text);
                }
                long amount = Long.parseLong(matcher.group(1));
                total = total.plus(toDuration(amount, matcher.group(2)));
                position = matcher.end();
            }
            // 时间窗口按毫秒计算，超出毫秒范围同样视为无效
            total.toMillis();
        } catch (NumberFormatException | ArithmeticException e) {
            throw TelemetryException.invalidInterval(text);
        }
        if (position == 0 || position != value.length()) {
            throw TelemetryException.invalidInterval(text);
        }
        return total;
    }

    /**
     * 把时长格式化为紧凑写法（设备侧参数使用秒）
     */
    public static String toSeconds(Duration duration) {
        return Math.max(0, duration.getSeconds()) + "s";
    }

    private static Duration toDuration(long amount, String unit) {
        return switch (unit) {
            case "ms" -> Duration.ofMillis(amount);
            case "s" -> Duration.ofSeconds(amount);
            case "m" -> Duration.ofMinutes(amount);
            case "h" -> Duration.ofHours(amount);
            case "d" -> Duration.ofDays(amount);
            case "w" -> Duration.ofDays(Math.multiplyExact(amount, 7L));
            default -> throw new IllegalArgumentException("unknown unit: " + unit);
        };
    }
}
