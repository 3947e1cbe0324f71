package com.wangbin.telemetry.common.utils;

import com.wangbin.telemetry.common.exception.TelemetryException;
import com.wangbin.telemetry.common.web.result.ResultCode;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class DurationUtilTest {

    @Test
    void compactSegmentsAreSummed() {
        assertEquals(Duration.ofSeconds(30), DurationUtil.parse("30s"));
        assertEquals(Duration.ofMinutes(5), DurationUtil.parse("5m"));
        assertEquals(Duration.ofMinutes(90), DurationUtil.parse("1h30m"));
        assertEquals(Duration.ofDays(1), DurationUtil.parse("1d"));
        assertEquals(Duration.ofDays(14), DurationUtil.parse("2w"));
        assertEquals(Duration.ofMillis(500), DurationUtil.parse("500ms"));
        assertEquals(Duration.ofMinutes(5), DurationUtil.parse(" 5M "));
    }

    @Test
    void isoFormatIsAccepted() {
        assertEquals(Duration.ofMinutes(5), DurationUtil.parse("PT5M"));
        assertEquals(Duration.ofHours(1), DurationUtil.parse("pt1h"));
    }

    @Test
    void garbageIsRejectedAsInvalidInterval() {
        for (String text : new String[]{null, "", "  ", "5", "m", "5x", "5m junk", "abc5m", "P"}) {
            TelemetryException e = assertThrows(TelemetryException.class, () -> DurationUtil.parse(text), text);
            assertEquals(ResultCode.INVALID_INTERVAL, e.getResultCode());
        }
    }

    @Test
    void overflowingAmountsAreInvalidIntervals() {
        for (String text : new String[]{"9999999999999999d", "9999999999999999999s",
                "2000000000000000000w", "9223372036854775807s1s", "PT9999999999999999H"}) {
            TelemetryException e = assertThrows(TelemetryException.class, () -> DurationUtil.parsePositive(text), text);
            assertEquals(ResultCode.INVALID_INTERVAL, e.getResultCode());
        }
    }

    @Test
    void parsePositiveRejectsZero() {
        assertThrows(TelemetryException.class, () -> DurationUtil.parsePositive("0s"));
        assertThrows(TelemetryException.class, () -> DurationUtil.parsePositive("PT-5M"));
        assertEquals(Duration.ofSeconds(10), DurationUtil.parsePositive("10s"));
    }

    @Test
    void secondsFormatting() {
        assertEquals("10s", DurationUtil.toSeconds(Duration.ofSeconds(10)));
        assertEquals("0s", DurationUtil.toSeconds(Duration.ofSeconds(-1)));
    }
}
