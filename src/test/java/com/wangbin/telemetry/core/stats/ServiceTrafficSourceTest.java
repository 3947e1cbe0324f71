package com.wangbin.telemetry.core.stats;

import com.wangbin.telemetry.core.device.DeviceCommand;
import com.wangbin.telemetry.core.event.ServiceTrafficUpdateEvent;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ServiceTrafficSourceTest {

    private final ServiceTrafficSource source = new ServiceTrafficSource();

    @Test
    void commandTargetsTheServiceQueue() {
        DeviceCommand command = source.buildCommand("r1:web-01");

        assertEquals("/queue/simple", command.getPath());
        assertEquals(Map.of("name", "svc-web-01"), command.getQuery());
    }

    @Test
    void pairedCountersSplitIntoUploadAndDownload() {
        ServiceTrafficStats first = source.buildPoint("r1:web-01",
                List.of(queue("svc-web-01", "1000/5000", "10/50")), null, 0);
        ServiceTrafficStats second = source.buildPoint("r1:web-01",
                List.of(queue("svc-web-01", "3000/15000", "30/150")), first, 10_000);

        assertEquals(3000, second.getTxBytes());
        assertEquals(15000, second.getRxBytes());
        assertEquals(200.0, second.getTxBytesPerSec(), 1e-9);
        assertEquals(1000.0, second.getRxBytesPerSec(), 1e-9);
        assertEquals(10.0, second.getRxPacketsPerSec(), 1e-9);
        assertEquals("r1:svc-web-01", second.getHistoryResourceId());

        ServiceTrafficUpdateEvent event = (ServiceTrafficUpdateEvent) source.toEvent(second);
        assertEquals("web-01", event.getInstanceId());
        assertEquals(200.0, event.getUploadRate(), 1e-9);
    }

    @Test
    void incompleteCounterPairRejectsTheSample() {
        assertThrows(IllegalArgumentException.class, () -> source.buildPoint("r1:web-01",
                List.of(queue("svc-web-01", "1000", "10/50")), null, 0));
        assertThrows(IllegalArgumentException.class, () -> source.buildPoint("r1:web-01",
                List.of(Map.of("name", "svc-web-01", "packets", "10/50")), null, 0));
    }

    @Test
    void otherQueuesAreIgnored() {
        assertNull(source.buildPoint("r1:web-01", List.of(queue("svc-web-02", "1/1", "1/1")), null, 0));
    }

    private static Map<String, String> queue(String name, String bytes, String packets) {
        return Map.of("name", name, "bytes", bytes, "packets", packets);
    }
}
