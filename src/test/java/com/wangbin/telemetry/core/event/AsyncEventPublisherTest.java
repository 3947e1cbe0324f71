package com.wangbin.telemetry.core.event;

import com.wangbin.telemetry.Awaits;
import com.wangbin.telemetry.core.health.HealthVerdict;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class AsyncEventPublisherTest {

    @Test
    void eventsReachSinkInOrder() {
        RecordingEventSink sink = new RecordingEventSink();
        try (AsyncEventPublisher publisher = new AsyncEventPublisher(sink, 100, 10)) {
            publisher.start();
            for (int i = 0; i < 5; i++) {
                assertTrue(publisher.publish(event("r1:wan" + i)));
            }
            Awaits.until(() -> sink.getEvents().size() == 5, Duration.ofSeconds(5), "events delivered");

            List<WanHealthChangedEvent> events = sink.getEvents(WanHealthChangedEvent.class);
            assertEquals("r1:wan0", events.get(0).getLinkKey());
            assertEquals("r1:wan4", events.get(4).getLinkKey());
            assertEquals(5, publisher.getPublishedCount());
        }
    }

    @Test
    void fullQueueDropsWithoutBlocking() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch entered = new CountDownLatch(1);
        EventSink blockingSink = event -> {
            entered.countDown();
            release.await(10, TimeUnit.SECONDS);
        };
        AsyncEventPublisher publisher = new AsyncEventPublisher(blockingSink, 2, 1);
        publisher.start();
        try {
            assertTrue(publisher.publish(event("r1:wan1")));
            assertTrue(entered.await(5, TimeUnit.SECONDS));

            assertTrue(publisher.publish(event("r1:wan2")));
            assertTrue(publisher.publish(event("r1:wan3")));
            assertFalse(publisher.publish(event("r1:wan4")));
            assertEquals(1, publisher.getDroppedCount());
        } finally {
            release.countDown();
            publisher.close();
        }
    }

    @Test
    void sinkFailuresAreCountedNotPropagated() {
        RecordingEventSink sink = new RecordingEventSink();
        sink.setFailing(true);
        try (AsyncEventPublisher publisher = new AsyncEventPublisher(sink, 10, 10)) {
            publisher.start();
            publisher.publish(event("r1:wan1"));
            Awaits.until(() -> publisher.getFailedCount() == 1, Duration.ofSeconds(5), "failure counted");

            sink.setFailing(false);
            publisher.publish(event("r1:wan2"));
            Awaits.until(() -> sink.getEvents().size() == 1, Duration.ofSeconds(5), "publisher keeps working");
        }
    }

    @Test
    void publishBeforeStartIsDropped() {
        AsyncEventPublisher publisher = new AsyncEventPublisher(new RecordingEventSink(), 10, 10);

        assertFalse(publisher.publish(event("r1:wan1")));
        assertEquals(1, publisher.getDroppedCount());
        publisher.close();
    }

    @Test
    void missingSinkFailsConstruction() {
        assertThrows(NullPointerException.class, () -> new AsyncEventPublisher(null, 10, 10));
    }

    private static WanHealthChangedEvent event(String linkKey) {
        return new WanHealthChangedEvent(linkKey, HealthVerdict.DOWN, HealthVerdict.HEALTHY, 0, 2, List.of("1.1.1.1", "8.8.8.8"));
    }
}
