package com.wangbin.telemetry.core.concurrent;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class CancellationScopeTest {

    @Test
    void cancelRunsCallbacksExactlyOnce() {
        CancellationScope scope = CancellationScope.root("session");
        AtomicInteger calls = new AtomicInteger();
        scope.onCancel(calls::incrementAndGet);

        scope.cancel();
        scope.cancel();

        assertTrue(scope.isCancelled());
        assertEquals(1, calls.get());
    }

    @Test
    void callbackRegisteredAfterCancelRunsImmediately() {
        CancellationScope scope = CancellationScope.root("session");
        scope.cancel();
        AtomicInteger calls = new AtomicInteger();

        scope.onCancel(calls::incrementAndGet);

        assertEquals(1, calls.get());
    }

    @Test
    void removedRegistrationIsNotInvoked() {
        CancellationScope scope = CancellationScope.root("session");
        AtomicInteger calls = new AtomicInteger();
        CancellationScope.Registration registration = scope.onCancel(calls::incrementAndGet);

        registration.remove();
        scope.cancel();

        assertEquals(0, calls.get());
    }

    @Test
    void parentCancellationPropagatesToChildrenOnly() {
        CancellationScope parent = CancellationScope.root("multiplexer");
        CancellationScope child = parent.child("session");
        CancellationScope grandChild = child.child("fetch");

        child.cancel();
        assertTrue(grandChild.isCancelled());
        assertFalse(parent.isCancelled());

        CancellationScope other = parent.child("other");
        parent.cancel();
        assertTrue(other.isCancelled());
    }

    @Test
    void failingCallbackDoesNotStopOthers() {
        CancellationScope scope = CancellationScope.root("session");
        AtomicInteger calls = new AtomicInteger();
        scope.onCancel(() -> {
            throw new IllegalStateException("boom");
        });
        scope.onCancel(calls::incrementAndGet);

        scope.cancel();

        assertEquals(1, calls.get());
    }

    @Test
    void awaitReturnsEarlyOnCancel() throws Exception {
        CancellationScope scope = CancellationScope.root("loop");
        assertFalse(scope.await(Duration.ofMillis(20)));

        Thread canceller = new Thread(() -> {
            try {
                Thread.sleep(50);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            scope.cancel();
        });
        canceller.start();

        long started = System.nanoTime();
        assertTrue(scope.await(Duration.ofSeconds(10)));
        assertTrue(Duration.ofNanos(System.nanoTime() - started).compareTo(Duration.ofSeconds(5)) < 0);
        canceller.join();
    }
}
