package com.wangbin.telemetry.core.polling;

import com.wangbin.telemetry.core.concurrent.CancellationScope;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 单个资源键的轮询会话：一个轮询循环加上一组订阅者
 */
final class PollingSession<T> {

    private final String key;
    private final Duration interval;
    private final CancellationScope scope;
    private final CountDownLatch finished = new CountDownLatch(1);

    private final ReentrantLock subscriberLock = new ReentrantLock();
    private final Set<Subscription<T>> subscribers = new LinkedHashSet<>();

    private volatile long lastFetchAt;

    // 只由轮询线程读写
    private T previous;

    PollingSession(String key, Duration interval, CancellationScope scope) {
        this.key = key;
        this.interval = interval;
        this.scope = scope;
    }

    String getKey() {
        return key;
    }

    Duration getInterval() {
        return interval;
    }

    CancellationScope getScope() {
        return scope;
    }

    long getLastFetchAt() {
        return lastFetchAt;
    }

    T getPrevious() {
        return previous;
    }

    void recordFetch(T point, long timestamp) {
        this.previous = point;
        this.lastFetchAt = timestamp;
    }

    void addSubscriber(Subscription<T> subscription) {
        subscriberLock.lock();
        try {
            subscribers.add(subscription);
        } finally {
            subscriberLock.unlock();
        }
    }

    /**
     * @return 订阅者确实属于本会话时返回 true
     */
    boolean removeSubscriber(Subscription<T> subscription) {
        subscriberLock.lock();
        try {
            return subscribers.remove(subscription);
        } finally {
            subscriberLock.unlock();
        }
    }

    boolean hasSubscribers() {
        subscriberLock.lock();
        try {
            return !subscribers.isEmpty();
        } finally {
            subscriberLock.unlock();
        }
    }

    int getSubscriberCount() {
        subscriberLock.lock();
        try {
            return subscribers.size();
        } finally {
            subscriberLock.unlock();
        }
    }

    /**
     * 订阅者快照，广播在锁外进行
     */
    List<Subscription<T>> snapshotSubscribers() {
        subscriberLock.lock();
        try {
            return new ArrayList<>(subscribers);
        } finally {
            subscriberLock.unlock();
        }
    }

    List<Subscription<T>> clearSubscribers() {
        subscriberLock.lock();
        try {
            List<Subscription<T>> removed = new ArrayList<>(subscribers);
            subscribers.clear();
            return removed;
        } finally {
            subscriberLock.unlock();
        }
    }

    void markFinished() {
        finished.countDown();
    }

    boolean awaitFinished(Duration timeout) throws InterruptedException {
        return finished.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }
}
