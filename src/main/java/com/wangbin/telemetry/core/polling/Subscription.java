package com.wangbin.telemetry.core.polling;

import com.wangbin.telemetry.core.concurrent.CancellationScope;

import java.time.Duration;
import java.util.Collection;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * 订阅者持有的只读数据流
 * <p>
 * 底层是有界队列，只由所属会话写入；调用方只能读取或取消。
 * 关闭只发生一次，关闭后不再写入，已缓冲的数据点仍可读出。
 *
 * @param <T> 数据点类型
 */
public final class Subscription<T> {

    private static final long CLOSE_CHECK_MS = 100;

    private final long id;
    private final String key;
    private final BlockingQueue<T> queue;
    private final Consumer<Subscription<T>> canceller;
    private final AtomicLong dropped = new AtomicLong(0);
    private final AtomicLong delivered = new AtomicLong(0);

    // guarded by this
    private boolean closed;
    private CancellationScope.Registration callerRegistration;

    Subscription(long id, String key, int capacity, Consumer<Subscription<T>> canceller) {
        this.id = id;
        this.key = key;
        this.queue = new ArrayBlockingQueue<>(Math.max(1, capacity));
        this.canceller = canceller;
    }

    public long getId() {
        return id;
    }

    public String getKey() {
        return key;
    }

    /**
     * 非阻塞投递，队列已满时丢弃本次数据点
     */
    boolean offer(T point) {
        synchronized (this) {
            if (closed) {
                return false;
            }
            if (queue.offer(point)) {
                delivered.incrementAndGet();
                return true;
            }
        }
        dropped.incrementAndGet();
        return false;
    }

    void bindCallerScope(CancellationScope.Registration registration) {
        boolean alreadyClosed;
        synchronized (this) {
            alreadyClosed = closed;
            if (!alreadyClosed) {
                callerRegistration = registration;
            }
        }
        if (alreadyClosed) {
            registration.remove();
        }
    }

    /**
     * 关闭队列，只有第一次调用生效
     */
    boolean close() {
        CancellationScope.Registration registration;
        synchronized (this) {
            if (closed) {
                return false;
            }
            closed = true;
            registration = callerRegistration;
            callerRegistration = null;
        }
        if (registration != null) {
            registration.remove();
        }
        return true;
    }

    public synchronized boolean isClosed() {
        return closed;
    }

    /**
     * 取出下一个数据点，没有数据时立即返回 null
     */
    public T poll() {
        return queue.poll();
    }

    /**
     * 在给定时长内等待下一个数据点
     *
     * @return 数据点；超时或订阅已关闭且缓冲为空时返回 null
     */
    public T poll(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (true) {
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                return queue.poll();
            }
            T point = queue.poll(Math.min(remaining, TimeUnit.MILLISECONDS.toNanos(CLOSE_CHECK_MS)), TimeUnit.NANOSECONDS);
            if (point != null) {
                return point;
            }
            if (isClosed()) {
                return queue.poll();
            }
        }
    }

    public int drainTo(Collection<? super T> target) {
        return queue.drainTo(target);
    }

    /**
     * 当前缓冲的数据点数量
     */
    public int size() {
        return queue.size();
    }

    public long getDroppedCount() {
        return dropped.get();
    }

    public long getDeliveredCount() {
        return delivered.get();
    }

    /**
     * 取消订阅，等价于调用所属多路复用器的 unsubscribe
     */
    public void cancel() {
        canceller.accept(this);
    }

    @Override
    public String toString() {
        return "Subscription{id=" + id + ", key=" + key + ", closed=" + isClosed() + "}";
    }
}
