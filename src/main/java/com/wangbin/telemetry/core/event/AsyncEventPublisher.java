package com.wangbin.telemetry.core.event;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 异步事件发布器
 * <p>
 * 轮询线程只做非阻塞入队，独立的工作线程批量取出事件交给 {@link EventSink}。
 * 队列满时丢弃最新事件；慢速的事件出口不会拖慢轮询循环。
 */
@Slf4j
public class AsyncEventPublisher implements AutoCloseable {

    private static final long POLL_INTERVAL_MS = 200;
    private static final long CLOSE_TIMEOUT_MS = 5000;

    private final EventSink sink;
    private final BlockingQueue<TelemetryEvent> queue;
    private final int batchSize;
    private final Thread workerThread;
    private final AtomicBoolean running = new AtomicBoolean(false);

    // 统计信息
    private final AtomicLong published = new AtomicLong(0);
    private final AtomicLong dropped = new AtomicLong(0);
    private final AtomicLong failed = new AtomicLong(0);

    public AsyncEventPublisher(EventSink sink, int capacity, int batchSize) {
        this.sink = Objects.requireNonNull(sink, "EventSink 未配置");
        this.queue = new LinkedBlockingQueue<>(Math.max(1, capacity));
        this.batchSize = Math.max(1, batchSize);
        this.workerThread = new Thread(this::processLoop, "event-publisher-" + System.identityHashCode(this));
        this.workerThread.setDaemon(true);
    }

    public void start() {
        if (running.compareAndSet(false, true)) {
            workerThread.start();
            log.info("事件发布器已启动: sink={}, capacity={}, batchSize={}",
                    sink.getClass().getSimpleName(), queue.remainingCapacity(), batchSize);
        }
    }

    /**
     * 非阻塞入队
     *
     * @return 队列已满或发布器未运行时返回 false
     */
    public boolean publish(TelemetryEvent event) {
        if (event == null) {
            return false;
        }
        if (!running.get() || !queue.offer(event)) {
            dropped.incrementAndGet();
            log.debug("事件被丢弃: type={}, id={}", event.getType(), event.getId());
            return false;
        }
        return true;
    }

    private void processLoop() {
        List<TelemetryEvent> batch = new ArrayList<>(batchSize);
        while (running.get()) {
            try {
                TelemetryEvent first = queue.poll(POLL_INTERVAL_MS, TimeUnit.MILLISECONDS);
                if (first == null) {
                    continue;
                }
                batch.add(first);
                queue.drainTo(batch, batchSize - 1);
                dispatchBatch(batch);
                batch.clear();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }

        // 停止后把剩余事件发完
        queue.drainTo(batch);
        dispatchBatch(batch);
        batch.clear();
    }

    private void dispatchBatch(List<TelemetryEvent> batch) {
        for (TelemetryEvent event : batch) {
            try {
                sink.publish(event);
                published.incrementAndGet();
            } catch (Exception e) {
                failed.incrementAndGet();
                log.warn("事件发布失败: type={}, id={}, error={}", event.getType(), event.getId(), e.getMessage());
            }
        }
    }

    public long getPublishedCount() {
        return published.get();
    }

    public long getDroppedCount() {
        return dropped.get();
    }

    public long getFailedCount() {
        return failed.get();
    }

    @Override
    public void close() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        try {
            workerThread.join(CLOSE_TIMEOUT_MS);
            if (workerThread.isAlive()) {
                log.warn("事件发布器未在 {}ms 内退出", CLOSE_TIMEOUT_MS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("等待事件发布器退出时被中断");
        }
        log.info("事件发布器已关闭: published={}, dropped={}, failed={}",
                published.get(), dropped.get(), failed.get());
    }
}
