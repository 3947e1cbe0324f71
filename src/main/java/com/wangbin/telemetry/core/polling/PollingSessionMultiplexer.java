package com.wangbin.telemetry.core.polling;

import com.wangbin.telemetry.common.exception.TelemetryException;
import com.wangbin.telemetry.core.concurrent.CancellationScope;
import com.wangbin.telemetry.core.device.DeviceCommand;
import com.wangbin.telemetry.core.device.DeviceProbe;
import com.wangbin.telemetry.core.device.ProbeResult;
import com.wangbin.telemetry.core.event.AsyncEventPublisher;
import com.wangbin.telemetry.core.event.TelemetryEvent;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * 轮询会话多路复用器
 * <p>
 * 每个资源键最多对应一个会话，每个会话只有一个"采集-广播"循环，
 * 订阅者共享该循环的采集节奏。会话在第一次订阅时创建，最后一个订阅者离开时销毁。
 * 会话表的创建、启动与销毁都在同一把锁内完成，调用方看不到没有循环的会话。
 *
 * @param <T> 数据点类型
 */
@Slf4j
public class PollingSessionMultiplexer<T> {

    private final String name;
    private final DeviceProbe probe;
    private final PollingSource<T> source;
    private final PollingSettings settings;
    private final Executor loopExecutor;
    private final Executor probeExecutor;
    private final AsyncEventPublisher eventPublisher;

    private final CancellationScope rootScope;
    private final List<Consumer<T>> sampleListeners = new CopyOnWriteArrayList<>();
    private final AtomicLong subscriptionSequence = new AtomicLong(0);

    // 会话表锁：只保护成员变更，不跨越设备调用与广播
    private final ReentrantLock sessionsLock = new ReentrantLock();
    private final Map<String, PollingSession<T>> sessions = new HashMap<>();
    private boolean stopped;

    public PollingSessionMultiplexer(DeviceProbe probe,
                                     PollingSource<T> source,
                                     PollingSettings settings,
                                     Executor loopExecutor,
                                     Executor probeExecutor,
                                     AsyncEventPublisher eventPublisher) {
        if (probe == null) {
            throw new IllegalArgumentException("DeviceProbe 未配置");
        }
        if (eventPublisher == null) {
            throw new IllegalArgumentException("事件发布器未配置");
        }
        this.probe = probe;
        this.source = Objects.requireNonNull(source, "source");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.loopExecutor = Objects.requireNonNull(loopExecutor, "loopExecutor");
        this.probeExecutor = Objects.requireNonNull(probeExecutor, "probeExecutor");
        this.eventPublisher = eventPublisher;
        this.name = source.getName();
        this.rootScope = CancellationScope.root(name);
    }

    /**
     * 订阅资源键的数据流
     *
     * @param key          会话键
     * @param pollInterval 期望的采集间隔，会被限制在实例的上下限内；会话已存在时沿用会话的间隔
     * @param callerScope  调用方作用域，取消时自动退订；可为 null
     */
    public Subscription<T> subscribe(String key, Duration pollInterval, CancellationScope callerScope) {
        if (key == null || key.isBlank()) {
            throw TelemetryException.configException(key, "会话键不能为空");
        }

        Subscription<T> subscription = new Subscription<>(
                subscriptionSequence.incrementAndGet(),
                key,
                settings.getQueueCapacity(),
                sub -> unsubscribe(key, sub));

        sessionsLock.lock();
        try {
            if (stopped) {
                throw TelemetryException.stopped(name, key);
            }
            PollingSession<T> session = sessions.get(key);
            if (session == null) {
                session = startSession(key, settings.clamp(pollInterval));
                sessions.put(key, session);
            }
            session.addSubscriber(subscription);
            log.debug("[{}] 新增订阅: key={}, subscription={}, subscribers={}",
                    name, key, subscription.getId(), session.getSubscriberCount());
        } finally {
            sessionsLock.unlock();
        }

        if (callerScope != null) {
            subscription.bindCallerScope(callerScope.onCancel(subscription::cancel));
        }
        return subscription;
    }

    /**
     * 退订；会话没有订阅者后停止循环并移除会话
     */
    public void unsubscribe(String key, Subscription<T> subscription) {
        if (subscription == null) {
            return;
        }
        if (!subscription.getKey().equals(key)) {
            log.warn("[{}] 退订键与订阅不一致，按订阅自身的键退订: key={}, subscription={}",
                    name, key, subscription);
            key = subscription.getKey();
        }
        sessionsLock.lock();
        try {
            PollingSession<T> session = sessions.get(key);
            boolean removed = session != null && session.removeSubscriber(subscription);
            subscription.close();
            if (removed && !session.hasSubscribers()) {
                session.getScope().cancel();
                sessions.remove(key);
                log.info("[{}] 会话已关闭: key={}", name, key);
            }
        } finally {
            sessionsLock.unlock();
        }
    }

    /**
     * 停止所有会话，并等待所有循环退出后返回
     */
    public void stop() {
        List<PollingSession<T>> toStop;
        sessionsLock.lock();
        try {
            if (stopped) {
                return;
            }
            stopped = true;
            toStop = new ArrayList<>(sessions.values());
            sessions.clear();
        } finally {
            sessionsLock.unlock();
        }

        rootScope.cancel();
        for (PollingSession<T> session : toStop) {
            session.getScope().cancel();
            for (Subscription<T> subscription : session.clearSubscribers()) {
                subscription.close();
            }
        }

        Duration waitTimeout = settings.getFetchTimeout().plusSeconds(1);
        for (PollingSession<T> session : toStop) {
            try {
                if (!session.awaitFinished(waitTimeout)) {
                    log.warn("[{}] 轮询循环未在 {}ms 内退出: key={}", name, waitTimeout.toMillis(), session.getKey());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("[{}] 等待轮询循环退出时被中断", name);
                return;
            }
        }
        log.info("[{}] 多路复用器已停止，共关闭 {} 个会话", name, toStop.size());
    }

    /**
     * 注册采样监听器（例如写入历史存储），每个成功的数据点都会回调
     */
    public void addSampleListener(Consumer<T> listener) {
        if (listener != null) {
            sampleListeners.add(listener);
        }
    }

    public String getName() {
        return name;
    }

    public int getActiveSessionCount() {
        sessionsLock.lock();
        try {
            return sessions.size();
        } finally {
            sessionsLock.unlock();
        }
    }

    public int getTotalSubscriberCount() {
        sessionsLock.lock();
        try {
            int total = 0;
            for (PollingSession<T> session : sessions.values()) {
                total += session.getSubscriberCount();
            }
            return total;
        } finally {
            sessionsLock.unlock();
        }
    }

    public Set<String> getSessionKeys() {
        sessionsLock.lock();
        try {
            return Collections.unmodifiableSet(new TreeSet<>(sessions.keySet()));
        } finally {
            sessionsLock.unlock();
        }
    }

    /**
     * 各会话最近一次成功采集的时间（毫秒），尚未成功采集的会话为 0
     */
    public Map<String, Long> getLastFetchTimes() {
        sessionsLock.lock();
        try {
            Map<String, Long> result = new TreeMap<>();
            for (PollingSession<T> session : sessions.values()) {
                result.put(session.getKey(), session.getLastFetchAt());
            }
            return result;
        } finally {
            sessionsLock.unlock();
        }
    }

    /**
     * 会话的实际采集间隔，会话不存在时返回 null
     */
    public Duration getSessionInterval(String key) {
        sessionsLock.lock();
        try {
            PollingSession<T> session = sessions.get(key);
            return session != null ? session.getInterval() : null;
        } finally {
            sessionsLock.unlock();
        }
    }

    // 调用方持有 sessionsLock
    private PollingSession<T> startSession(String key, Duration interval) {
        PollingSession<T> session = new PollingSession<>(key, interval, rootScope.child(name + ":" + key));
        try {
            loopExecutor.execute(() -> runLoop(session));
        } catch (RejectedExecutionException e) {
            session.getScope().cancel();
            throw TelemetryException.stopped(name, key);
        }
        log.info("[{}] 会话已创建: key={}, interval={}ms", name, key, interval.toMillis());
        return session;
    }

    private void runLoop(PollingSession<T> session) {
        CancellationScope scope = session.getScope();
        long intervalNanos = session.getInterval().toNanos();
        long nextTick = System.nanoTime();
        try {
            while (!scope.isCancelled()) {
                try {
                    pollOnce(session);
                } catch (RuntimeException e) {
                    log.error("[{}] 本次采集处理异常，等待下一节拍: key={}", name, session.getKey(), e);
                }

                // 固定频率；单次采集超出间隔时跳过错过的节拍
                nextTick += intervalNanos;
                long now = System.nanoTime();
                while (nextTick <= now) {
                    nextTick += intervalNanos;
                }
                if (scope.await(Duration.ofNanos(nextTick - now))) {
                    break;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[{}] 轮询线程被中断: key={}", name, session.getKey());
        } finally {
            session.markFinished();
            log.debug("[{}] 轮询循环已退出: key={}", name, session.getKey());
        }
    }

    private void pollOnce(PollingSession<T> session) throws InterruptedException {
        String key = session.getKey();
        T point = fetch(session);
        if (point == null || session.getScope().isCancelled()) {
            return;
        }

        for (Subscription<T> subscription : session.snapshotSubscribers()) {
            if (!subscription.offer(point)) {
                log.trace("[{}] 订阅者队列已满，丢弃本次数据: key={}, subscription={}",
                        name, key, subscription.getId());
            }
        }

        for (Consumer<T> listener : sampleListeners) {
            try {
                listener.accept(point);
            } catch (RuntimeException e) {
                log.warn("[{}] 采样监听器处理失败: key={}, error={}", name, key, e.getMessage());
            }
        }

        TelemetryEvent event = source.toEvent(point);
        if (event != null && !eventPublisher.publish(event)) {
            log.debug("[{}] 事件未能入队: key={}, type={}", name, key, event.getType());
        }
    }

    /**
     * 执行一次带超时的采集；任何失败都返回 null，由下一个节拍重试
     */
    T fetch(PollingSession<T> session) throws InterruptedException {
        String key = session.getKey();
        DeviceCommand command;
        try {
            command = source.buildCommand(key);
        } catch (RuntimeException e) {
            log.warn("[{}] 构建采集命令失败: key={}, error={}", name, key, e.getMessage());
            return null;
        }

        CancellationScope fetchScope = session.getScope().child(key + "#fetch");
        ProbeResult result;
        try {
            CompletableFuture<ProbeResult> future =
                    CompletableFuture.supplyAsync(() -> probe.execute(command, fetchScope), probeExecutor);
            result = future.get(settings.getFetchTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.debug("[{}] 采集超时: key={}, timeout={}ms", name, key, settings.getFetchTimeout().toMillis());
            return null;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.debug("[{}] 采集失败: key={}, error={}", name, key, cause.getMessage());
            return null;
        } catch (RejectedExecutionException e) {
            log.warn("[{}] 采集任务被拒绝: key={}", name, key);
            return null;
        } finally {
            fetchScope.cancel();
        }

        if (result == null || !result.hasRecords()) {
            log.debug("[{}] 采集无有效数据: key={}, error={}", name, key, result != null ? result.getError() : null);
            return null;
        }

        long now = System.currentTimeMillis();
        T point;
        try {
            point = source.buildPoint(key, result.getRecords(), session.getPrevious(), now);
        } catch (RuntimeException e) {
            log.warn("[{}] 构建数据点失败: key={}, error={}", name, key, e.getMessage());
            return null;
        }
        if (point != null) {
            session.recordFetch(point, now);
        }
        return point;
    }
}
