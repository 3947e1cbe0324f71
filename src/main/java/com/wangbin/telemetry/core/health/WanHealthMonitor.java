package com.wangbin.telemetry.core.health;

import com.wangbin.telemetry.common.exception.TelemetryException;
import com.wangbin.telemetry.core.concurrent.CancellationScope;
import com.wangbin.telemetry.core.device.DeviceCommand;
import com.wangbin.telemetry.core.device.DeviceProbe;
import com.wangbin.telemetry.core.device.ProbeResult;
import com.wangbin.telemetry.core.event.AsyncEventPublisher;
import com.wangbin.telemetry.core.event.WanHealthChangedEvent;
import com.wangbin.telemetry.core.stats.ResourceKey;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * WAN链路健康监控
 * <p>
 * 每条链路在设备上配置一组带标签的可达性探针，并由一个本地循环定期读取探针状态、
 * 聚合为健康结论。结论只在发生变化时发布事件。
 * <p>
 * 配置状态与结论状态各用一把锁：重新配置期间（包括设备命令）读取结论不会被阻塞。
 */
@Slf4j
public class WanHealthMonitor {

    public static final String TAG_PREFIX = "wan-health:";

    private final DeviceProbe probe;
    private final AsyncEventPublisher eventPublisher;
    private final Executor loopExecutor;
    private final Executor probeExecutor;
    private final Duration commandTimeout;
    private final HealthDefaults defaults;

    private final CancellationScope rootScope = CancellationScope.root("wan-health");

    // 配置状态
    private final ReentrantLock configLock = new ReentrantLock();
    private final Map<String, LinkMonitor> links = new HashMap<>();
    private boolean shutdown;

    // 结论状态
    private final ReentrantReadWriteLock verdictLock = new ReentrantReadWriteLock();
    private final Map<String, HealthVerdict> verdicts = new HashMap<>();

    public WanHealthMonitor(DeviceProbe probe,
                            AsyncEventPublisher eventPublisher,
                            Executor loopExecutor,
                            Executor probeExecutor,
                            Duration commandTimeout,
                            HealthDefaults defaults) {
        if (probe == null) {
            throw new IllegalArgumentException("DeviceProbe 未配置");
        }
        if (eventPublisher == null) {
            throw new IllegalArgumentException("事件发布器未配置");
        }
        this.probe = probe;
        this.eventPublisher = eventPublisher;
        this.loopExecutor = Objects.requireNonNull(loopExecutor, "loopExecutor");
        this.probeExecutor = Objects.requireNonNull(probeExecutor, "probeExecutor");
        this.commandTimeout = Objects.requireNonNull(commandTimeout, "commandTimeout");
        this.defaults = defaults != null ? defaults : HealthDefaults.STANDARD;
    }

    /**
     * 设备侧探针使用的标签
     */
    public static String tagOf(String linkKey) {
        return TAG_PREFIX + linkKey;
    }

    public void configureHealthCheck(String routerId, String wanId, HealthCheckConfig config) {
        configureHealthCheck(ResourceKey.of(routerId, wanId).asKey(), config);
    }

    /**
     * 配置链路健康检查
     * <p>
     * 启用且目标非空时：停止旧循环，删除该链路所有旧探针，再逐个添加新探针并启动循环。
     * 禁用或目标为空时：停止循环，尽力清理设备侧探针，结论置为 UNKNOWN。
     *
     * @param linkKey 链路键 {@code routerId:wanId}
     * @throws TelemetryException 配置非法或设备命令失败
     */
    public void configureHealthCheck(String linkKey, HealthCheckConfig config) {
        ResourceKey key = ResourceKey.parse(linkKey);
        if (config == null) {
            throw TelemetryException.configException(linkKey, "健康检查配置不能为空");
        }
        HealthCheckConfig effective = config.withDefaults(
                defaults.getIntervalSec(), defaults.getTimeoutSec(), defaults.getFailureThreshold());
        if (effective.isEnabled()) {
            validate(linkKey, effective);
        }

        configLock.lock();
        try {
            if (shutdown) {
                throw TelemetryException.stopped("wan-health-monitor", linkKey);
            }
            stopLinkLocked(linkKey);

            String tag = tagOf(linkKey);
            if (!effective.isEnabled() || effective.getTargets().isEmpty()) {
                try {
                    removeProbes(key.getRouterId(), linkKey, tag);
                } catch (TelemetryException e) {
                    log.warn("清理设备侧探针失败: link={}, error={}", linkKey, e.getMessage());
                }
                setVerdictWithoutEvent(linkKey, HealthVerdict.UNKNOWN);
                log.info("链路健康检查已关闭: link={}", linkKey);
                return;
            }

            // 先删后加：设备侧可能残留超时未确认的探针
            removeProbes(key.getRouterId(), linkKey, tag);
            for (String target : effective.getTargets()) {
                ProbeResult result = execute(NetwatchCommands.add(key.getRouterId(), target.trim(), effective, tag), linkKey);
                if (!result.isSuccess()) {
                    throw TelemetryException.probeFailure(linkKey, "添加探针失败: " + target + ", " + result.getError(), null);
                }
            }

            LinkMonitor link = new LinkMonitor(key, tag, effective, rootScope.child(tag));
            try {
                loopExecutor.execute(() -> runLoop(link));
            } catch (RejectedExecutionException e) {
                link.scope.cancel();
                throw TelemetryException.stopped("wan-health-monitor", linkKey);
            }
            links.put(linkKey, link);
            log.info("链路健康检查已启动: link={}, targets={}, interval={}s",
                    linkKey, effective.getTargets(), effective.getIntervalSec());
        } finally {
            configLock.unlock();
        }
    }

    /**
     * 读取当前结论，未配置的链路为 UNKNOWN
     */
    public HealthVerdict getHealthStatus(String linkKey) {
        verdictLock.readLock().lock();
        try {
            return verdicts.getOrDefault(linkKey, HealthVerdict.UNKNOWN);
        } finally {
            verdictLock.readLock().unlock();
        }
    }

    /**
     * 停止链路的本地循环（不清理设备侧探针），重复调用无副作用
     */
    public void stopMonitoring(String linkKey) {
        configLock.lock();
        try {
            if (stopLinkLocked(linkKey)) {
                setVerdictWithoutEvent(linkKey, HealthVerdict.UNKNOWN);
                log.info("链路健康检查已停止: link={}", linkKey);
            }
        } finally {
            configLock.unlock();
        }
    }

    /**
     * 停止所有链路循环并等待其退出，重复调用无副作用
     */
    public void shutdown() {
        List<LinkMonitor> toStop;
        configLock.lock();
        try {
            if (shutdown) {
                return;
            }
            shutdown = true;
            toStop = new ArrayList<>(links.values());
            links.clear();
        } finally {
            configLock.unlock();
        }

        rootScope.cancel();
        for (LinkMonitor link : toStop) {
            if (!awaitStopped(link)) {
                break;
            }
        }
        log.info("WAN健康监控已关闭，共停止 {} 条链路", toStop.size());
    }

    public boolean isMonitoring(String linkKey) {
        configLock.lock();
        try {
            return links.containsKey(linkKey);
        } finally {
            configLock.unlock();
        }
    }

    public Set<String> getMonitoredLinks() {
        configLock.lock();
        try {
            return Collections.unmodifiableSet(new TreeSet<>(links.keySet()));
        } finally {
            configLock.unlock();
        }
    }

    /**
     * 执行一次健康检查并更新结论；探针状态读取失败时返回 null，保留原结论
     */
    HealthVerdict checkHealth(LinkMonitor link) {
        String linkKey = link.key.asKey();
        ProbeResult result;
        try {
            result = execute(NetwatchCommands.list(link.key.getRouterId(), link.tag), linkKey);
        } catch (TelemetryException e) {
            log.debug("健康检查失败，跳过本次: link={}, error={}", linkKey, e.getMessage());
            return null;
        }
        if (result == null || !result.isSuccess()) {
            log.debug("健康检查失败，跳过本次: link={}, error={}", linkKey, result != null ? result.getError() : null);
            return null;
        }

        int total = 0;
        int reachable = 0;
        for (Map<String, String> record : result.getRecords()) {
            // 设备端过滤不可靠时再按标签确认一次
            String comment = record.get(NetwatchCommands.FIELD_COMMENT);
            if (comment != null && !link.tag.equals(comment)) {
                continue;
            }
            total++;
            if (NetwatchCommands.isUp(record)) {
                reachable++;
            }
        }

        HealthVerdict verdict = HealthVerdict.aggregate(reachable, total);
        if (link.scope.isCancelled()) {
            return verdict;
        }
        updateVerdict(linkKey, verdict, reachable, total, link.config.getTargets());
        return verdict;
    }

    private void updateVerdict(String linkKey, HealthVerdict verdict, int reachable, int total, List<String> targets) {
        HealthVerdict previous;
        verdictLock.writeLock().lock();
        try {
            previous = verdicts.put(linkKey, verdict);
        } finally {
            verdictLock.writeLock().unlock();
        }
        if (previous == null) {
            previous = HealthVerdict.UNKNOWN;
        }
        if (previous == verdict) {
            return;
        }

        log.info("链路健康状态变化: link={}, {} -> {}, reachable={}/{}", linkKey, previous, verdict, reachable, total);
        WanHealthChangedEvent event = new WanHealthChangedEvent(linkKey, verdict, previous, reachable, total, targets);
        if (!eventPublisher.publish(event)) {
            log.warn("健康状态变化事件未能入队: link={}", linkKey);
        }
    }

    private void setVerdictWithoutEvent(String linkKey, HealthVerdict verdict) {
        verdictLock.writeLock().lock();
        try {
            verdicts.put(linkKey, verdict);
        } finally {
            verdictLock.writeLock().unlock();
        }
    }

    private void runLoop(LinkMonitor link) {
        Duration interval = Duration.ofSeconds(link.config.getIntervalSec());
        try {
            while (!link.scope.isCancelled()) {
                try {
                    checkHealth(link);
                } catch (RuntimeException e) {
                    log.error("健康检查处理异常，等待下一周期: link={}", link.key, e);
                }
                if (link.scope.await(interval)) {
                    break;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("健康检查线程被中断: link={}", link.key);
        } finally {
            link.finished.countDown();
        }
    }

    // 调用方持有 configLock
    private boolean stopLinkLocked(String linkKey) {
        LinkMonitor link = links.remove(linkKey);
        if (link == null) {
            return false;
        }
        link.scope.cancel();
        awaitStopped(link);
        return true;
    }

    private boolean awaitStopped(LinkMonitor link) {
        Duration timeout = commandTimeout.plusSeconds(1);
        try {
            if (!link.finished.await(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("健康检查循环未在 {}ms 内退出: link={}", timeout.toMillis(), link.key);
            }
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("等待健康检查循环退出时被中断: link={}", link.key);
            return false;
        }
    }

    private void removeProbes(String routerId, String linkKey, String tag) {
        ProbeResult existing = execute(NetwatchCommands.list(routerId, tag), linkKey);
        if (!existing.isSuccess()) {
            throw TelemetryException.probeFailure(linkKey, "查询已有探针失败: " + existing.getError(), null);
        }
        for (Map<String, String> record : existing.getRecords()) {
            String probeId = record.get(NetwatchCommands.FIELD_ID);
            if (probeId == null) {
                continue;
            }
            ProbeResult removed = execute(NetwatchCommands.remove(routerId, probeId), linkKey);
            if (!removed.isSuccess()) {
                throw TelemetryException.probeFailure(linkKey, "删除探针失败: " + probeId + ", " + removed.getError(), null);
            }
            log.debug("已删除旧探针: link={}, id={}", linkKey, probeId);
        }
    }

    private ProbeResult execute(DeviceCommand command, String linkKey) {
        CancellationScope commandScope = rootScope.child(linkKey + "#command");
        try {
            ProbeResult result = CompletableFuture
                    .supplyAsync(() -> probe.execute(command, commandScope), probeExecutor)
                    .get(commandTimeout.toMillis(), TimeUnit.MILLISECONDS);
            return result != null ? result : ProbeResult.failed("empty response");
        } catch (TimeoutException e) {
            throw TelemetryException.probeFailure(linkKey, "设备命令超时: " + command, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw TelemetryException.probeFailure(linkKey, "设备命令失败: " + cause.getMessage(), cause);
        } catch (RejectedExecutionException e) {
            throw TelemetryException.probeFailure(linkKey, "设备命令被拒绝: " + command, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw TelemetryException.probeFailure(linkKey, "设备命令被中断: " + command, e);
        } finally {
            commandScope.cancel();
        }
    }

    private static void validate(String linkKey, HealthCheckConfig config) {
        if (config.getTargets() == null) {
            throw TelemetryException.configException(linkKey, "缺少探测目标列表");
        }
        for (String target : config.getTargets()) {
            if (target == null || target.isBlank()) {
                throw TelemetryException.configException(linkKey, "探测目标不能为空");
            }
        }
        if (config.getIntervalSec() <= 0) {
            throw TelemetryException.configException(linkKey, "探测间隔必须为正: " + config.getIntervalSec());
        }
        if (config.getTimeoutSec() <= 0) {
            throw TelemetryException.configException(linkKey, "探测超时必须为正: " + config.getTimeoutSec());
        }
        if (config.getFailureThreshold() <= 0) {
            throw TelemetryException.configException(linkKey, "失败阈值必须为正: " + config.getFailureThreshold());
        }
    }

    /**
     * 单条链路的运行状态
     */
    static final class LinkMonitor {

        final ResourceKey key;
        final String tag;
        final HealthCheckConfig config;
        final CancellationScope scope;
        final CountDownLatch finished = new CountDownLatch(1);

        LinkMonitor(ResourceKey key, String tag, HealthCheckConfig config, CancellationScope scope) {
            this.key = key;
            this.tag = tag;
            this.config = config;
            this.scope = scope;
        }
    }
}
