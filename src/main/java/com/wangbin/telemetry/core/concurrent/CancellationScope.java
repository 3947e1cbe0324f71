package com.wangbin.telemetry.core.concurrent;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * 协作式取消作用域
 * <p>
 * 每个后台轮询任务都持有一个作用域，并在定时等待时同时等待取消信号。
 * 子作用域随父作用域一起取消；取消只会发生一次，回调只执行一次。
 */
@Slf4j
public final class CancellationScope {

    private final String name;
    private final CountDownLatch cancelLatch = new CountDownLatch(1);

    // guarded by this
    private final List<Runnable> callbacks = new ArrayList<>();
    private boolean cancelled;

    private Registration parentRegistration;

    private CancellationScope(String name) {
        this.name = name;
    }

    /**
     * 创建根作用域
     */
    public static CancellationScope root(String name) {
        return new CancellationScope(name);
    }

    /**
     * 创建子作用域，父作用域取消时子作用域随之取消
     */
    public CancellationScope child(String childName) {
        CancellationScope child = new CancellationScope(childName);
        Registration registration = onCancel(child::cancel);
        synchronized (child) {
            child.parentRegistration = registration;
        }
        return child;
    }

    public String getName() {
        return name;
    }

    public boolean isCancelled() {
        return cancelLatch.getCount() == 0;
    }

    /**
     * 取消作用域并执行已注册的回调，重复调用无副作用
     */
    public void cancel() {
        List<Runnable> toRun;
        synchronized (this) {
            if (cancelled) {
                return;
            }
            cancelled = true;
            toRun = new ArrayList<>(callbacks);
            callbacks.clear();
        }
        cancelLatch.countDown();
        for (Runnable callback : toRun) {
            runCallback(callback);
        }
        detach();
    }

    /**
     * 注册取消回调；作用域已取消时回调立即在当前线程执行
     */
    public Registration onCancel(Runnable callback) {
        synchronized (this) {
            if (!cancelled) {
                callbacks.add(callback);
                return () -> {
                    synchronized (CancellationScope.this) {
                        callbacks.remove(callback);
                    }
                };
            }
        }
        runCallback(callback);
        return () -> { };
    }

    /**
     * 从父作用域解除关联（子作用域正常结束时调用，避免父作用域累积回调）
     */
    public void detach() {
        Registration registration;
        synchronized (this) {
            registration = parentRegistration;
            parentRegistration = null;
        }
        if (registration != null) {
            registration.remove();
        }
    }

    /**
     * 在给定时长内等待取消信号
     *
     * @return 等待期间作用域被取消返回 true，超时返回 false
     */
    public boolean await(Duration timeout) throws InterruptedException {
        return cancelLatch.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    private void runCallback(Runnable callback) {
        try {
            callback.run();
        } catch (RuntimeException e) {
            log.warn("取消回调执行失败: scope={}", name, e);
        }
    }

    @Override
    public String toString() {
        return "CancellationScope{" + name + (isCancelled() ? ", cancelled" : "") + "}";
    }

    /**
     * 回调注册句柄
     */
    @FunctionalInterface
    public interface Registration {
        void remove();
    }
}
