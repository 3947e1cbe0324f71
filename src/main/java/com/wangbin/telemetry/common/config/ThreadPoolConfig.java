package com.wangbin.telemetry.common.config;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

@Configuration
public class ThreadPoolConfig {

    private final int cpuCores = Runtime.getRuntime().availableProcessors();

    private ThreadFactory buildNamedThreadFactory(String prefix, boolean daemon) {
        return new ThreadFactoryBuilder()
                .setNameFormat(prefix + "-%d")
                .setDaemon(daemon)
                .setPriority(Thread.NORM_PRIORITY)
                .build();
    }

    /**
     * 轮询会话线程池：每个会话独占一个线程，大部分时间在等待下一个节拍
     */
    @Bean(name = "pollingLoopExecutor", destroyMethod = "shutdownNow")
    public ThreadPoolExecutor pollingLoopExecutor() {
        return new ThreadPoolExecutor(
                0,
                Integer.MAX_VALUE,
                60L, TimeUnit.SECONDS,
                new SynchronousQueue<>(),
                buildNamedThreadFactory("polling-loop", true)
        );
    }

    /**
     * 设备命令线程池（IO密集型），单次调用受采集超时约束
     */
    @Bean(name = "probeExecutor", destroyMethod = "shutdownNow")
    public ThreadPoolExecutor probeExecutor(@Value("${telemetry.executor.probe-pool-size:0}") int poolSize) {
        int size = poolSize > 0 ? poolSize : cpuCores * 4;
        ThreadPoolExecutor executor = new ThreadPoolExecutor(
                size,
                size,
                30L, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(1000),
                buildNamedThreadFactory("device-probe", true)
        );
        executor.allowCoreThreadTimeOut(true);
        return executor;
    }

    /**
     * WAN健康检查线程池：每条链路一个循环
     */
    @Bean(name = "healthLoopExecutor", destroyMethod = "shutdownNow")
    public ThreadPoolExecutor healthLoopExecutor() {
        return new ThreadPoolExecutor(
                0,
                Integer.MAX_VALUE,
                60L, TimeUnit.SECONDS,
                new SynchronousQueue<>(),
                buildNamedThreadFactory("wan-health", true)
        );
    }
}
