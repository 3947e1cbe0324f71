package com.wangbin.telemetry.core.device;

import com.wangbin.telemetry.core.concurrent.CancellationScope;

/**
 * 设备命令执行能力（由宿主应用提供具体协议实现）
 * <p>
 * 调用可能很慢，也可能失败；调用方不得假设命令的副作用恰好执行一次，
 * 也不会盲目重试。实现应在作用域取消后尽快返回。
 */
public interface DeviceProbe {

    /**
     * 执行命令
     *
     * @param command 结构化命令
     * @param scope   本次调用的取消作用域
     * @return 执行结果；实现也可以直接抛出运行时异常表示失败
     */
    ProbeResult execute(DeviceCommand command, CancellationScope scope);
}
