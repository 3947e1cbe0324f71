package com.wangbin.telemetry.common.web.result;

/**
 * 响应码枚举
 */
public enum ResultCode {

    // 成功
    SUCCESS(200, "成功"),

    // 客户端错误
    BAD_REQUEST(400, "请求参数错误"),
    NOT_FOUND(404, "资源不存在"),

    // 业务错误
    PARAM_ERROR(1000, "参数错误"),
    INVALID_INTERVAL(1006, "时间间隔无效"),
    INVALID_TIME_RANGE(1007, "时间范围无效"),

    // 设备探测相关错误
    PROBE_FAILED(2007, "设备探测失败"),

    // 配置相关错误
    CONFIG_INVALID(3002, "配置无效"),

    // 系统错误
    SYSTEM_ERROR(5000, "系统内部错误"),
    SERVICE_UNAVAILABLE(5001, "服务不可用"),
    STORAGE_ERROR(5003, "存储错误"),

    // 其他错误
    UNKNOWN_ERROR(9999, "未知错误");

    private final int code;
    private final String message;

    ResultCode(int code, String message) {
        this.code = code;
        this.message = message;
    }

    public int getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }

    /**
     * 根据code获取枚举
     */
    public static ResultCode fromCode(int code) {
        for (ResultCode resultCode : values()) {
            if (resultCode.getCode() == code) {
                return resultCode;
            }
        }
        return UNKNOWN_ERROR;
    }

    public boolean isClientError() {
        return (code >= 400 && code < 500) || (code >= 1000 && code < 2000) || (code >= 3000 && code < 4000);
    }
}
