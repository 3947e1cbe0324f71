package com.wangbin.telemetry.core.device;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * 发往路由器的结构化命令，例如 {@code /interface print ?.id=*1}
 */
@Value
@Builder
public class DeviceCommand {

    public static final String ACTION_PRINT = "print";
    public static final String ACTION_ADD = "add";
    public static final String ACTION_REMOVE = "remove";

    String routerId;
    String path;
    String action;

    /**
     * 目标条目ID（remove/set 使用）
     */
    String id;

    /**
     * 命令参数（add/set 使用）
     */
    @Singular
    Map<String, String> args;

    /**
     * 过滤条件（print 使用），键值需全部相等
     */
    @Singular("where")
    Map<String, String> query;

    public static DeviceCommand print(String routerId, String path) {
        return DeviceCommand.builder().routerId(routerId).path(path).action(ACTION_PRINT).build();
    }

    public static DeviceCommand remove(String routerId, String path, String id) {
        return DeviceCommand.builder().routerId(routerId).path(path).action(ACTION_REMOVE).id(id).build();
    }

    @Override
    public String toString() {
        return routerId + " " + path + "/" + action
                + (id != null ? " .id=" + id : "")
                + (args.isEmpty() ? "" : " " + args)
                + (query.isEmpty() ? "" : " ?" + query);
    }
}
