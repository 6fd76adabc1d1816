package com.security.subgraph.model.event;

import com.security.subgraph.exception.SubgraphException;
import lombok.Getter;
import lombok.Setter;

/**
 * 遥测事件
 *
 * 只有四种子类：进程创建、文件创建、入站连接、出站连接。
 * 构造函数为包级可见，外部无法扩展新的事件类型。
 */
@Getter
@Setter
public abstract class TelemetryEvent {

    /**
     * 主机标识（Sysmon Computer 字段）
     */
    private String computer;

    /**
     * 事件发生时间（UTC，yyyy-MM-dd HH:mm:ss.SSS）
     */
    private String utcTime;

    TelemetryEvent() {
    }

    public abstract EventKind getKind();

    /**
     * 构图时使用的时间字段，默认为 utcTime
     */
    public String getGraphTimestamp() {
        return utcTime;
    }

    public abstract <R> R accept(TelemetryEventVisitor<R> visitor) throws SubgraphException;
}
