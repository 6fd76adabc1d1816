package com.security.subgraph.model.event;

import com.security.subgraph.exception.SubgraphException;
import lombok.Getter;
import lombok.Setter;

/**
 * 文件创建事件（Sysmon EventID 11）
 */
@Getter
@Setter
public class FileCreateEvent extends TelemetryEvent {
    private long processId;
    private String image;
    private String targetFilename;

    /**
     * 文件创建时间，构图使用该字段而不是 utcTime
     */
    private String creationUtcTime;

    @Override
    public EventKind getKind() {
        return EventKind.FILE_CREATE;
    }

    @Override
    public String getGraphTimestamp() {
        return creationUtcTime;
    }

    @Override
    public <R> R accept(TelemetryEventVisitor<R> visitor) throws SubgraphException {
        return visitor.visitFileCreate(this);
    }
}
