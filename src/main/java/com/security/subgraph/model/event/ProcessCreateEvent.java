package com.security.subgraph.model.event;

import com.security.subgraph.exception.SubgraphException;
import lombok.Getter;
import lombok.Setter;

/**
 * 进程创建事件（Sysmon EventID 1）
 */
@Getter
@Setter
public class ProcessCreateEvent extends TelemetryEvent {
    private long processId;
    private long parentProcessId;
    private String image;

    // 可选字段
    private String processGuid;
    private String commandLine;
    private String parentImage;
    private String user;

    @Override
    public EventKind getKind() {
        return EventKind.PROCESS_CREATE;
    }

    @Override
    public <R> R accept(TelemetryEventVisitor<R> visitor) throws SubgraphException {
        return visitor.visitProcessCreate(this);
    }
}
