package com.security.subgraph.rule;

import com.security.subgraph.exception.InvalidTimestampException;
import com.security.subgraph.exception.MappingException;
import com.security.subgraph.model.event.EventKind;
import com.security.subgraph.model.event.ProcessCreateEvent;
import com.security.subgraph.model.graph.*;
import com.security.subgraph.util.TimeUtil;
import org.springframework.stereotype.Component;

/**
 * 进程创建规则
 *
 * 父进程(EXISTING) --children--> 子进程(CREATED) --bin_file--> 可执行文件(EXISTING)
 */
@Component
public class ProcessCreateRule implements GraphConstructionRule<ProcessCreateEvent> {

    @Override
    public GraphFragment apply(ProcessCreateEvent event) throws InvalidTimestampException, MappingException {
        long timestamp = TimeUtil.utcToEpochMillis(event.getGraphTimestamp());
        EventKind kind = EventKind.PROCESS_CREATE;

        ProcessNode parent = ProcessNode.builder(kind)
                .assetId(event.getComputer())
                .state(NodeState.EXISTING)
                .pid(event.getParentProcessId())
                .lastSeenTimestamp(timestamp)
                .build();

        ProcessNode child = ProcessNode.builder(kind)
                .assetId(event.getComputer())
                .imageName(event.getImage())
                .state(NodeState.CREATED)
                .pid(event.getProcessId())
                .createdTimestamp(timestamp)
                .build();

        FileNode childExe = FileNode.builder(kind)
                .assetId(event.getComputer())
                .state(NodeState.EXISTING)
                .lastSeenTimestamp(timestamp)
                .path(event.getImage())
                .build();

        // 子进程最后加入：pid 与父进程相同时保留 CREATED 的观察结果
        return GraphFragment.builder(kind, timestamp)
                .addNode(childExe)
                .addNode(parent)
                .addNode(child)
                .addEdge(EdgeLabel.BIN_FILE, child, childExe)
                .addEdge(EdgeLabel.CHILDREN, parent, child)
                .build();
    }
}
