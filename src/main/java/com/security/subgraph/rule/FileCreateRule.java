package com.security.subgraph.rule;

import com.security.subgraph.exception.InvalidTimestampException;
import com.security.subgraph.exception.MappingException;
import com.security.subgraph.model.event.EventKind;
import com.security.subgraph.model.event.FileCreateEvent;
import com.security.subgraph.model.graph.*;
import com.security.subgraph.util.TimeUtil;
import org.springframework.stereotype.Component;

/**
 * 文件创建规则
 *
 * 创建者进程(EXISTING) --created_files--> 文件(CREATED)
 */
@Component
public class FileCreateRule implements GraphConstructionRule<FileCreateEvent> {

    @Override
    public GraphFragment apply(FileCreateEvent event) throws InvalidTimestampException, MappingException {
        long timestamp = TimeUtil.utcToEpochMillis(event.getGraphTimestamp());
        EventKind kind = EventKind.FILE_CREATE;

        ProcessNode creator = ProcessNode.builder(kind)
                .assetId(event.getComputer())
                .imageName(event.getImage())
                .state(NodeState.EXISTING)
                .pid(event.getProcessId())
                .lastSeenTimestamp(timestamp)
                .build();

        FileNode file = FileNode.builder(kind)
                .assetId(event.getComputer())
                .state(NodeState.CREATED)
                .path(event.getTargetFilename())
                .createdTimestamp(timestamp)
                .build();

        return GraphFragment.builder(kind, timestamp)
                .addNode(creator)
                .addNode(file)
                .addEdge(EdgeLabel.CREATED_FILES, creator, file)
                .build();
    }
}
