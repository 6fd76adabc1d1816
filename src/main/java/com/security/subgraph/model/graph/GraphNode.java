package com.security.subgraph.model.graph;

import com.security.subgraph.exception.MappingException;
import com.security.subgraph.model.event.EventKind;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * 子图节点基类
 *
 * nodeKey 由节点类型和实体标识字段确定性派生（见 NodeKeys），
 * 下游合并逻辑依赖它识别跨子图的同一实体。
 */
@Getter
@EqualsAndHashCode
@ToString
public abstract class GraphNode {

    private final String nodeKey;

    protected GraphNode(String nodeKey) {
        this.nodeKey = nodeKey;
    }

    public abstract NodeType getNodeType();

    protected static String requireText(EventKind eventKind, String field, String value)
            throws MappingException {
        if (value == null || value.trim().isEmpty()) {
            throw new MappingException(eventKind, field, "缺失或为空");
        }
        return value;
    }

    protected static <T> T requirePresent(EventKind eventKind, String field, T value)
            throws MappingException {
        if (value == null) {
            throw new MappingException(eventKind, field, "缺失");
        }
        return value;
    }

    /**
     * CREATED 状态必须带 createdTimestamp，EXISTING 状态必须带 lastSeenTimestamp
     */
    protected static void requireTimestampForState(EventKind eventKind, NodeState state,
                                                   Long createdTimestamp, Long lastSeenTimestamp)
            throws MappingException {
        if (state == NodeState.CREATED && createdTimestamp == null) {
            throw new MappingException(eventKind, "created_timestamp", "CREATED 状态缺少创建时间");
        }
        if (state == NodeState.EXISTING && lastSeenTimestamp == null) {
            throw new MappingException(eventKind, "last_seen_timestamp", "EXISTING 状态缺少最后观察时间");
        }
    }
}
