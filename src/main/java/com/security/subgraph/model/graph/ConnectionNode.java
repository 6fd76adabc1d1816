package com.security.subgraph.model.graph;

import com.security.subgraph.exception.MappingException;
import com.security.subgraph.model.event.EventKind;
import com.security.subgraph.util.NodeKeys;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * 半连接节点基类，以（hostIp, port）识别
 *
 * 入站和出站两侧分别在各自主机上观察到，下游按 key 把两侧拼成一条连接
 */
@Getter
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public abstract class ConnectionNode extends GraphNode {
    private final String hostIp;
    private final int port;
    private final NodeState state;
    private final Long createdTimestamp;
    private final Long lastSeenTimestamp;

    protected ConnectionNode(String nodeKey, Builder<?> builder) {
        super(nodeKey);
        this.hostIp = builder.hostIp;
        this.port = builder.port;
        this.state = builder.state;
        this.createdTimestamp = builder.createdTimestamp;
        this.lastSeenTimestamp = builder.lastSeenTimestamp;
    }

    interface Factory<T extends ConnectionNode> {
        T create(String nodeKey, Builder<T> builder);
    }

    public static final class Builder<T extends ConnectionNode> {
        private final EventKind eventKind;
        private final NodeType nodeType;
        private final Factory<T> factory;
        private String hostIp;
        private Integer port;
        private NodeState state;
        private Long createdTimestamp;
        private Long lastSeenTimestamp;

        Builder(EventKind eventKind, NodeType nodeType, Factory<T> factory) {
            this.eventKind = eventKind;
            this.nodeType = nodeType;
            this.factory = factory;
        }

        public Builder<T> hostIp(String hostIp) {
            this.hostIp = hostIp;
            return this;
        }

        public Builder<T> port(int port) {
            this.port = port;
            return this;
        }

        public Builder<T> state(NodeState state) {
            this.state = state;
            return this;
        }

        public Builder<T> createdTimestamp(long createdTimestamp) {
            this.createdTimestamp = createdTimestamp;
            return this;
        }

        public Builder<T> lastSeenTimestamp(long lastSeenTimestamp) {
            this.lastSeenTimestamp = lastSeenTimestamp;
            return this;
        }

        public T build() throws MappingException {
            requireText(eventKind, "host_ip", hostIp);
            requirePresent(eventKind, "port", port);
            if (port < 0 || port > 65535) {
                throw new MappingException(eventKind, "port", "超出范围: " + port);
            }
            requirePresent(eventKind, "state", state);
            requireTimestampForState(eventKind, state, createdTimestamp, lastSeenTimestamp);
            return factory.create(NodeKeys.of(nodeType, hostIp, String.valueOf(port)), this);
        }
    }
}
