package com.security.subgraph.model.graph;

import com.security.subgraph.exception.MappingException;
import com.security.subgraph.model.event.EventKind;
import com.security.subgraph.util.NodeKeys;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * 进程节点
 *
 * 进程以（主机标识, pid）识别。主机标识优先使用 assetId，
 * 网络事件中只有主机IP时使用 hostIp。
 */
@Getter
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class ProcessNode extends GraphNode {
    private final String assetId;
    private final String hostIp;
    private final long pid;
    private final String imageName;
    private final NodeState state;
    private final Long createdTimestamp;
    private final Long lastSeenTimestamp;

    private ProcessNode(Builder builder, String nodeKey) {
        super(nodeKey);
        this.assetId = builder.assetId;
        this.hostIp = builder.hostIp;
        this.pid = builder.pid;
        this.imageName = builder.imageName;
        this.state = builder.state;
        this.createdTimestamp = builder.createdTimestamp;
        this.lastSeenTimestamp = builder.lastSeenTimestamp;
    }

    @Override
    public NodeType getNodeType() {
        return NodeType.PROCESS;
    }

    public static Builder builder(EventKind eventKind) {
        return new Builder(eventKind);
    }

    public static final class Builder {
        private final EventKind eventKind;
        private String assetId;
        private String hostIp;
        private Long pid;
        private String imageName;
        private NodeState state;
        private Long createdTimestamp;
        private Long lastSeenTimestamp;

        private Builder(EventKind eventKind) {
            this.eventKind = eventKind;
        }

        public Builder assetId(String assetId) {
            this.assetId = assetId;
            return this;
        }

        public Builder hostIp(String hostIp) {
            this.hostIp = hostIp;
            return this;
        }

        public Builder pid(long pid) {
            this.pid = pid;
            return this;
        }

        public Builder imageName(String imageName) {
            this.imageName = imageName;
            return this;
        }

        public Builder state(NodeState state) {
            this.state = state;
            return this;
        }

        public Builder createdTimestamp(long createdTimestamp) {
            this.createdTimestamp = createdTimestamp;
            return this;
        }

        public Builder lastSeenTimestamp(long lastSeenTimestamp) {
            this.lastSeenTimestamp = lastSeenTimestamp;
            return this;
        }

        public ProcessNode build() throws MappingException {
            requirePresent(eventKind, "pid", pid);
            if (pid < 0) {
                throw new MappingException(eventKind, "pid", "不能为负数: " + pid);
            }
            requirePresent(eventKind, "state", state);
            requireTimestampForState(eventKind, state, createdTimestamp, lastSeenTimestamp);

            String nodeKey;
            if (assetId != null && !assetId.trim().isEmpty()) {
                nodeKey = NodeKeys.of(NodeType.PROCESS, "asset", assetId, String.valueOf(pid));
            } else {
                requireText(eventKind, "asset_id/host_ip", hostIp);
                nodeKey = NodeKeys.of(NodeType.PROCESS, "host", hostIp, String.valueOf(pid));
            }
            return new ProcessNode(this, nodeKey);
        }
    }
}
