package com.security.subgraph.model.graph;

import com.security.subgraph.exception.MappingException;
import com.security.subgraph.model.event.EventKind;
import com.security.subgraph.util.NodeKeys;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * 文件节点，以（assetId, path）识别
 */
@Getter
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class FileNode extends GraphNode {
    private final String assetId;
    private final String path;
    private final NodeState state;
    private final Long createdTimestamp;
    private final Long lastSeenTimestamp;

    private FileNode(Builder builder, String nodeKey) {
        super(nodeKey);
        this.assetId = builder.assetId;
        this.path = builder.path;
        this.state = builder.state;
        this.createdTimestamp = builder.createdTimestamp;
        this.lastSeenTimestamp = builder.lastSeenTimestamp;
    }

    @Override
    public NodeType getNodeType() {
        return NodeType.FILE;
    }

    public static Builder builder(EventKind eventKind) {
        return new Builder(eventKind);
    }

    public static final class Builder {
        private final EventKind eventKind;
        private String assetId;
        private String path;
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

        public Builder path(String path) {
            this.path = path;
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

        public FileNode build() throws MappingException {
            requireText(eventKind, "asset_id", assetId);
            requireText(eventKind, "path", path);
            if (path.indexOf('\uFFFD') >= 0) {
                // UTF-8 有损解码产生的替换字符，路径已损坏
                throw new MappingException(eventKind, "path", "包含无法解码的字节");
            }
            requirePresent(eventKind, "state", state);
            requireTimestampForState(eventKind, state, createdTimestamp, lastSeenTimestamp);
            return new FileNode(this, NodeKeys.of(NodeType.FILE, assetId, path));
        }
    }
}
