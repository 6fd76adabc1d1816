package com.security.subgraph.model.graph;

import com.security.subgraph.exception.MappingException;
import com.security.subgraph.model.event.EventKind;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.*;

/**
 * 子图片段
 *
 * 由一条遥测事件经一条构图规则生成，构建后不可变。
 * 每条边的两端节点都必须在同一个片段中。
 */
@Getter
@EqualsAndHashCode
@ToString
public class GraphFragment {

    /**
     * 片段时间戳（epoch 毫秒），取自原始事件
     */
    private final long timestamp;

    /**
     * nodeKey -> 节点，按加入顺序
     */
    private final Map<String, GraphNode> nodes;

    private final Set<GraphEdge> edges;

    private GraphFragment(long timestamp, Map<String, GraphNode> nodes, Set<GraphEdge> edges) {
        this.timestamp = timestamp;
        this.nodes = Collections.unmodifiableMap(nodes);
        this.edges = Collections.unmodifiableSet(edges);
    }

    public GraphNode getNode(String nodeKey) {
        return nodes.get(nodeKey);
    }

    public boolean hasEdge(EdgeLabel label) {
        for (GraphEdge edge : edges) {
            if (edge.getLabel() == label) {
                return true;
            }
        }
        return false;
    }

    public static Builder builder(EventKind eventKind, long timestamp) {
        return new Builder(eventKind, timestamp);
    }

    /**
     * 片段构建器
     *
     * 节点和边先在构建器中暂存，build() 校验通过后一次性生成片段
     */
    public static final class Builder {
        private final EventKind eventKind;
        private final long timestamp;
        private final Map<String, GraphNode> nodes = new LinkedHashMap<>();
        private final Set<GraphEdge> edges = new LinkedHashSet<>();

        private Builder(EventKind eventKind, long timestamp) {
            this.eventKind = eventKind;
            this.timestamp = timestamp;
        }

        /**
         * 相同 nodeKey 的节点后加入的覆盖先加入的
         */
        public Builder addNode(GraphNode node) {
            nodes.put(node.getNodeKey(), node);
            return this;
        }

        public Builder addEdge(EdgeLabel label, GraphNode from, GraphNode to) {
            edges.add(new GraphEdge(label, from.getNodeKey(), to.getNodeKey()));
            return this;
        }

        public GraphFragment build() throws MappingException {
            for (GraphEdge edge : edges) {
                if (!nodes.containsKey(edge.getFromKey())) {
                    throw new MappingException(eventKind, edge.getLabel().getLabel(),
                            "边的起点不在片段中: " + edge.getFromKey());
                }
                if (!nodes.containsKey(edge.getToKey())) {
                    throw new MappingException(eventKind, edge.getLabel().getLabel(),
                            "边的终点不在片段中: " + edge.getToKey());
                }
            }
            return new GraphFragment(timestamp, new LinkedHashMap<>(nodes), new LinkedHashSet<>(edges));
        }
    }
}
