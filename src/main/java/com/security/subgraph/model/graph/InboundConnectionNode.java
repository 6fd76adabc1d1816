package com.security.subgraph.model.graph;

import com.security.subgraph.model.event.EventKind;

/**
 * 入站半连接节点
 */
public class InboundConnectionNode extends ConnectionNode {

    private InboundConnectionNode(String nodeKey, Builder<InboundConnectionNode> builder) {
        super(nodeKey, builder);
    }

    @Override
    public NodeType getNodeType() {
        return NodeType.INBOUND_CONNECTION;
    }

    public static Builder<InboundConnectionNode> builder(EventKind eventKind) {
        return new Builder<>(eventKind, NodeType.INBOUND_CONNECTION, InboundConnectionNode::new);
    }
}
