package com.security.subgraph.model.graph;

import com.security.subgraph.model.event.EventKind;

/**
 * 出站半连接节点
 */
public class OutboundConnectionNode extends ConnectionNode {

    private OutboundConnectionNode(String nodeKey, Builder<OutboundConnectionNode> builder) {
        super(nodeKey, builder);
    }

    @Override
    public NodeType getNodeType() {
        return NodeType.OUTBOUND_CONNECTION;
    }

    public static Builder<OutboundConnectionNode> builder(EventKind eventKind) {
        return new Builder<>(eventKind, NodeType.OUTBOUND_CONNECTION, OutboundConnectionNode::new);
    }
}
