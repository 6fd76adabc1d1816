package com.security.subgraph.model.event;

import com.security.subgraph.exception.SubgraphException;

/**
 * 入站网络连接
 */
public class InboundNetworkEvent extends NetworkEvent {

    @Override
    public EventKind getKind() {
        return EventKind.INBOUND_NETWORK;
    }

    @Override
    public <R> R accept(TelemetryEventVisitor<R> visitor) throws SubgraphException {
        return visitor.visitInboundNetwork(this);
    }
}
