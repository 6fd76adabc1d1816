package com.security.subgraph.model.event;

import com.security.subgraph.exception.SubgraphException;

/**
 * 出站网络连接
 */
public class OutboundNetworkEvent extends NetworkEvent {

    @Override
    public EventKind getKind() {
        return EventKind.OUTBOUND_NETWORK;
    }

    @Override
    public <R> R accept(TelemetryEventVisitor<R> visitor) throws SubgraphException {
        return visitor.visitOutboundNetwork(this);
    }
}
