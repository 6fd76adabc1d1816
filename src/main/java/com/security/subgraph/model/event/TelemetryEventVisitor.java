package com.security.subgraph.model.event;

import com.security.subgraph.exception.SubgraphException;

/**
 * 遥测事件访问者
 *
 * 每种事件类型对应一个方法，新增事件类型时必须同时实现对应的处理逻辑
 *
 * @param <R> 处理结果类型
 */
public interface TelemetryEventVisitor<R> {

    R visitProcessCreate(ProcessCreateEvent event) throws SubgraphException;

    R visitFileCreate(FileCreateEvent event) throws SubgraphException;

    R visitInboundNetwork(InboundNetworkEvent event) throws SubgraphException;

    R visitOutboundNetwork(OutboundNetworkEvent event) throws SubgraphException;
}
