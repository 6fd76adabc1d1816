package com.security.subgraph.rule;

import com.security.subgraph.exception.InvalidTimestampException;
import com.security.subgraph.exception.MappingException;
import com.security.subgraph.model.event.EventKind;
import com.security.subgraph.model.event.OutboundNetworkEvent;
import com.security.subgraph.model.graph.*;
import com.security.subgraph.util.EndpointClassifier;
import com.security.subgraph.util.TimeUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;

/**
 * 出站连接规则
 *
 * 进程 --created_connection--> 出站连接(source host, source port)
 * 对端为内网时，对端进程必然在 destination port 上监听：
 *   出站连接 --connection--> 对端入站连接(EXISTING)
 * 对端为外网或未部署采集时：出站连接 --external_connection--> 外部IP
 */
@Slf4j
@Component
public class OutboundNetworkRule implements GraphConstructionRule<OutboundNetworkEvent> {

    @Override
    public GraphFragment apply(OutboundNetworkEvent event) throws InvalidTimestampException, MappingException {
        long timestamp = TimeUtil.utcToEpochMillis(event.getGraphTimestamp());
        EventKind kind = EventKind.OUTBOUND_NETWORK;

        ProcessNode process = ProcessNode.builder(kind)
                .hostIp(event.getSourceHostname())
                .imageName(event.getImage())
                .state(NodeState.EXISTING)
                .pid(event.getProcessId())
                .lastSeenTimestamp(timestamp)
                .build();

        OutboundConnectionNode outbound = OutboundConnectionNode.builder(kind)
                .hostIp(event.getSourceHostname())
                .state(NodeState.CREATED)
                .port(event.getSourcePort())
                .createdTimestamp(timestamp)
                .build();

        GraphFragment.Builder fragment = GraphFragment.builder(kind, timestamp);
        String destination = event.getDestinationHostname();

        if (destination != null && EndpointClassifier.isInternal(destination.getBytes(StandardCharsets.UTF_8))) {
            InboundConnectionNode inbound = InboundConnectionNode.builder(kind)
                    .hostIp(destination)
                    .state(NodeState.EXISTING)
                    .port(event.getDestinationPort())
                    .lastSeenTimestamp(timestamp)
                    .build();

            fragment.addNode(inbound)
                    .addEdge(EdgeLabel.CONNECTION, outbound, inbound);
        } else {
            IpAddressNode externalIp = IpAddressNode.of(kind, destination, timestamp);

            fragment.addNode(externalIp)
                    .addEdge(EdgeLabel.EXTERNAL_CONNECTION, outbound, externalIp);
        }

        GraphFragment result = fragment
                .addNode(outbound)
                .addNode(process)
                .addEdge(EdgeLabel.CREATED_CONNECTION, process, outbound)
                .build();

        log.debug("【构图】-> 出站连接: {}:{} -> {}:{}", event.getSourceHostname(), event.getSourcePort(),
                destination, event.getDestinationPort());
        return result;
    }
}
