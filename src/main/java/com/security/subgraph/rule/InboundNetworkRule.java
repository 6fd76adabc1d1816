package com.security.subgraph.rule;

import com.security.subgraph.exception.InvalidTimestampException;
import com.security.subgraph.exception.MappingException;
import com.security.subgraph.model.event.EventKind;
import com.security.subgraph.model.event.InboundNetworkEvent;
import com.security.subgraph.model.graph.*;
import com.security.subgraph.util.EndpointClassifier;
import com.security.subgraph.util.TimeUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;

/**
 * 入站连接规则
 *
 * Sysmon 中入站连接的 source 一侧是本机：
 * 进程 --bound_connection--> 本地入站连接(source host, source port)
 * 对端为内网时：对端入站连接 --connection--> 本地入站连接
 * 对端为外网时：本地入站连接 --external_connection--> 外部IP
 */
@Slf4j
@Component
public class InboundNetworkRule implements GraphConstructionRule<InboundNetworkEvent> {

    @Override
    public GraphFragment apply(InboundNetworkEvent event) throws InvalidTimestampException, MappingException {
        long timestamp = TimeUtil.utcToEpochMillis(event.getGraphTimestamp());
        EventKind kind = EventKind.INBOUND_NETWORK;

        ProcessNode process = ProcessNode.builder(kind)
                .hostIp(event.getSourceHostname())
                .imageName(event.getImage())
                .state(NodeState.EXISTING)
                .pid(event.getProcessId())
                .lastSeenTimestamp(timestamp)
                .build();

        InboundConnectionNode inbound = InboundConnectionNode.builder(kind)
                .hostIp(event.getSourceHostname())
                .state(NodeState.CREATED)
                .port(event.getSourcePort())
                .createdTimestamp(timestamp)
                .build();

        GraphFragment.Builder fragment = GraphFragment.builder(kind, timestamp);
        String destination = event.getDestinationHostname();

        if (destination != null && EndpointClassifier.isInternal(destination.getBytes(StandardCharsets.UTF_8))) {
            // 对端连接使用本地 source port，与出站一侧的 destination port 对应
            InboundConnectionNode remote = InboundConnectionNode.builder(kind)
                    .hostIp(destination)
                    .state(NodeState.CREATED)
                    .port(event.getSourcePort())
                    .createdTimestamp(timestamp)
                    .build();

            fragment.addNode(remote)
                    .addEdge(EdgeLabel.CONNECTION, remote, inbound);
        } else {
            IpAddressNode externalIp = IpAddressNode.of(kind, destination, timestamp);

            fragment.addNode(externalIp)
                    .addEdge(EdgeLabel.EXTERNAL_CONNECTION, inbound, externalIp);
        }

        GraphFragment result = fragment
                .addNode(inbound)
                .addNode(process)
                .addEdge(EdgeLabel.BOUND_CONNECTION, process, inbound)
                .build();

        log.debug("【构图】-> 入站连接: {}:{} <- {}", event.getSourceHostname(), event.getSourcePort(), destination);
        return result;
    }
}
