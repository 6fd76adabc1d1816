package com.security.subgraph.model.graph;

import com.security.subgraph.exception.MappingException;
import com.security.subgraph.model.event.EventKind;
import com.security.subgraph.util.NodeKeys;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * 外部IP节点
 *
 * 外部端点不会有对端观察，因此不建连接节点，只建IP节点
 */
@Getter
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class IpAddressNode extends GraphNode {
    private final String ipAddress;
    private final long lastSeenTimestamp;

    private IpAddressNode(String nodeKey, String ipAddress, long lastSeenTimestamp) {
        super(nodeKey);
        this.ipAddress = ipAddress;
        this.lastSeenTimestamp = lastSeenTimestamp;
    }

    @Override
    public NodeType getNodeType() {
        return NodeType.IP_ADDRESS;
    }

    public static IpAddressNode of(EventKind eventKind, String ipAddress, long timestamp)
            throws MappingException {
        requireText(eventKind, "ip_address", ipAddress);
        return new IpAddressNode(NodeKeys.of(NodeType.IP_ADDRESS, ipAddress), ipAddress, timestamp);
    }
}
