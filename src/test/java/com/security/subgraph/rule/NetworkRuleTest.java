package com.security.subgraph.rule;

import com.security.subgraph.TelemetryFixtures;
import com.security.subgraph.exception.MappingException;
import com.security.subgraph.model.event.InboundNetworkEvent;
import com.security.subgraph.model.event.OutboundNetworkEvent;
import com.security.subgraph.model.graph.*;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 入站/出站连接构图测试
 */
public class NetworkRuleTest {

    private final InboundNetworkRule inboundRule = new InboundNetworkRule();
    private final OutboundNetworkRule outboundRule = new OutboundNetworkRule();

    @Test
    @DisplayName("入站-内网对端：两个入站半连接 + connection 边")
    public void testInboundInternal() throws Exception {
        GraphFragment fragment = inboundRule.apply(TelemetryFixtures.inbound("192.168.1.20"));

        assertEquals(3, fragment.getNodes().size());
        assertEquals(2, fragment.getEdges().size());
        assertTrue(fragment.hasEdge(EdgeLabel.CONNECTION));
        assertTrue(fragment.hasEdge(EdgeLabel.BOUND_CONNECTION));
        assertFalse(fragment.hasEdge(EdgeLabel.EXTERNAL_CONNECTION));
        assertTrue(TelemetryFixtures.nodesOfType(fragment, IpAddressNode.class).isEmpty());

        List<InboundConnectionNode> connections = TelemetryFixtures.nodesOfType(fragment, InboundConnectionNode.class);
        assertEquals(2, connections.size());
        InboundConnectionNode local = findByHost(connections, "10.50.86.136");
        InboundConnectionNode remote = findByHost(connections, "192.168.1.20");
        assertEquals(49712, local.getPort());
        assertEquals(49712, remote.getPort());
        assertEquals(NodeState.CREATED, remote.getState());

        ProcessNode process = TelemetryFixtures.nodesOfType(fragment, ProcessNode.class).get(0);
        assertEquals("10.50.86.136", process.getHostIp());
        assertEquals(NodeState.EXISTING, process.getState());

        assertTrue(fragment.getEdges().contains(
                new GraphEdge(EdgeLabel.CONNECTION, remote.getNodeKey(), local.getNodeKey())));
        assertTrue(fragment.getEdges().contains(
                new GraphEdge(EdgeLabel.BOUND_CONNECTION, process.getNodeKey(), local.getNodeKey())));
    }

    @Test
    @DisplayName("入站-外网对端：外部IP节点 + external_connection 边")
    public void testInboundExternal() throws Exception {
        GraphFragment fragment = inboundRule.apply(TelemetryFixtures.inbound("8.8.8.8"));

        assertEquals(3, fragment.getNodes().size());
        assertTrue(fragment.hasEdge(EdgeLabel.EXTERNAL_CONNECTION));
        assertFalse(fragment.hasEdge(EdgeLabel.CONNECTION));

        IpAddressNode ip = TelemetryFixtures.nodesOfType(fragment, IpAddressNode.class).get(0);
        InboundConnectionNode local = TelemetryFixtures.nodesOfType(fragment, InboundConnectionNode.class).get(0);
        assertEquals("8.8.8.8", ip.getIpAddress());
        assertEquals(TelemetryFixtures.UTC_TIME_MILLIS, ip.getLastSeenTimestamp());
        assertTrue(fragment.getEdges().contains(
                new GraphEdge(EdgeLabel.EXTERNAL_CONNECTION, local.getNodeKey(), ip.getNodeKey())));
    }

    @Test
    @DisplayName("出站-内网对端：出站连接指向对端入站连接(EXISTING)")
    public void testOutboundInternal() throws Exception {
        GraphFragment fragment = outboundRule.apply(TelemetryFixtures.outbound("10.50.86.46"));

        assertEquals(3, fragment.getNodes().size());
        assertEquals(2, fragment.getEdges().size());
        assertTrue(fragment.hasEdge(EdgeLabel.CONNECTION));
        assertTrue(fragment.hasEdge(EdgeLabel.CREATED_CONNECTION));
        assertFalse(fragment.hasEdge(EdgeLabel.EXTERNAL_CONNECTION));

        OutboundConnectionNode outbound = TelemetryFixtures.nodesOfType(fragment, OutboundConnectionNode.class).get(0);
        InboundConnectionNode inbound = TelemetryFixtures.nodesOfType(fragment, InboundConnectionNode.class).get(0);
        assertEquals("10.50.86.136", outbound.getHostIp());
        assertEquals(49712, outbound.getPort());
        assertEquals(NodeState.CREATED, outbound.getState());
        assertEquals("10.50.86.46", inbound.getHostIp());
        assertEquals(443, inbound.getPort());
        assertEquals(NodeState.EXISTING, inbound.getState());
        assertEquals(TelemetryFixtures.UTC_TIME_MILLIS, inbound.getLastSeenTimestamp());

        assertTrue(fragment.getEdges().contains(
                new GraphEdge(EdgeLabel.CONNECTION, outbound.getNodeKey(), inbound.getNodeKey())));
    }

    @Test
    @DisplayName("出站-外网对端：外部IP节点，不会同时出现两种分支")
    public void testOutboundExternal() throws Exception {
        GraphFragment fragment = outboundRule.apply(TelemetryFixtures.outbound("93.184.216.34"));

        assertEquals(3, fragment.getNodes().size());
        assertEquals(2, fragment.getEdges().size());
        assertTrue(fragment.hasEdge(EdgeLabel.EXTERNAL_CONNECTION));
        assertFalse(fragment.hasEdge(EdgeLabel.CONNECTION));
        assertTrue(TelemetryFixtures.nodesOfType(fragment, InboundConnectionNode.class).isEmpty());
        assertEquals(1, TelemetryFixtures.nodesOfType(fragment, IpAddressNode.class).size());
    }

    @Test
    @DisplayName("出站的对端入站连接与对端主机上观察到的入站连接 key 一致")
    public void testHalfConnectionsShareKey() throws Exception {
        OutboundNetworkEvent outbound = TelemetryFixtures.outbound("10.50.86.46");

        // 对端主机上的入站观察：source 为对端自身，端口为监听端口
        InboundNetworkEvent observedOnPeer = TelemetryFixtures.inbound("10.50.86.136");
        observedOnPeer.setSourceHostname("10.50.86.46");
        observedOnPeer.setSourcePort(443);

        InboundConnectionNode expected = TelemetryFixtures.nodesOfType(outboundRule.apply(outbound), InboundConnectionNode.class).get(0);
        List<InboundConnectionNode> peerNodes = TelemetryFixtures.nodesOfType(inboundRule.apply(observedOnPeer), InboundConnectionNode.class);

        assertTrue(peerNodes.stream().anyMatch(n -> n.getNodeKey().equals(expected.getNodeKey())));
    }

    @Test
    public void testIdempotent() throws Exception {
        OutboundNetworkEvent event = TelemetryFixtures.outbound("8.8.8.8");
        assertEquals(outboundRule.apply(event), outboundRule.apply(event));
    }

    @Test
    @DisplayName("缺少目的地址时映射失败")
    public void testMissingDestination() {
        OutboundNetworkEvent event = TelemetryFixtures.outbound(null);

        MappingException e = assertThrows(MappingException.class, () -> outboundRule.apply(event));
        assertEquals("ip_address", e.getField());
    }

    @Test
    public void testInvalidPort() {
        InboundNetworkEvent event = TelemetryFixtures.inbound("8.8.8.8");
        event.setSourcePort(70000);

        MappingException e = assertThrows(MappingException.class, () -> inboundRule.apply(event));
        assertEquals("port", e.getField());
    }

    private static InboundConnectionNode findByHost(List<InboundConnectionNode> nodes, String host) {
        for (InboundConnectionNode node : nodes) {
            if (host.equals(node.getHostIp())) {
                return node;
            }
        }
        fail("连接节点不存在: " + host);
        return null;
    }
}
