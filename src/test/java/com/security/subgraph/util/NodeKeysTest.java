package com.security.subgraph.util;

import com.security.subgraph.model.graph.NodeType;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class NodeKeysTest {

    @Test
    public void testDeterministic() {
        assertEquals(NodeKeys.of(NodeType.PROCESS, "asset", "host-a", "100"),
                NodeKeys.of(NodeType.PROCESS, "asset", "host-a", "100"));
        assertEquals(32, NodeKeys.of(NodeType.FILE, "host-a", "C:\\a.txt").length());
    }

    @Test
    public void testDistinctComponentsGiveDistinctKeys() {
        assertNotEquals(NodeKeys.of(NodeType.PROCESS, "asset", "host-a", "100"),
                NodeKeys.of(NodeType.PROCESS, "asset", "host-a", "101"));
        assertNotEquals(NodeKeys.of(NodeType.INBOUND_CONNECTION, "10.0.0.1", "80"),
                NodeKeys.of(NodeType.OUTBOUND_CONNECTION, "10.0.0.1", "80"));
        // 分隔符出现在字段值中也不会产生相同的规范串
        assertNotEquals(NodeKeys.canonical(NodeType.FILE, "a|1:b", "c"),
                NodeKeys.canonical(NodeType.FILE, "a", "b|1:c"));
    }
}
