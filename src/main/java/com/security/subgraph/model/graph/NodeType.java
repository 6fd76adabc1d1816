package com.security.subgraph.model.graph;

/**
 * 子图节点类型枚举
 */
public enum NodeType {
    PROCESS,              // 进程节点
    FILE,                 // 文件节点
    IP_ADDRESS,           // 外部IP节点
    INBOUND_CONNECTION,   // 入站半连接
    OUTBOUND_CONNECTION   // 出站半连接
}
