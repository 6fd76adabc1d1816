package com.security.subgraph.model.graph;

/**
 * 节点生命周期状态
 */
public enum NodeState {
    EXISTING,  // 推断存在，本次事件未直接观察到其创建
    CREATED    // 本次事件观察到其创建
}
