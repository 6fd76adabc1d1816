package com.security.subgraph.rule;

import com.security.subgraph.exception.InvalidTimestampException;
import com.security.subgraph.exception.MappingException;
import com.security.subgraph.model.event.TelemetryEvent;
import com.security.subgraph.model.graph.GraphFragment;

/**
 * 构图规则：一条事件生成一个独立的子图片段
 *
 * 实现必须是纯函数，同一事件多次调用得到结构相同的片段
 *
 * @param <E> 事件类型
 */
public interface GraphConstructionRule<E extends TelemetryEvent> {

    GraphFragment apply(E event) throws InvalidTimestampException, MappingException;
}
