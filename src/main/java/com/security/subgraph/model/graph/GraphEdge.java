package com.security.subgraph.model.graph;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * 子图中的有向边
 */
@Getter
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public class GraphEdge {
    private final EdgeLabel label;
    private final String fromKey;
    private final String toKey;
}
