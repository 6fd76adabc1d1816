package com.security.subgraph.sink;

import com.security.subgraph.exception.SinkException;
import com.security.subgraph.model.graph.GeneratedSubgraphs;

/**
 * 子图批次输出
 *
 * 每次调用只交付一次完整批次（包括空批次）。失败直接抛出，不做重试。
 */
@FunctionalInterface
public interface SubgraphSink {

    void accept(GeneratedSubgraphs subgraphs) throws SinkException;
}
