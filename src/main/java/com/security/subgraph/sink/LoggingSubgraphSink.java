package com.security.subgraph.sink;

import com.security.subgraph.constants.SubgraphConstants;
import com.security.subgraph.model.graph.GeneratedSubgraphs;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * 只打印统计信息的输出，未配置输出类型时使用
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "subgraph.sink", name = "type",
        havingValue = SubgraphConstants.Sink.TYPE_LOG, matchIfMissing = true)
public class LoggingSubgraphSink implements SubgraphSink {

    @Override
    public void accept(GeneratedSubgraphs subgraphs) {
        log.info("【子图输出】-> 子图数: {}, 节点数: {}, 边数: {}",
                subgraphs.size(), subgraphs.getNodeCount(), subgraphs.getEdgeCount());
    }
}
