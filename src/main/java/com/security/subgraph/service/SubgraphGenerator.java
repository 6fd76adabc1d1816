package com.security.subgraph.service;

import com.security.subgraph.exception.SinkException;
import com.security.subgraph.model.graph.GeneratedSubgraphs;
import com.security.subgraph.sink.SubgraphSink;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * 子图生成服务
 *
 * 一次调用处理一个原始负载：批量映射后把完整批次交给 SubgraphSink，且只交一次。
 * 映射被中断时不交付任何批次。
 */
@Slf4j
@Service
public class SubgraphGenerator {

    private final SubgraphBatchMapper batchMapper;
    private final SubgraphSink sink;

    @Autowired
    public SubgraphGenerator(SubgraphBatchMapper batchMapper, SubgraphSink sink) {
        this.batchMapper = batchMapper;
        this.sink = sink;
    }

    /**
     * @param payload 换行分隔的原始记录，null 视为空负载
     * @return 已交付的批次
     * @throws SinkException 交付失败，整个调用失败
     * @throws InterruptedException 映射被中断
     */
    public GeneratedSubgraphs handleEvent(byte[] payload) throws SinkException, InterruptedException {
        byte[] raw = payload != null ? payload : new byte[0];
        log.info("【子图生成】-> 开始处理原始事件, 大小: {} 字节", raw.length);

        GeneratedSubgraphs subgraphs = batchMapper.map(raw);
        log.info("【子图生成】-> 映射完成, 子图数: {}", subgraphs.size());

        long startTime = System.currentTimeMillis();
        try {
            sink.accept(subgraphs);
        } catch (SinkException e) {
            log.error("【子图生成】-> 子图输出失败: {}", e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            log.error("【子图生成】-> 子图输出异常", e);
            throw new SinkException("子图输出异常: " + e.getMessage(), e);
        }
        log.info("【子图生成】-> 子图输出完成, 耗时: {}ms", System.currentTimeMillis() - startTime);

        return subgraphs;
    }
}
