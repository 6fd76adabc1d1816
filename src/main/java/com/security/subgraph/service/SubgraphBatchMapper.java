package com.security.subgraph.service;

import com.security.subgraph.config.SubgraphConfig;
import com.security.subgraph.constants.SubgraphConstants;
import com.security.subgraph.decoder.TelemetryEventDecoder;
import com.security.subgraph.exception.DecodeException;
import com.security.subgraph.exception.SubgraphException;
import com.security.subgraph.model.event.TelemetryEvent;
import com.security.subgraph.model.graph.GeneratedSubgraphs;
import com.security.subgraph.model.graph.GraphFragment;
import com.security.subgraph.rule.SubgraphRuleDispatcher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.util.StopWatch;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.ForkJoinTask;
import java.util.stream.Collectors;

/**
 * 批量映射器
 *
 * 职责：
 * 1. 按换行符拆分原始负载
 * 2. 并行地对每条记录解析 + 构图
 * 3. 单条记录失败只记录日志并丢弃，不影响其它记录
 * 4. 收集成功的子图片段为一个批次
 *
 * 注意：输出批次中的顺序与输入记录顺序无关
 */
@Slf4j
@Component
public class SubgraphBatchMapper implements DisposableBean {

    private final TelemetryEventDecoder decoder;
    private final SubgraphRuleDispatcher dispatcher;

    /**
     * 专用线程池，避免占用公共 ForkJoinPool
     */
    private final ForkJoinPool pool;

    @Autowired
    public SubgraphBatchMapper(TelemetryEventDecoder decoder,
                               SubgraphRuleDispatcher dispatcher,
                               SubgraphConfig config) {
        this(decoder, dispatcher, config.getParallelism());
    }

    public SubgraphBatchMapper(TelemetryEventDecoder decoder,
                               SubgraphRuleDispatcher dispatcher,
                               int parallelism) {
        this.decoder = decoder;
        this.dispatcher = dispatcher;
        this.pool = new ForkJoinPool(Math.max(1, parallelism));
    }

    /**
     * 将一个原始负载映射为子图批次
     *
     * @param payload 换行分隔的原始记录
     * @return 成功映射的子图批次，可能为空
     * @throws InterruptedException 映射过程被中断，此时不产生任何批次
     */
    public GeneratedSubgraphs map(byte[] payload) throws InterruptedException {
        StopWatch stopWatch = new StopWatch("subgraph-mapping");

        stopWatch.start("event split");
        List<byte[]> records = splitRecords(payload);
        stopWatch.stop();
        log.info("【子图生成】-> 拆分记录完成, 记录数: {}, 耗时: {}ms",
                records.size(), stopWatch.getLastTaskTimeMillis());

        stopWatch.start("events par_iter");
        ForkJoinTask<List<GraphFragment>> task = pool.submit(() -> records.parallelStream()
                .map(this::mapRecord)
                .filter(Optional::isPresent)
                .map(Optional::get)
                .collect(Collectors.toList()));
        List<GraphFragment> fragments;
        try {
            fragments = task.get();
        } catch (InterruptedException e) {
            task.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            // mapRecord 已经吸收了单条记录的异常，到这里说明是线程池本身的问题
            throw new IllegalStateException("并行映射失败", e.getCause());
        }
        stopWatch.stop();
        log.info("【子图生成】-> 并行映射完成, 成功: {}, 丢弃: {}, 耗时: {}ms",
                fragments.size(), records.size() - fragments.size(), stopWatch.getLastTaskTimeMillis());

        return new GeneratedSubgraphs(fragments);
    }

    /**
     * 按 '\n' 拆分，不裁剪其它空白。
     * 末尾的空记录保留（随后解析失败被丢弃），空负载视为一条空记录。
     */
    static List<byte[]> splitRecords(byte[] payload) {
        List<byte[]> records = new ArrayList<>();
        int start = 0;
        for (int i = 0; i < payload.length; i++) {
            if (payload[i] == SubgraphConstants.Batch.RECORD_SEPARATOR) {
                records.add(Arrays.copyOfRange(payload, start, i));
                start = i + 1;
            }
        }
        records.add(Arrays.copyOfRange(payload, start, payload.length));
        return records;
    }

    /**
     * 单条记录：UTF-8 有损解码 -> 解析 -> 构图
     *
     * @return 成功时为子图片段，失败时为空
     */
    Optional<GraphFragment> mapRecord(byte[] raw) {
        // 非法字节替换为 U+FFFD，不拒绝整条记录
        String record = new String(raw, StandardCharsets.UTF_8);

        TelemetryEvent event;
        try {
            event = decoder.decode(record);
        } catch (DecodeException e) {
            log.debug("【子图生成】-> 记录解析失败，跳过: {}, 记录: {}", e.getMessage(), preview(record));
            return Optional.empty();
        } catch (RuntimeException e) {
            log.error("【子图生成】-> 记录解析异常，跳过: {}", preview(record), e);
            return Optional.empty();
        }

        try {
            return Optional.of(dispatcher.dispatch(event));
        } catch (SubgraphException e) {
            log.warn("【子图生成】-> 处理 {} 事件失败: {}", event.getKind().getDescription(), e.getMessage());
            return Optional.empty();
        } catch (RuntimeException e) {
            log.error("【子图生成】-> 处理 {} 事件异常", event.getKind().getDescription(), e);
            return Optional.empty();
        }
    }

    private static String preview(String record) {
        int limit = SubgraphConstants.Batch.LOG_RECORD_PREVIEW_LENGTH;
        return record.length() <= limit ? record : record.substring(0, limit) + "...";
    }

    @Override
    public void destroy() {
        pool.shutdown();
    }
}
