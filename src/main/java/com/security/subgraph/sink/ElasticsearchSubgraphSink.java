package com.security.subgraph.sink;

import com.security.subgraph.config.SubgraphConfig;
import com.security.subgraph.constants.SubgraphConstants;
import com.security.subgraph.exception.SinkException;
import com.security.subgraph.model.graph.*;
import lombok.extern.slf4j.Slf4j;
import org.elasticsearch.action.bulk.BulkRequest;
import org.elasticsearch.action.bulk.BulkResponse;
import org.elasticsearch.action.index.IndexRequest;
import org.elasticsearch.client.RequestOptions;
import org.elasticsearch.client.RestHighLevelClient;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.*;

/**
 * 将子图批次写入 Elasticsearch
 *
 * 每个批次一次 bulk 请求，每个子图片段一个文档
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "subgraph.sink", name = "type",
        havingValue = SubgraphConstants.Sink.TYPE_ELASTICSEARCH)
public class ElasticsearchSubgraphSink implements SubgraphSink {

    private final RestHighLevelClient client;
    private final String index;

    @Autowired
    public ElasticsearchSubgraphSink(RestHighLevelClient client, SubgraphConfig config) {
        this(client, config.getSink().getIndex());
    }

    public ElasticsearchSubgraphSink(RestHighLevelClient client, String index) {
        this.client = client;
        this.index = index;
    }

    @Override
    public void accept(GeneratedSubgraphs subgraphs) throws SinkException {
        if (subgraphs.isEmpty()) {
            log.info("【子图输出】-> 空批次，跳过写入");
            return;
        }

        BulkRequest bulkRequest = buildBulkRequest(subgraphs);
        BulkResponse response;
        try {
            response = client.bulk(bulkRequest, RequestOptions.DEFAULT);
        } catch (IOException e) {
            throw new SinkException("写入ES失败: " + e.getMessage(), e);
        }

        if (response.hasFailures()) {
            throw new SinkException("ES批量写入部分失败: " + response.buildFailureMessage());
        }
        log.info("【子图输出】-> 写入ES完成, 索引: {}, 子图数: {}, 耗时: {}ms",
                index, subgraphs.size(), response.getTook().getMillis());
    }

    BulkRequest buildBulkRequest(GeneratedSubgraphs subgraphs) {
        BulkRequest bulkRequest = new BulkRequest();
        for (GraphFragment fragment : subgraphs.getSubgraphs()) {
            bulkRequest.add(new IndexRequest(index).source(toDocument(fragment)));
        }
        return bulkRequest;
    }

    /**
     * 子图片段转换为ES文档
     */
    static Map<String, Object> toDocument(GraphFragment fragment) {
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("timestamp", fragment.getTimestamp());

        List<Map<String, Object>> nodes = new ArrayList<>();
        for (GraphNode node : fragment.getNodes().values()) {
            nodes.add(toNodeDocument(node));
        }
        document.put("nodes", nodes);

        List<Map<String, Object>> edges = new ArrayList<>();
        for (GraphEdge edge : fragment.getEdges()) {
            Map<String, Object> edgeDoc = new LinkedHashMap<>();
            edgeDoc.put("label", edge.getLabel().getLabel());
            edgeDoc.put("from", edge.getFromKey());
            edgeDoc.put("to", edge.getToKey());
            edges.add(edgeDoc);
        }
        document.put("edges", edges);
        return document;
    }

    private static Map<String, Object> toNodeDocument(GraphNode node) {
        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put("node_key", node.getNodeKey());
        doc.put("node_type", node.getNodeType().name().toLowerCase(Locale.ROOT));

        if (node instanceof ProcessNode) {
            ProcessNode process = (ProcessNode) node;
            putIfPresent(doc, "asset_id", process.getAssetId());
            putIfPresent(doc, "host_ip", process.getHostIp());
            doc.put("pid", process.getPid());
            putIfPresent(doc, "image_name", process.getImageName());
            putState(doc, process.getState(), process.getCreatedTimestamp(), process.getLastSeenTimestamp());
        } else if (node instanceof FileNode) {
            FileNode file = (FileNode) node;
            doc.put("asset_id", file.getAssetId());
            doc.put("path", file.getPath());
            putState(doc, file.getState(), file.getCreatedTimestamp(), file.getLastSeenTimestamp());
        } else if (node instanceof ConnectionNode) {
            ConnectionNode connection = (ConnectionNode) node;
            doc.put("host_ip", connection.getHostIp());
            doc.put("port", connection.getPort());
            putState(doc, connection.getState(), connection.getCreatedTimestamp(), connection.getLastSeenTimestamp());
        } else if (node instanceof IpAddressNode) {
            IpAddressNode ip = (IpAddressNode) node;
            doc.put("ip_address", ip.getIpAddress());
            doc.put("last_seen_timestamp", ip.getLastSeenTimestamp());
        }
        return doc;
    }

    private static void putState(Map<String, Object> doc, NodeState state, Long created, Long lastSeen) {
        doc.put("state", state.name().toLowerCase(Locale.ROOT));
        putIfPresent(doc, "created_timestamp", created);
        putIfPresent(doc, "last_seen_timestamp", lastSeen);
    }

    private static void putIfPresent(Map<String, Object> doc, String key, Object value) {
        if (value != null) {
            doc.put(key, value);
        }
    }
}
