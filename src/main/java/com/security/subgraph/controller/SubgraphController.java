package com.security.subgraph.controller;

import com.security.subgraph.exception.SinkException;
import com.security.subgraph.model.graph.GeneratedSubgraphs;
import com.security.subgraph.service.SubgraphGenerator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 子图生成REST API控制器
 */
@Slf4j
@RestController
@RequestMapping("/api/subgraph")
public class SubgraphController {

    @Autowired
    private SubgraphGenerator subgraphGenerator;

    /**
     * 处理一个原始负载（换行分隔的 Sysmon 记录）
     *
     * @param payload 请求体原始字节
     * @return 生成的子图、节点、边数量
     */
    @PostMapping(value = "/generate",
            consumes = {MediaType.APPLICATION_OCTET_STREAM_VALUE, MediaType.TEXT_PLAIN_VALUE})
    public ResponseEntity<Map<String, Object>> generate(@RequestBody(required = false) byte[] payload) {
        log.info("收到子图生成请求, 大小: {} 字节", payload != null ? payload.length : 0);

        Map<String, Object> body = new LinkedHashMap<>();
        try {
            GeneratedSubgraphs subgraphs = subgraphGenerator.handleEvent(payload);
            body.put("subgraphs", subgraphs.size());
            body.put("nodes", subgraphs.getNodeCount());
            body.put("edges", subgraphs.getEdgeCount());
            return ResponseEntity.ok(body);
        } catch (SinkException e) {
            body.put("error", e.getMessage());
            return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(body);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("【子图生成】-> 请求处理被中断");
            body.put("error", "处理被中断");
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(body);
        }
    }
}
