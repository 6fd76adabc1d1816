package com.security.subgraph.config;

import com.security.subgraph.constants.SubgraphConstants;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * 子图生成配置类
 */
@Configuration
@ConfigurationProperties(prefix = "subgraph")
public class SubgraphConfig {

    /**
     * 记录映射并行度，默认为CPU核数
     */
    private int parallelism = Runtime.getRuntime().availableProcessors();

    private Sink sink = new Sink();

    public int getParallelism() {
        return parallelism;
    }

    public void setParallelism(int parallelism) {
        this.parallelism = parallelism;
    }

    public Sink getSink() {
        return sink;
    }

    public void setSink(Sink sink) {
        this.sink = sink;
    }

    /**
     * 子图输出配置
     */
    public static class Sink {

        /**
         * log 或 elasticsearch
         */
        private String type = SubgraphConstants.Sink.TYPE_LOG;

        /**
         * elasticsearch 输出时的索引名
         */
        private String index = SubgraphConstants.Sink.DEFAULT_INDEX;

        public String getType() {
            return type;
        }

        public void setType(String type) {
            this.type = type;
        }

        public String getIndex() {
            return index;
        }

        public void setIndex(String index) {
            this.index = index;
        }
    }
}
