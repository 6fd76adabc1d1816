package com.security.subgraph.constants;

/**
 * 子图生成相关常量定义
 */
public final class SubgraphConstants {

    private SubgraphConstants() {
        // 工具类，防止实例化
    }

    /**
     * 时间相关常量
     */
    public static final class Time {
        private Time() {}

        /** Sysmon UtcTime 格式（毫秒精度） */
        public static final String UTC_TIME_FORMAT = "uuuu-MM-dd HH:mm:ss.SSS";
    }

    /**
     * Sysmon 事件ID
     */
    public static final class SysmonEventId {
        private SysmonEventId() {}

        public static final int PROCESS_CREATE = 1;
        public static final int NETWORK_CONNECT = 3;
        public static final int FILE_CREATE = 11;
    }

    /**
     * 批处理相关常量
     */
    public static final class Batch {
        private Batch() {}

        /** 记录分隔符 */
        public static final byte RECORD_SEPARATOR = '\n';

        /** 日志中截断的记录长度 */
        public static final int LOG_RECORD_PREVIEW_LENGTH = 120;
    }

    /**
     * 输出相关常量
     */
    public static final class Sink {
        private Sink() {}

        public static final String TYPE_LOG = "log";
        public static final String TYPE_ELASTICSEARCH = "elasticsearch";

        /** 默认子图索引名 */
        public static final String DEFAULT_INDEX = "sysmon_subgraphs";
    }
}
