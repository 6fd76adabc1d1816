package com.security.subgraph.exception;

/**
 * 时间字符串不符合 yyyy-MM-dd HH:mm:ss.SSS 格式
 */
public class TimestampFormatException extends InvalidTimestampException {

    public TimestampFormatException(String timestamp) {
        super("时间格式错误: " + timestamp, timestamp);
    }

    public TimestampFormatException(String timestamp, Throwable cause) {
        super("时间格式错误: " + timestamp, timestamp, cause);
    }
}
