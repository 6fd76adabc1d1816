package com.security.subgraph.exception;

/**
 * 时间戳无效（格式错误或超出范围）
 */
public class InvalidTimestampException extends SubgraphException {

    private final String timestamp;

    public InvalidTimestampException(String message, String timestamp) {
        super(message);
        this.timestamp = timestamp;
    }

    public InvalidTimestampException(String message, String timestamp, Throwable cause) {
        super(message, cause);
        this.timestamp = timestamp;
    }

    public String getTimestamp() {
        return timestamp;
    }
}
