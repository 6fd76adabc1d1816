package com.security.subgraph.exception;

/**
 * 子图批次交付失败，整个调用失败
 */
public class SinkException extends SubgraphException {

    public SinkException(String message) {
        super(message);
    }

    public SinkException(String message, Throwable cause) {
        super(message, cause);
    }
}
