package com.security.subgraph.exception;

/**
 * 原始记录无法解析为遥测事件
 */
public class DecodeException extends SubgraphException {

    public DecodeException(String message) {
        super(message);
    }

    public DecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
