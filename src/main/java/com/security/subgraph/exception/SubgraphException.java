package com.security.subgraph.exception;

/**
 * 子图生成异常基类
 */
public class SubgraphException extends Exception {

    public SubgraphException(String message) {
        super(message);
    }

    public SubgraphException(String message, Throwable cause) {
        super(message, cause);
    }
}
