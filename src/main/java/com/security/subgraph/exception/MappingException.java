package com.security.subgraph.exception;

import com.security.subgraph.model.event.EventKind;

/**
 * 构图规则无法从事件中生成必需的节点或边字段
 */
public class MappingException extends SubgraphException {

    private final EventKind eventKind;
    private final String field;

    public MappingException(EventKind eventKind, String field, String reason) {
        super(String.format("[%s] 字段 %s 无效: %s", eventKind, field, reason));
        this.eventKind = eventKind;
        this.field = field;
    }

    public EventKind getEventKind() {
        return eventKind;
    }

    public String getField() {
        return field;
    }
}
