package com.security.subgraph.model.event;

/**
 * 遥测事件类型
 */
public enum EventKind {
    PROCESS_CREATE("process create"),
    FILE_CREATE("file create"),
    INBOUND_NETWORK("inbound network"),
    OUTBOUND_NETWORK("outbound network");

    private final String description;

    EventKind(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
