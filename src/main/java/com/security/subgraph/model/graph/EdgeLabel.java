package com.security.subgraph.model.graph;

/**
 * 边标签（固定词表）
 */
public enum EdgeLabel {
    BIN_FILE("bin_file"),
    CHILDREN("children"),
    CREATED_FILES("created_files"),
    CONNECTION("connection"),
    EXTERNAL_CONNECTION("external_connection"),
    BOUND_CONNECTION("bound_connection"),
    CREATED_CONNECTION("created_connection");

    private final String label;

    EdgeLabel(String label) {
        this.label = label;
    }

    /**
     * 下游合并使用的标签名
     */
    public String getLabel() {
        return label;
    }

    @Override
    public String toString() {
        return label;
    }
}
