package com.security.subgraph.model.graph;

import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 一次调用生成的子图批次，交付给 SubgraphSink
 *
 * 批次内顺序不保证与输入记录顺序一致
 */
@Getter
@ToString
public class GeneratedSubgraphs {

    private final List<GraphFragment> subgraphs;

    public GeneratedSubgraphs(List<GraphFragment> subgraphs) {
        this.subgraphs = Collections.unmodifiableList(new ArrayList<>(subgraphs));
    }

    public int size() {
        return subgraphs.size();
    }

    public boolean isEmpty() {
        return subgraphs.isEmpty();
    }

    public int getNodeCount() {
        int count = 0;
        for (GraphFragment fragment : subgraphs) {
            count += fragment.getNodes().size();
        }
        return count;
    }

    public int getEdgeCount() {
        int count = 0;
        for (GraphFragment fragment : subgraphs) {
            count += fragment.getEdges().size();
        }
        return count;
    }
}
