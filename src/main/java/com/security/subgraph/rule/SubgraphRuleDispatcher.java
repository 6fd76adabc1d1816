package com.security.subgraph.rule;

import com.security.subgraph.exception.SubgraphException;
import com.security.subgraph.model.event.*;
import com.security.subgraph.model.graph.GraphFragment;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * 按事件类型分派到对应的构图规则
 */
@Component
public class SubgraphRuleDispatcher implements TelemetryEventVisitor<GraphFragment> {

    private final ProcessCreateRule processCreateRule;
    private final FileCreateRule fileCreateRule;
    private final InboundNetworkRule inboundNetworkRule;
    private final OutboundNetworkRule outboundNetworkRule;

    public SubgraphRuleDispatcher() {
        this(new ProcessCreateRule(), new FileCreateRule(), new InboundNetworkRule(), new OutboundNetworkRule());
    }

    @Autowired
    public SubgraphRuleDispatcher(ProcessCreateRule processCreateRule,
                                  FileCreateRule fileCreateRule,
                                  InboundNetworkRule inboundNetworkRule,
                                  OutboundNetworkRule outboundNetworkRule) {
        this.processCreateRule = processCreateRule;
        this.fileCreateRule = fileCreateRule;
        this.inboundNetworkRule = inboundNetworkRule;
        this.outboundNetworkRule = outboundNetworkRule;
    }

    public GraphFragment dispatch(TelemetryEvent event) throws SubgraphException {
        return event.accept(this);
    }

    @Override
    public GraphFragment visitProcessCreate(ProcessCreateEvent event) throws SubgraphException {
        return processCreateRule.apply(event);
    }

    @Override
    public GraphFragment visitFileCreate(FileCreateEvent event) throws SubgraphException {
        return fileCreateRule.apply(event);
    }

    @Override
    public GraphFragment visitInboundNetwork(InboundNetworkEvent event) throws SubgraphException {
        return inboundNetworkRule.apply(event);
    }

    @Override
    public GraphFragment visitOutboundNetwork(OutboundNetworkEvent event) throws SubgraphException {
        return outboundNetworkRule.apply(event);
    }
}
