package uk.gegc.scriptflow.features.flowsync.domain.model;

import uk.gegc.scriptflow.features.flow.domain.model.FlowNode;

import java.util.List;

/**
 * Ordered nodes of one page-to-be plus the choice branches hanging off them.
 */
public record TraversalTree(List<FlowNode> nodes, List<TraversalBranch> branches) {

    public TraversalTree {
        nodes = List.copyOf(nodes);
        branches = List.copyOf(branches);
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }
}
