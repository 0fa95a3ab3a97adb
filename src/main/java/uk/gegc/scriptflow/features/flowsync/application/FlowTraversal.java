package uk.gegc.scriptflow.features.flowsync.application;

import org.springframework.stereotype.Component;
import uk.gegc.scriptflow.features.flow.domain.model.FlowConnection;
import uk.gegc.scriptflow.features.flow.domain.model.FlowNode;
import uk.gegc.scriptflow.features.flow.domain.model.FlowNodeType;
import uk.gegc.scriptflow.features.flowsync.domain.model.FlowPins;
import uk.gegc.scriptflow.features.flowsync.domain.model.TraversalBranch;
import uk.gegc.scriptflow.features.flowsync.domain.model.TraversalTree;
import uk.gegc.scriptflow.features.flowsync.infra.mapping.ResponseChoiceCodec;
import uk.gegc.scriptflow.shared.exception.NoEntryNodeException;

import java.util.*;

/**
 * Walks a flow graph from its entry nodes. Entry nodes are walked in ascending id order and a node is
 * emitted at most once, so hub loops terminate. Nodes not reachable from an entry are left out.
 */
@Component
public class FlowTraversal {

    private static final Comparator<UUID> ID_ORDER = Comparator.comparing(UUID::toString);

    /**
     * Single path through the graph. Condition nodes follow their {@code true} pin only.
     *
     * @throws NoEntryNodeException when the graph has no entry node
     */
    public List<FlowNode> linearize(List<FlowNode> nodes, List<FlowConnection> connections) {
        Graph graph = new Graph(nodes, connections);
        Set<UUID> visited = new HashSet<>();
        List<FlowNode> path = new ArrayList<>();
        for (FlowNode entry : graph.entries()) {
            FlowNode current = entry;
            while (current != null && visited.add(current.getId())) {
                path.add(current);
                if (isTerminal(current)) {
                    break;
                }
                current = graph.follow(current, continuationPin(current));
            }
        }
        return path;
    }

    /**
     * Like {@link #linearize} but a dialogue node with connected response pins ends the sequence and
     * each connected choice becomes a branch holding its own subtree.
     *
     * @throws NoEntryNodeException when the graph has no entry node
     */
    public TraversalTree linearizeTree(List<FlowNode> nodes, List<FlowConnection> connections) {
        Graph graph = new Graph(nodes, connections);
        Set<UUID> visited = new HashSet<>();
        List<FlowNode> path = new ArrayList<>();
        List<TraversalBranch> branches = new ArrayList<>();
        for (FlowNode entry : graph.entries()) {
            TraversalTree tree = walk(entry, graph, visited);
            path.addAll(tree.nodes());
            branches.addAll(tree.branches());
        }
        return new TraversalTree(path, branches);
    }

    private TraversalTree walk(FlowNode start, Graph graph, Set<UUID> visited) {
        List<FlowNode> path = new ArrayList<>();
        List<TraversalBranch> branches = new ArrayList<>();
        FlowNode current = start;
        while (current != null && visited.add(current.getId())) {
            path.add(current);
            if (isTerminal(current)) {
                break;
            }
            List<String> choicePins = connectedChoicePins(current, graph);
            if (!choicePins.isEmpty()) {
                for (String choiceId : choicePins) {
                    FlowNode target = graph.follow(current, choiceId);
                    if (target == null) {
                        continue;
                    }
                    TraversalTree subtree = walk(target, graph, visited);
                    if (!subtree.isEmpty()) {
                        branches.add(new TraversalBranch(current.getId(), choiceId, subtree));
                    }
                }
                break;
            }
            current = graph.follow(current, continuationPin(current));
        }
        return new TraversalTree(path, branches);
    }

    // Response ids, in response order, that have at least one outgoing connection.
    private List<String> connectedChoicePins(FlowNode node, Graph graph) {
        if (node.getType() != FlowNodeType.DIALOGUE || node.getData() == null) {
            return List.of();
        }
        List<String> pins = new ArrayList<>();
        for (String choiceId : ResponseChoiceCodec.choiceIds(node.getData().get("responses"))) {
            if (!pins.contains(choiceId) && graph.hasOutgoing(node.getId(), choiceId)) {
                pins.add(choiceId);
            }
        }
        return pins;
    }

    private boolean isTerminal(FlowNode node) {
        return node.getType() == FlowNodeType.EXIT || node.getType() == FlowNodeType.JUMP;
    }

    private String continuationPin(FlowNode node) {
        return node.getType() == FlowNodeType.CONDITION ? FlowPins.TRUE : FlowPins.OUTPUT;
    }

    private static final class Graph {
        private final Map<UUID, FlowNode> nodesById = new HashMap<>();
        private final Map<UUID, List<FlowConnection>> outgoing = new HashMap<>();
        private final List<FlowNode> entries;

        private Graph(List<FlowNode> nodes, List<FlowConnection> connections) {
            nodes.forEach(node -> nodesById.put(node.getId(), node));
            connections.stream()
                    .sorted(Comparator.comparing((FlowConnection c) -> c.getTargetNodeId().toString()))
                    .forEach(c -> outgoing.computeIfAbsent(c.getSourceNodeId(), id -> new ArrayList<>()).add(c));
            entries = nodes.stream()
                    .filter(node -> node.getType() == FlowNodeType.ENTRY)
                    .sorted(Comparator.comparing(FlowNode::getId, ID_ORDER))
                    .toList();
            if (entries.isEmpty()) {
                UUID flowId = nodes.isEmpty() ? null : nodes.get(0).getFlowId();
                throw flowId != null ? new NoEntryNodeException(flowId) : new NoEntryNodeException("Flow has no entry node");
            }
        }

        private List<FlowNode> entries() {
            return entries;
        }

        private boolean hasOutgoing(UUID nodeId, String pin) {
            return outgoing.getOrDefault(nodeId, List.of()).stream()
                    .anyMatch(c -> pin.equals(c.getSourcePin()) && nodesById.containsKey(c.getTargetNodeId()));
        }

        private FlowNode follow(FlowNode node, String pin) {
            return outgoing.getOrDefault(node.getId(), List.of()).stream()
                    .filter(c -> pin.equals(c.getSourcePin()))
                    .map(c -> nodesById.get(c.getTargetNodeId()))
                    .filter(Objects::nonNull)
                    .findFirst()
                    .orElse(null);
        }
    }
}
