package uk.gegc.scriptflow.features.flowsync.application;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.scriptflow.features.flow.domain.model.FlowNodeType;
import uk.gegc.scriptflow.features.flowsync.domain.model.*;
import uk.gegc.scriptflow.features.flowsync.infra.grouping.ElementGrouper;
import uk.gegc.scriptflow.features.flowsync.infra.mapping.ForwardNodeMapper;
import uk.gegc.scriptflow.features.flowsync.infra.mapping.ResponseChoiceCodec;

import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Turns a page and its linked child pages into a tree of node specifications, and flattens that
 * tree into the node and connection lists a push writes.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PageTreeBuilder {

    private final ElementGrouper elementGrouper;
    private final ForwardNodeMapper forwardNodeMapper;

    public PageTree build(PageSnapshot root) {
        return build(root, false, new HashMap<>(), new HashSet<>());
    }

    private PageTree build(PageSnapshot page,
                           boolean childPage,
                           Map<UUID, PageTree> built,
                           Set<UUID> inProgress) {
        inProgress.add(page.screenplayId());
        List<ElementGroup> groups = elementGrouper.group(page.elements());
        List<NodeSpec> specs = forwardNodeMapper.toNodeSpecs(groups, !childPage);

        Map<UUID, PageSnapshot> childrenById = page.children().stream()
                .collect(Collectors.toMap(PageSnapshot::screenplayId, Function.identity(), (a, b) -> a));

        List<PageBranch> branches = new ArrayList<>();
        for (int index = 0; index < specs.size(); index++) {
            NodeSpec spec = specs.get(index);
            if (spec.type() != FlowNodeType.DIALOGUE) {
                continue;
            }
            for (JsonNode choice : ResponseChoiceCodec.choicesOf(spec.data().get("responses"))) {
                Optional<UUID> linked = ResponseChoiceCodec.linkedScreenplayId(choice);
                if (linked.isEmpty() || !choice.hasNonNull(ResponseChoiceCodec.ID)) {
                    continue;
                }
                UUID childId = linked.get();
                PageSnapshot child = childrenById.get(childId);
                if (child == null) {
                    log.warn("Choice on page {} links screenplay {} which is not one of its child pages",
                            page.screenplayId(), childId);
                    continue;
                }
                if (inProgress.contains(childId) && !built.containsKey(childId)) {
                    log.warn("Skipping cyclic page link {} -> {}", page.screenplayId(), childId);
                    continue;
                }
                PageTree childTree = built.get(childId);
                if (childTree == null) {
                    childTree = build(child, true, built, inProgress);
                }
                if (childTree.nodeSpecs().isEmpty()) {
                    continue;
                }
                branches.add(new PageBranch(index, choice.get(ResponseChoiceCodec.ID).asText(), childTree));
            }
        }

        PageTree tree = new PageTree(page.screenplayId(), specs, branches);
        built.put(page.screenplayId(), tree);
        return tree;
    }

    /**
     * Depth-first pre-order flattening: a page's own nodes, then each branch's subtree in declaration
     * order. A child page reached twice is emitted once.
     */
    public FlatPageTree flatten(PageTree root) {
        FlattenState state = new FlattenState();
        emit(root, state);
        List<UUID> screenplayIds = state.screenplayIds.stream()
                .sorted(Comparator.comparing(UUID::toString))
                .toList();
        return new FlatPageTree(state.nodeSpecs, state.connections, screenplayIds);
    }

    private int emit(PageTree tree, FlattenState state) {
        int base = state.nodeSpecs.size();
        state.firstIndex.put(tree, base);
        state.screenplayIds.add(tree.screenplayId());
        state.nodeSpecs.addAll(tree.nodeSpecs());

        List<NodeSpec> specs = tree.nodeSpecs();
        for (int index = 0; index < specs.size(); index++) {
            NodeSpec spec = specs.get(index);
            int source = base + index;
            boolean hasSuccessor = index + 1 < specs.size();
            if (!tree.branchesFrom(index).isEmpty() || spec.type() == FlowNodeType.EXIT || !hasSuccessor) {
                continue;
            }
            if (spec.type() == FlowNodeType.CONDITION) {
                state.connections.add(new ConnectionSpec(source, FlowPins.TRUE, source + 1, FlowPins.INPUT));
                state.connections.add(new ConnectionSpec(source, FlowPins.FALSE, source + 1, FlowPins.INPUT));
            } else {
                state.connections.add(new ConnectionSpec(source, FlowPins.OUTPUT, source + 1, FlowPins.INPUT));
            }
        }

        for (PageBranch branch : tree.branches()) {
            Integer childStart = state.firstIndex.get(branch.child());
            if (childStart == null) {
                childStart = emit(branch.child(), state);
            }
            state.connections.add(new ConnectionSpec(
                    base + branch.sourceNodeIndex(), branch.choiceId(), childStart, FlowPins.INPUT));
        }
        return base;
    }

    private static final class FlattenState {
        private final List<NodeSpec> nodeSpecs = new ArrayList<>();
        private final List<ConnectionSpec> connections = new ArrayList<>();
        private final Set<UUID> screenplayIds = new HashSet<>();
        private final Map<PageTree, Integer> firstIndex = new IdentityHashMap<>();
    }
}
