package uk.gegc.scriptflow.features.flowsync.application;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import uk.gegc.scriptflow.features.flowsync.config.FlowSyncProperties;
import uk.gegc.scriptflow.features.flowsync.domain.model.NodePosition;
import uk.gegc.scriptflow.features.flowsync.domain.model.PageBranch;
import uk.gegc.scriptflow.features.flowsync.domain.model.PageTree;

import java.util.*;

/**
 * Canvas positions for the nodes of a page tree. Each page is a vertical column; the branches of a
 * node share the horizontal space beneath it and the page continues below the deepest of them.
 * <p>
 * Stateless apart from the configured spacing, so safe to share between threads.
 */
@Component
@RequiredArgsConstructor
public class FlowLayout {

    private final FlowSyncProperties properties;

    /**
     * @return one position per node, in the order produced by {@link PageTreeBuilder#flatten(PageTree)}
     */
    public List<NodePosition> computePositions(PageTree root) {
        FlowSyncProperties.Layout layout = properties.getLayout();
        Map<PageTree, NodePosition[]> byTree = new IdentityHashMap<>();
        layoutPage(root, layout.getCenterX(), layout.getStartY(), layout, byTree);

        List<NodePosition> ordered = new ArrayList<>();
        collect(root, byTree, Collections.newSetFromMap(new IdentityHashMap<>()), ordered);
        return ordered;
    }

    // Returns the first free y below the page.
    private double layoutPage(PageTree tree,
                              double x,
                              double startY,
                              FlowSyncProperties.Layout layout,
                              Map<PageTree, NodePosition[]> byTree) {
        NodePosition[] positions = new NodePosition[tree.nodeSpecs().size()];
        byTree.put(tree, positions);

        double y = startY;
        for (int index = 0; index < positions.length; index++) {
            positions[index] = new NodePosition(x, y);
            double nodeY = y;
            y += layout.getRowSpacing();

            List<PageBranch> branches = tree.branchesFrom(index).stream()
                    .filter(branch -> !byTree.containsKey(branch.child()))
                    .toList();
            if (branches.isEmpty()) {
                continue;
            }

            double totalWidth = branches.stream().mapToDouble(branch -> width(branch.child(), layout)).sum();
            double left = x - totalWidth / 2;
            double branchY = nodeY + layout.getRowSpacing();
            double deepest = branchY;
            for (PageBranch branch : branches) {
                if (byTree.containsKey(branch.child())) {
                    continue;
                }
                double branchWidth = width(branch.child(), layout);
                double end = layoutPage(branch.child(), left + branchWidth / 2, branchY, layout, byTree);
                deepest = Math.max(deepest, end);
                left += branchWidth;
            }
            y = Math.max(y, deepest);
        }
        return y;
    }

    private double width(PageTree tree, FlowSyncProperties.Layout layout) {
        if (tree.branches().isEmpty()) {
            return layout.getBranchGap();
        }
        return tree.branches().stream().mapToDouble(branch -> width(branch.child(), layout)).sum();
    }

    private void collect(PageTree tree,
                         Map<PageTree, NodePosition[]> byTree,
                         Set<PageTree> emitted,
                         List<NodePosition> ordered) {
        emitted.add(tree);
        ordered.addAll(Arrays.asList(byTree.get(tree)));
        for (PageBranch branch : tree.branches()) {
            if (!emitted.contains(branch.child())) {
                collect(branch.child(), byTree, emitted, ordered);
            }
        }
    }
}
