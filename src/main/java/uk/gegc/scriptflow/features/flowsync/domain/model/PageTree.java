package uk.gegc.scriptflow.features.flowsync.domain.model;

import java.util.List;
import java.util.UUID;

public record PageTree(UUID screenplayId, List<NodeSpec> nodeSpecs, List<PageBranch> branches) {

    public PageTree {
        nodeSpecs = List.copyOf(nodeSpecs);
        branches = List.copyOf(branches);
    }

    public List<PageBranch> branchesFrom(int nodeIndex) {
        return branches.stream().filter(branch -> branch.sourceNodeIndex() == nodeIndex).toList();
    }
}
