package uk.gegc.scriptflow.features.flowsync.domain.model;

/**
 * Link from a response choice of the node at {@code sourceNodeIndex} (page-local) to a child page.
 */
public record PageBranch(int sourceNodeIndex, String choiceId, PageTree child) {
}
