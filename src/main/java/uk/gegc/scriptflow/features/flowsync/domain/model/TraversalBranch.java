package uk.gegc.scriptflow.features.flowsync.domain.model;

import java.util.UUID;

public record TraversalBranch(UUID sourceNodeId, String choiceId, TraversalTree subtree) {
}
