package uk.gegc.scriptflow.features.flowsync.domain.model;

import java.util.List;
import java.util.UUID;

public record FlatPageTree(List<NodeSpec> nodeSpecs, List<ConnectionSpec> connections, List<UUID> screenplayIds) {

    public FlatPageTree {
        nodeSpecs = List.copyOf(nodeSpecs);
        connections = List.copyOf(connections);
        screenplayIds = List.copyOf(screenplayIds);
    }
}
