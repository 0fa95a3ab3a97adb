package uk.gegc.scriptflow.features.flowsync.domain.model;

import com.fasterxml.jackson.databind.node.ObjectNode;
import uk.gegc.scriptflow.features.flow.domain.model.FlowNodeType;

import java.util.List;
import java.util.UUID;

/**
 * Node to be materialized by a push, together with the ids of the elements it was built from.
 */
public record NodeSpec(FlowNodeType type, ObjectNode data, List<UUID> elementIds) {

    public NodeSpec {
        elementIds = List.copyOf(elementIds);
    }
}
