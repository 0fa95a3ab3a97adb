package uk.gegc.scriptflow.features.flowsync.domain.model;

import com.fasterxml.jackson.databind.JsonNode;
import uk.gegc.scriptflow.features.screenplay.domain.model.ElementType;

import java.util.UUID;

/**
 * Element to be written by a pull, stamped with the node it came from.
 */
public record ElementSpec(ElementType type, String content, JsonNode data, UUID sourceNodeId) {
}
