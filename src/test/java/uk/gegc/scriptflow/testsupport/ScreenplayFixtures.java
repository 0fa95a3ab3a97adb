package uk.gegc.scriptflow.testsupport;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import uk.gegc.scriptflow.features.flow.domain.model.FlowConnection;
import uk.gegc.scriptflow.features.flow.domain.model.FlowNode;
import uk.gegc.scriptflow.features.flow.domain.model.FlowNodeType;
import uk.gegc.scriptflow.features.flow.domain.model.NodeSource;
import uk.gegc.scriptflow.features.screenplay.domain.model.ElementType;
import uk.gegc.scriptflow.features.screenplay.domain.model.ScreenplayElement;

import java.io.UncheckedIOException;
import java.util.UUID;

/**
 * Detached elements, nodes and connections with ids already assigned, for tests that never touch
 * the database.
 */
public final class ScreenplayFixtures {

    public static final ObjectMapper MAPPER = new ObjectMapper();

    private ScreenplayFixtures() {
    }

    public static ScreenplayElement element(ElementType type, String content) {
        return element(type, content, null);
    }

    public static ScreenplayElement element(ElementType type, String content, JsonNode data) {
        ScreenplayElement element = new ScreenplayElement(UUID.randomUUID(), type, content, data, 0);
        element.setId(UUID.randomUUID());
        return element;
    }

    public static FlowNode node(FlowNodeType type, String json) {
        FlowNode node = new FlowNode(UUID.randomUUID(), type, json(json), 0, 0, NodeSource.SCREENPLAY_SYNC);
        node.setId(UUID.randomUUID());
        return node;
    }

    public static FlowNode node(UUID id, FlowNodeType type, String json) {
        FlowNode node = node(type, json);
        node.setId(id);
        return node;
    }

    public static FlowConnection connection(FlowNode source, String pin, FlowNode target) {
        FlowConnection connection = new FlowConnection(source.getFlowId(), source.getId(), pin, target.getId(), "input");
        connection.setId(UUID.randomUUID());
        return connection;
    }

    /**
     * Parses JSON written with single quotes, e.g. {@code "{'text': 'Hi'}"}.
     */
    public static ObjectNode json(String singleQuoted) {
        if (singleQuoted == null) {
            return null;
        }
        try {
            return (ObjectNode) MAPPER.readTree(singleQuoted.replace('\'', '"'));
        } catch (com.fasterxml.jackson.core.JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }
}
