package uk.gegc.scriptflow.features.flowsync.infra.mapping;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Converts response choices between the screenplay form (structured {@code condition} and
 * {@code instruction}) and the flow node form (both pre-encoded as JSON strings).
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ResponseChoiceCodec {

    public static final String CHOICES = "choices";
    public static final String ID = "id";
    public static final String TEXT = "text";
    public static final String CONDITION = "condition";
    public static final String INSTRUCTION = "instruction";
    public static final String LINKED_SCREENPLAY_ID = "linked_screenplay_id";

    private static final Set<String> LOGIC_TYPES = Set.of("all", "any");
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private final ObjectMapper objectMapper;

    /**
     * Builds a dialogue node's {@code responses} array from a response element's payload.
     */
    public ArrayNode toNodeResponses(JsonNode responseData) {
        ArrayNode responses = NODES.arrayNode();
        for (JsonNode choice : choicesOf(responseData)) {
            ObjectNode response = NODES.objectNode();
            response.set(ID, copyOrNull(choice.get(ID)));
            response.put(TEXT, textOrEmpty(choice.get(TEXT)));
            response.set(CONDITION, encodeCondition(choice.get(CONDITION)));
            response.set(INSTRUCTION, encodeInstruction(choice.get(INSTRUCTION)));
            response.set(LINKED_SCREENPLAY_ID, copyOrNull(choice.get(LINKED_SCREENPLAY_ID)));
            responses.add(response);
        }
        return responses;
    }

    /**
     * Builds a response element's {@code choices} array from a dialogue node's {@code responses}.
     */
    public ArrayNode toElementChoices(JsonNode responses) {
        ArrayNode choices = NODES.arrayNode();
        if (responses == null || !responses.isArray()) {
            return choices;
        }
        for (JsonNode response : responses) {
            ObjectNode choice = NODES.objectNode();
            choice.set(ID, copyOrNull(response.get(ID)));
            choice.put(TEXT, textOrEmpty(response.get(TEXT)));
            choice.set(CONDITION, decodeCondition(response.get(CONDITION)));
            choice.set(INSTRUCTION, decodeInstruction(response.get(INSTRUCTION)));
            choice.set(LINKED_SCREENPLAY_ID, copyOrNull(response.get(LINKED_SCREENPLAY_ID)));
            choices.add(choice);
        }
        return choices;
    }

    JsonNode encodeCondition(JsonNode condition) {
        if (isAbsent(condition)) {
            return NullNode.getInstance();
        }
        if (condition.isTextual()) {
            return condition;
        }
        if (!condition.isObject()) {
            return NullNode.getInstance();
        }
        JsonNode rules = condition.get("rules");
        if (rules == null || !rules.isArray() || rules.isEmpty()) {
            return NullNode.getInstance();
        }
        ObjectNode normalized = NODES.objectNode();
        normalized.put("logic", textOrEmpty(condition.get("logic")));
        normalized.set("rules", rules.deepCopy());
        return TextNode.valueOf(writeJson(normalized));
    }

    JsonNode encodeInstruction(JsonNode instruction) {
        if (isAbsent(instruction)) {
            return NullNode.getInstance();
        }
        if (instruction.isTextual()) {
            return instruction;
        }
        if (instruction.isArray()) {
            return TextNode.valueOf(writeJson(instruction));
        }
        return NullNode.getInstance();
    }

    JsonNode decodeCondition(JsonNode condition) {
        if (isAbsent(condition)) {
            return NullNode.getInstance();
        }
        if (condition.isObject()) {
            return condition.deepCopy();
        }
        if (!condition.isTextual() || condition.asText().isBlank()) {
            return NullNode.getInstance();
        }
        JsonNode parsed = readJson(condition.asText());
        if (parsed != null && isStructuredCondition(parsed)) {
            return parsed;
        }
        // Plain-text expressions predate structured conditions and are kept as written.
        return condition;
    }

    JsonNode decodeInstruction(JsonNode instruction) {
        if (isAbsent(instruction)) {
            return NullNode.getInstance();
        }
        if (instruction.isArray()) {
            return instruction.deepCopy();
        }
        if (!instruction.isTextual()) {
            return NullNode.getInstance();
        }
        JsonNode parsed = readJson(instruction.asText());
        return parsed != null ? parsed : NullNode.getInstance();
    }

    public static List<JsonNode> choicesOf(JsonNode responseData) {
        List<JsonNode> choices = new ArrayList<>();
        if (responseData == null) {
            return choices;
        }
        JsonNode array = responseData.isArray() ? responseData : responseData.get(CHOICES);
        if (array != null && array.isArray()) {
            array.forEach(choices::add);
        }
        return choices;
    }

    public static List<String> choiceIds(JsonNode responses) {
        List<String> ids = new ArrayList<>();
        for (JsonNode choice : choicesOf(responses)) {
            JsonNode id = choice.get(ID);
            if (!isAbsent(id)) {
                ids.add(id.asText());
            }
        }
        return ids;
    }

    public static Optional<UUID> linkedScreenplayId(JsonNode choice) {
        JsonNode linked = choice == null ? null : choice.get(LINKED_SCREENPLAY_ID);
        if (isAbsent(linked) || linked.asText().isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(UUID.fromString(linked.asText()));
        } catch (IllegalArgumentException e) {
            log.debug("Ignoring malformed linked_screenplay_id '{}'", linked.asText());
            return Optional.empty();
        }
    }

    public static Optional<JsonNode> findChoice(JsonNode responses, String choiceId) {
        return choicesOf(responses).stream()
                .filter(choice -> choice.hasNonNull(ID) && choice.get(ID).asText().equals(choiceId))
                .findFirst();
    }

    /**
     * Returns a copy of a response element payload with one choice's link replaced.
     * A {@code null} target clears the link.
     */
    public static ObjectNode withLinkedScreenplay(JsonNode elementData, String choiceId, UUID screenplayId) {
        ObjectNode copy = elementData != null && elementData.isObject()
                ? ((ObjectNode) elementData).deepCopy()
                : NODES.objectNode();
        JsonNode choices = copy.get(CHOICES);
        if (choices != null && choices.isArray()) {
            for (JsonNode choice : choices) {
                if (choice.isObject() && choice.hasNonNull(ID) && choice.get(ID).asText().equals(choiceId)) {
                    ((ObjectNode) choice).set(LINKED_SCREENPLAY_ID,
                            screenplayId != null ? TextNode.valueOf(screenplayId.toString()) : NullNode.getInstance());
                }
            }
        }
        return copy;
    }

    private boolean isStructuredCondition(JsonNode parsed) {
        return parsed.isObject()
                && parsed.hasNonNull("logic")
                && LOGIC_TYPES.contains(parsed.get("logic").asText())
                && parsed.has("rules")
                && parsed.get("rules").isArray();
    }

    private String writeJson(JsonNode value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to encode response choice field", e);
        }
    }

    private JsonNode readJson(String raw) {
        try {
            JsonNode parsed = objectMapper.readTree(raw);
            return parsed == null || parsed.isMissingNode() ? null : parsed;
        } catch (JsonProcessingException e) {
            log.debug("Response choice field is not JSON: {}", e.getOriginalMessage());
            return null;
        }
    }

    private static boolean isAbsent(JsonNode value) {
        return value == null || value.isNull() || value.isMissingNode();
    }

    private static JsonNode copyOrNull(JsonNode value) {
        return isAbsent(value) ? NullNode.getInstance() : value.deepCopy();
    }

    private static String textOrEmpty(JsonNode value) {
        return isAbsent(value) ? "" : value.asText();
    }
}
