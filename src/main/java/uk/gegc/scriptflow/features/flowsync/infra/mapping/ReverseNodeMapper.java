package uk.gegc.scriptflow.features.flowsync.infra.mapping;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import uk.gegc.scriptflow.features.flow.domain.model.FlowNode;
import uk.gegc.scriptflow.features.flowsync.domain.model.ElementSpec;
import uk.gegc.scriptflow.features.screenplay.domain.model.ElementType;
import uk.gegc.scriptflow.shared.exception.InvalidNodeTypeException;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Converts flow nodes back into screenplay element specifications. A dialogue node may expand into
 * up to four elements; a subflow node produces none.
 */
@Component
@RequiredArgsConstructor
public class ReverseNodeMapper {

    public static final String DEFAULT_CHARACTER = "CHARACTER";

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private final ResponseChoiceCodec choiceCodec;

    public List<ElementSpec> toElementSpecs(List<FlowNode> nodes) {
        List<ElementSpec> specs = new ArrayList<>();
        for (FlowNode node : nodes) {
            specs.addAll(toElementSpecs(node));
        }
        return specs;
    }

    public List<ElementSpec> toElementSpecs(FlowNode node) {
        if (node.getType() == null) {
            throw new InvalidNodeTypeException("Flow node " + node.getId() + " has no type");
        }
        JsonNode data = node.getData() != null ? node.getData() : NODES.objectNode();
        UUID id = node.getId();
        return switch (node.getType()) {
            case ENTRY -> List.of(new ElementSpec(ElementType.SCENE_HEADING, SceneHeadingFormat.DEFAULT_HEADING, null, id));
            case SCENE -> List.of(mapScene(id, data));
            case DIALOGUE -> mapDialogue(id, data);
            case CONDITION -> List.of(mapCondition(id, data));
            case INSTRUCTION -> List.of(mapInstruction(id, data));
            case EXIT -> List.of(new ElementSpec(ElementType.TRANSITION, text(data, "label"), null, id));
            case HUB -> List.of(mapHub(id, data));
            case JUMP -> List.of(mapJump(id, data));
            case SUBFLOW -> List.of();
        };
    }

    private ElementSpec mapScene(UUID id, JsonNode data) {
        String heading = SceneHeadingFormat.format(
                text(data, "int_ext"),
                text(data, "description"),
                text(data, "time_of_day"));
        return new ElementSpec(ElementType.SCENE_HEADING, heading, null, id);
    }

    private List<ElementSpec> mapDialogue(UUID id, JsonNode data) {
        if (data.hasNonNull("dual_dialogue")) {
            return List.of(mapDualDialogue(id, data));
        }

        String text = text(data, "text");
        String stageDirections = text(data, "stage_directions");
        String menuText = text(data, "menu_text");
        JsonNode responses = data.get("responses");
        boolean hasResponses = responses != null && responses.isArray() && !responses.isEmpty();

        if (text.isEmpty() && menuText.isEmpty() && !hasResponses && !stageDirections.isEmpty()) {
            return List.of(new ElementSpec(ElementType.ACTION, stageDirections, null, id));
        }
        if (text.isEmpty() && menuText.isEmpty() && stageDirections.isEmpty() && hasResponses
                && !data.hasNonNull("speaker_sheet_id")) {
            return List.of(responseElement(id, responses));
        }

        List<ElementSpec> elements = new ArrayList<>();
        ObjectNode characterData = null;
        if (data.hasNonNull("speaker_sheet_id")) {
            characterData = NODES.objectNode();
            characterData.set("sheet_id", data.get("speaker_sheet_id").deepCopy());
        }
        String characterName = menuText.isEmpty() ? DEFAULT_CHARACTER : menuText;
        elements.add(new ElementSpec(ElementType.CHARACTER, characterName, characterData, id));
        if (!stageDirections.isEmpty()) {
            elements.add(new ElementSpec(ElementType.PARENTHETICAL, stageDirections, null, id));
        }
        elements.add(new ElementSpec(ElementType.DIALOGUE, text, null, id));
        if (hasResponses) {
            elements.add(responseElement(id, responses));
        }
        return elements;
    }

    private ElementSpec responseElement(UUID id, JsonNode responses) {
        ArrayNode choices = choiceCodec.toElementChoices(responses);
        ObjectNode payload = NODES.objectNode();
        payload.set(ResponseChoiceCodec.CHOICES, choices);
        return new ElementSpec(ElementType.RESPONSE, "", payload, id);
    }

    private ElementSpec mapDualDialogue(UUID id, JsonNode data) {
        JsonNode dual = data.get("dual_dialogue");
        ObjectNode payload = NODES.objectNode();
        ObjectNode left = payload.putObject("left");
        left.put("character", text(data, "menu_text"));
        putNonEmptyOrNull(left, "parenthetical", text(data, "stage_directions"));
        left.put("dialogue", text(data, "text"));
        ObjectNode right = payload.putObject("right");
        right.put("character", text(dual, "menu_text"));
        putNonEmptyOrNull(right, "parenthetical", text(dual, "stage_directions"));
        right.put("dialogue", text(dual, "text"));
        return new ElementSpec(ElementType.DUAL_DIALOGUE, "", payload, id);
    }

    private ElementSpec mapCondition(UUID id, JsonNode data) {
        ObjectNode payload = NODES.objectNode();
        JsonNode condition = data.get("condition");
        payload.set("condition", condition != null && !condition.isNull()
                ? condition.deepCopy()
                : ForwardNodeMapper.emptyCondition());
        return new ElementSpec(ElementType.CONDITIONAL, "", payload, id);
    }

    private ElementSpec mapInstruction(UUID id, JsonNode data) {
        ObjectNode payload = NODES.objectNode();
        JsonNode assignments = data.get("assignments");
        payload.set("assignments", assignments != null && !assignments.isNull()
                ? assignments.deepCopy()
                : NODES.arrayNode());
        return new ElementSpec(ElementType.INSTRUCTION, "", payload, id);
    }

    private ElementSpec mapHub(UUID id, JsonNode data) {
        ObjectNode payload = NODES.objectNode();
        payload.put("hub_node_id", text(data, "hub_id"));
        String color = text(data, "color");
        payload.put("color", color.isEmpty() ? ForwardNodeMapper.DEFAULT_HUB_COLOR : color);
        return new ElementSpec(ElementType.HUB_MARKER, text(data, "label"), payload, id);
    }

    private ElementSpec mapJump(UUID id, JsonNode data) {
        ObjectNode payload = NODES.objectNode();
        payload.put("target_hub_id", text(data, "target_hub_id"));
        return new ElementSpec(ElementType.JUMP_MARKER, "", payload, id);
    }

    private static void putNonEmptyOrNull(ObjectNode target, String field, String value) {
        if (value.isEmpty()) {
            target.putNull(field);
        } else {
            target.put(field, value);
        }
    }

    private static String text(JsonNode data, String field) {
        if (data == null) {
            return "";
        }
        JsonNode value = data.get(field);
        return value == null || value.isNull() ? "" : value.asText();
    }
}
