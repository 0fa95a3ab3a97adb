package uk.gegc.scriptflow.features.flowsync.infra.mapping;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import uk.gegc.scriptflow.features.flow.domain.model.FlowNodeType;
import uk.gegc.scriptflow.features.flowsync.domain.model.ElementGroup;
import uk.gegc.scriptflow.features.flowsync.domain.model.GroupKind;
import uk.gegc.scriptflow.features.flowsync.domain.model.NodeSpec;
import uk.gegc.scriptflow.features.screenplay.domain.model.ElementType;
import uk.gegc.scriptflow.features.screenplay.domain.model.ScreenplayElement;
import uk.gegc.scriptflow.shared.exception.InvalidGroupException;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Converts element groups into flow node specifications.
 */
@Component
@RequiredArgsConstructor
public class ForwardNodeMapper {

    public static final String DEFAULT_EXIT_COLOR = "#22c55e";
    public static final String DEFAULT_HUB_COLOR = "#8b5cf6";

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private final ResponseChoiceCodec choiceCodec;

    /**
     * Maps a page's groups in order. On the root page the first scene heading becomes the entry node.
     */
    public List<NodeSpec> toNodeSpecs(List<ElementGroup> groups, boolean rootPage) {
        List<NodeSpec> specs = new ArrayList<>();
        boolean entryPending = rootPage;
        for (ElementGroup group : groups) {
            boolean asEntry = entryPending && group.kind() == GroupKind.SCENE_HEADING;
            if (asEntry) {
                entryPending = false;
            }
            toNodeSpec(group, asEntry).ifPresent(specs::add);
        }
        return specs;
    }

    public Optional<NodeSpec> toNodeSpec(ElementGroup group, boolean asEntry) {
        return switch (group.kind()) {
            case DIALOGUE_GROUP -> Optional.of(mapDialogueGroup(group));
            case SCENE_HEADING -> Optional.of(asEntry ? mapEntry(group) : mapScene(group));
            case ACTION -> Optional.of(mapAction(group));
            case CONDITIONAL -> Optional.of(mapConditional(group));
            case INSTRUCTION -> Optional.of(mapInstruction(group));
            case RESPONSE -> Optional.of(mapOrphanResponse(group));
            case TRANSITION -> Optional.of(mapTransition(group));
            case HUB_MARKER -> Optional.of(mapHubMarker(group));
            case JUMP_MARKER -> Optional.of(mapJumpMarker(group));
            case DUAL_DIALOGUE -> Optional.of(mapDualDialogue(group));
            case NON_MAPPEABLE -> Optional.empty();
        };
    }

    private NodeSpec mapDialogueGroup(ElementGroup group) {
        ScreenplayElement character = group.find(ElementType.CHARACTER)
                .orElseThrow(() -> new InvalidGroupException("Dialogue group has no character element"));
        ScreenplayElement dialogue = group.find(ElementType.DIALOGUE)
                .orElseThrow(() -> new InvalidGroupException("Dialogue group has no dialogue element"));
        String stageDirections = group.find(ElementType.PARENTHETICAL).map(this::contentOf).orElse("");
        ArrayNode responses = group.find(ElementType.RESPONSE)
                .map(response -> choiceCodec.toNodeResponses(response.getData()))
                .orElseGet(NODES::arrayNode);

        ObjectNode data = dialoguePayload(
                field(character.getData(), "sheet_id"),
                contentOf(dialogue),
                stageDirections,
                contentOf(character),
                responses);
        return new NodeSpec(FlowNodeType.DIALOGUE, data, group.elementIds());
    }

    private NodeSpec mapEntry(ElementGroup group) {
        single(group);
        return new NodeSpec(FlowNodeType.ENTRY, NODES.objectNode(), group.elementIds());
    }

    private NodeSpec mapScene(ElementGroup group) {
        SceneHeadingFormat.SceneHeading heading = SceneHeadingFormat.parse(contentOf(single(group)));
        ObjectNode data = NODES.objectNode();
        data.putNull("location_sheet_id");
        data.put("int_ext", heading.intExt());
        data.put("sub_location", "");
        data.put("time_of_day", heading.timeOfDay());
        data.put("description", heading.description());
        data.put("technical_id", "");
        return new NodeSpec(FlowNodeType.SCENE, data, group.elementIds());
    }

    private NodeSpec mapAction(ElementGroup group) {
        ObjectNode data = dialoguePayload(null, "", contentOf(single(group)), "", NODES.arrayNode());
        return new NodeSpec(FlowNodeType.DIALOGUE, data, group.elementIds());
    }

    private NodeSpec mapConditional(ElementGroup group) {
        JsonNode condition = field(single(group).getData(), "condition");
        ObjectNode data = NODES.objectNode();
        data.set("condition", condition != null ? condition.deepCopy() : emptyCondition());
        data.put("switch_mode", false);
        return new NodeSpec(FlowNodeType.CONDITION, data, group.elementIds());
    }

    private NodeSpec mapInstruction(ElementGroup group) {
        JsonNode assignments = field(single(group).getData(), "assignments");
        ObjectNode data = NODES.objectNode();
        data.set("assignments", assignments != null ? assignments.deepCopy() : NODES.arrayNode());
        data.put("description", "");
        return new NodeSpec(FlowNodeType.INSTRUCTION, data, group.elementIds());
    }

    private NodeSpec mapOrphanResponse(ElementGroup group) {
        ArrayNode responses = choiceCodec.toNodeResponses(single(group).getData());
        ObjectNode data = dialoguePayload(null, "", "", "", responses);
        return new NodeSpec(FlowNodeType.DIALOGUE, data, group.elementIds());
    }

    private NodeSpec mapTransition(ElementGroup group) {
        ObjectNode data = NODES.objectNode();
        data.put("label", contentOf(single(group)));
        data.put("technical_id", "");
        data.putArray("outcome_tags");
        data.put("outcome_color", DEFAULT_EXIT_COLOR);
        data.put("exit_mode", "terminal");
        data.putNull("referenced_flow_id");
        return new NodeSpec(FlowNodeType.EXIT, data, group.elementIds());
    }

    private NodeSpec mapHubMarker(ElementGroup group) {
        ScreenplayElement marker = single(group);
        ObjectNode data = NODES.objectNode();
        data.put("hub_id", textOr(field(marker.getData(), "hub_node_id"), ""));
        data.put("label", contentOf(marker));
        data.put("color", textOr(field(marker.getData(), "color"), DEFAULT_HUB_COLOR));
        return new NodeSpec(FlowNodeType.HUB, data, group.elementIds());
    }

    private NodeSpec mapJumpMarker(ElementGroup group) {
        ObjectNode data = NODES.objectNode();
        data.put("target_hub_id", textOr(field(single(group).getData(), "target_hub_id"), ""));
        return new NodeSpec(FlowNodeType.JUMP, data, group.elementIds());
    }

    private NodeSpec mapDualDialogue(ElementGroup group) {
        JsonNode payload = single(group).getData();
        JsonNode left = field(payload, "left");
        JsonNode right = field(payload, "right");

        ObjectNode data = dialoguePayload(
                null,
                textOr(field(left, "dialogue"), ""),
                textOr(field(left, "parenthetical"), ""),
                textOr(field(left, "character"), ""),
                NODES.arrayNode());
        ObjectNode dual = data.putObject("dual_dialogue");
        dual.put("text", textOr(field(right, "dialogue"), ""));
        dual.put("stage_directions", textOr(field(right, "parenthetical"), ""));
        dual.put("menu_text", textOr(field(right, "character"), ""));
        return new NodeSpec(FlowNodeType.DIALOGUE, data, group.elementIds());
    }

    private ObjectNode dialoguePayload(JsonNode speakerSheetId,
                                       String text,
                                       String stageDirections,
                                       String menuText,
                                       ArrayNode responses) {
        ObjectNode data = NODES.objectNode();
        data.set("speaker_sheet_id", speakerSheetId != null ? speakerSheetId.deepCopy() : NullNode.getInstance());
        data.put("text", text);
        data.put("stage_directions", stageDirections);
        data.put("menu_text", menuText);
        data.putNull("audio_asset_id");
        data.put("technical_id", "");
        data.put("localization_id", "");
        data.put("input_condition", "");
        data.put("output_instruction", "");
        data.set("responses", responses);
        return data;
    }

    static ObjectNode emptyCondition() {
        ObjectNode condition = NODES.objectNode();
        condition.put("logic", "all");
        condition.putArray("rules");
        return condition;
    }

    private ScreenplayElement single(ElementGroup group) {
        if (group.elements().size() != 1) {
            throw new InvalidGroupException("Group " + group.kind() + " must hold exactly one element but has "
                    + group.elements().size());
        }
        return group.first();
    }

    private String contentOf(ScreenplayElement element) {
        return element.getContent() != null ? element.getContent() : "";
    }

    private static JsonNode field(JsonNode data, String name) {
        if (data == null || !data.isObject()) {
            return null;
        }
        JsonNode value = data.get(name);
        return value == null || value.isNull() ? null : value;
    }

    private static String textOr(JsonNode value, String fallback) {
        return value != null ? value.asText() : fallback;
    }
}
