package uk.gegc.scriptflow.features.flowsync.infra.grouping;

import org.springframework.stereotype.Component;
import uk.gegc.scriptflow.features.flowsync.domain.model.ElementGroup;
import uk.gegc.scriptflow.features.flowsync.domain.model.GroupKind;
import uk.gegc.scriptflow.features.screenplay.domain.model.ElementType;
import uk.gegc.scriptflow.features.screenplay.domain.model.ScreenplayElement;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a page's ordered elements into groups that each convert into at most one flow node.
 * <p>
 * A dialogue group is {@code CHARACTER [PARENTHETICAL] DIALOGUE [RESPONSE]}. A character,
 * parenthetical or dialogue that does not complete such a run is reported as non-mappeable.
 * Every other element forms a group of its own.
 */
@Component
public class ElementGrouper {

    public List<ElementGroup> group(List<ScreenplayElement> elements) {
        List<ElementGroup> groups = new ArrayList<>();
        int index = 0;
        while (index < elements.size()) {
            ScreenplayElement element = elements.get(index);
            if (element.getType() == ElementType.CHARACTER) {
                int end = dialogueRunEnd(elements, index);
                if (end > index) {
                    groups.add(new ElementGroup(GroupKind.DIALOGUE_GROUP, elements.subList(index, end)));
                    index = end;
                    continue;
                }
            }
            groups.add(new ElementGroup(standaloneKind(element.getType()), List.of(element)));
            index++;
        }
        return groups;
    }

    // Exclusive end of the dialogue run starting at the character, or start when it is incomplete.
    private int dialogueRunEnd(List<ScreenplayElement> elements, int start) {
        int cursor = start + 1;
        if (typeAt(elements, cursor) == ElementType.PARENTHETICAL) {
            cursor++;
        }
        if (typeAt(elements, cursor) != ElementType.DIALOGUE) {
            return start;
        }
        cursor++;
        if (typeAt(elements, cursor) == ElementType.RESPONSE) {
            cursor++;
        }
        return cursor;
    }

    private ElementType typeAt(List<ScreenplayElement> elements, int index) {
        return index < elements.size() ? elements.get(index).getType() : null;
    }

    private GroupKind standaloneKind(ElementType type) {
        return switch (type) {
            case SCENE_HEADING -> GroupKind.SCENE_HEADING;
            case ACTION -> GroupKind.ACTION;
            case CONDITIONAL -> GroupKind.CONDITIONAL;
            case INSTRUCTION -> GroupKind.INSTRUCTION;
            case RESPONSE -> GroupKind.RESPONSE;
            case TRANSITION -> GroupKind.TRANSITION;
            case HUB_MARKER -> GroupKind.HUB_MARKER;
            case JUMP_MARKER -> GroupKind.JUMP_MARKER;
            case DUAL_DIALOGUE -> GroupKind.DUAL_DIALOGUE;
            case CHARACTER, PARENTHETICAL, DIALOGUE, NOTE, SECTION, PAGE_BREAK, TITLE_PAGE -> GroupKind.NON_MAPPEABLE;
        };
    }
}
