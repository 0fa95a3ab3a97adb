package uk.gegc.scriptflow.features.flowsync.domain.model;

import uk.gegc.scriptflow.features.screenplay.domain.model.ElementType;
import uk.gegc.scriptflow.features.screenplay.domain.model.ScreenplayElement;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * A run of consecutive screenplay elements that converts into at most one flow node.
 */
public record ElementGroup(GroupKind kind, List<ScreenplayElement> elements) {

    public ElementGroup {
        elements = List.copyOf(elements);
    }

    public Optional<ScreenplayElement> find(ElementType type) {
        return elements.stream().filter(element -> element.getType() == type).findFirst();
    }

    public ScreenplayElement first() {
        return elements.get(0);
    }

    public List<UUID> elementIds() {
        return elements.stream().map(ScreenplayElement::getId).toList();
    }
}
