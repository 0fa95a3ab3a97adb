package uk.gegc.scriptflow.features.flowsync.domain.model;

import uk.gegc.scriptflow.features.screenplay.domain.model.ScreenplayElement;

import java.util.List;
import java.util.UUID;

/**
 * A page, its ordered elements and its child pages as loaded for one push.
 */
public record PageSnapshot(UUID screenplayId, List<ScreenplayElement> elements, List<PageSnapshot> children) {

    public PageSnapshot {
        elements = List.copyOf(elements);
        children = List.copyOf(children);
    }
}
