package uk.gegc.scriptflow.features.screenplay.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import uk.gegc.scriptflow.shared.exception.InvalidGroupException;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

public enum ElementType {
    SCENE_HEADING("scene_heading"),
    ACTION("action"),
    CHARACTER("character"),
    DIALOGUE("dialogue"),
    PARENTHETICAL("parenthetical"),
    TRANSITION("transition"),
    DUAL_DIALOGUE("dual_dialogue"),
    NOTE("note"),
    SECTION("section"),
    PAGE_BREAK("page_break"),
    TITLE_PAGE("title_page"),
    CONDITIONAL("conditional"),
    INSTRUCTION("instruction"),
    RESPONSE("response"),
    HUB_MARKER("hub_marker"),
    JUMP_MARKER("jump_marker");

    private static final Set<ElementType> NON_MAPPEABLE = EnumSet.of(NOTE, SECTION, PAGE_BREAK, TITLE_PAGE);

    private final String value;

    ElementType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Writer-only element kinds that never produce a flow node and are never rewritten by a pull.
     */
    public boolean isNonMappeable() {
        return NON_MAPPEABLE.contains(this);
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static ElementType fromValue(String rawValue) {
        if (rawValue == null || rawValue.isBlank()) {
            throw new InvalidGroupException("Screenplay element type is missing");
        }
        String normalized = normalize(rawValue);
        return Arrays.stream(values())
                .filter(type -> type.value.equals(normalized) || normalize(type.name()).equals(normalized))
                .findFirst()
                .orElseThrow(() -> new InvalidGroupException("Unknown screenplay element type: " + rawValue));
    }

    private static String normalize(String input) {
        return input.trim()
                .toLowerCase(Locale.ROOT)
                .replace('-', '_')
                .replace(' ', '_');
    }
}
