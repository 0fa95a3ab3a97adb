package uk.gegc.scriptflow.features.flow.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import uk.gegc.scriptflow.shared.exception.InvalidNodeTypeException;

import java.util.Arrays;
import java.util.Locale;

public enum FlowNodeType {
    ENTRY("entry"),
    SCENE("scene"),
    DIALOGUE("dialogue"),
    CONDITION("condition"),
    INSTRUCTION("instruction"),
    EXIT("exit"),
    HUB("hub"),
    JUMP("jump"),
    SUBFLOW("subflow");

    private final String value;

    FlowNodeType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static FlowNodeType fromValue(String rawValue) {
        if (rawValue == null || rawValue.isBlank()) {
            throw new InvalidNodeTypeException("Flow node type is missing");
        }
        String normalized = rawValue.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(type -> type.value.equals(normalized))
                .findFirst()
                .orElseThrow(() -> new InvalidNodeTypeException("Unknown flow node type: " + rawValue));
    }
}
