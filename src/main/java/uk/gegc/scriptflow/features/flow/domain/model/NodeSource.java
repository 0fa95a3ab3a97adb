package uk.gegc.scriptflow.features.flow.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Who owns a flow node. Only {@link #SCREENPLAY_SYNC} nodes are ever modified or deleted by a push.
 */
public enum NodeSource {
    MANUAL("manual"),
    SCREENPLAY_SYNC("screenplay_sync");

    private final String value;

    NodeSource(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static NodeSource fromValue(String rawValue) {
        if (rawValue == null) {
            return MANUAL;
        }
        return Arrays.stream(values())
                .filter(source -> source.value.equalsIgnoreCase(rawValue.trim()))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown node source: " + rawValue));
    }
}
