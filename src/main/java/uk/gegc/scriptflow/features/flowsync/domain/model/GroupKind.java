package uk.gegc.scriptflow.features.flowsync.domain.model;

public enum GroupKind {
    DIALOGUE_GROUP,
    SCENE_HEADING,
    ACTION,
    CONDITIONAL,
    INSTRUCTION,
    RESPONSE,
    TRANSITION,
    HUB_MARKER,
    JUMP_MARKER,
    DUAL_DIALOGUE,
    NON_MAPPEABLE
}
