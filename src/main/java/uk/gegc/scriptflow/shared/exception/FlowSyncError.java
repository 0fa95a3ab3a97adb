package uk.gegc.scriptflow.shared.exception;

/**
 * Failure codes reported by the screenplay/flow synchronizer.
 */
public enum FlowSyncError {
    NO_ENTRY_NODE,
    NOT_LINKED,
    INVALID_GROUP,
    INVALID_NODE_TYPE
}
