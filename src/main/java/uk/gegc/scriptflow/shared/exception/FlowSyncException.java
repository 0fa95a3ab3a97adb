package uk.gegc.scriptflow.shared.exception;

import lombok.Getter;

/**
 * Base type for synchronization failures. Each subclass carries a stable {@link FlowSyncError}
 * so callers can branch on the outcome without inspecting messages.
 */
@Getter
public abstract class FlowSyncException extends RuntimeException {

    private final FlowSyncError error;

    protected FlowSyncException(FlowSyncError error, String message) {
        super(message);
        this.error = error;
    }

    protected FlowSyncException(FlowSyncError error, String message, Throwable cause) {
        super(message, cause);
        this.error = error;
    }
}
