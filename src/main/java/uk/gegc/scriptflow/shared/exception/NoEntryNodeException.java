package uk.gegc.scriptflow.shared.exception;

import java.util.UUID;

public class NoEntryNodeException extends FlowSyncException {

    public NoEntryNodeException(String message) {
        super(FlowSyncError.NO_ENTRY_NODE, message);
    }

    public NoEntryNodeException(UUID flowId) {
        this("Flow " + flowId + " has no entry node");
    }
}
