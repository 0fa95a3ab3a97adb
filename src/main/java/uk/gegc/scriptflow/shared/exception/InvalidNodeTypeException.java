package uk.gegc.scriptflow.shared.exception;

public class InvalidNodeTypeException extends FlowSyncException {

    public InvalidNodeTypeException(String message) {
        super(FlowSyncError.INVALID_NODE_TYPE, message);
    }

    public InvalidNodeTypeException(String message, Throwable cause) {
        super(FlowSyncError.INVALID_NODE_TYPE, message, cause);
    }
}
