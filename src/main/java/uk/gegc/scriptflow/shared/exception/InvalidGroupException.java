package uk.gegc.scriptflow.shared.exception;

public class InvalidGroupException extends FlowSyncException {

    public InvalidGroupException(String message) {
        super(FlowSyncError.INVALID_GROUP, message);
    }

    public InvalidGroupException(String message, Throwable cause) {
        super(FlowSyncError.INVALID_GROUP, message, cause);
    }
}
