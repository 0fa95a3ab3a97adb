package uk.gegc.scriptflow.shared.exception;

import java.util.UUID;

public class NotLinkedException extends FlowSyncException {

    public NotLinkedException(UUID screenplayId) {
        super(FlowSyncError.NOT_LINKED, "Screenplay " + screenplayId + " is not linked to a flow");
    }
}
