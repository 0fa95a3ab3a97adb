package uk.gegc.scriptflow.features.flowsync.application;

import uk.gegc.scriptflow.features.flowsync.api.dto.FlowLinkDto;
import uk.gegc.scriptflow.features.flowsync.api.dto.SyncReportDto;

import java.util.UUID;

/**
 * Keeps a screenplay page tree and its linked flow graph in step.
 * <p>
 * Callers must not run a push and a pull for the same flow concurrently. Each operation is
 * transactional: when one fails nothing it wrote is kept.
 */
public interface FlowSyncService {

    /**
     * Returns the linked flow, creating and linking a new empty one when the screenplay has none.
     */
    FlowLinkDto ensureFlow(UUID screenplayId);

    FlowLinkDto linkToFlow(UUID screenplayId, UUID flowId);

    /**
     * Clears the flow link and every element's node link across the page tree. The flow itself is kept.
     */
    FlowLinkDto unlinkFlow(UUID screenplayId);

    /**
     * Push: writes the page tree into the linked flow, creating the flow when needed.
     */
    SyncReportDto syncToFlow(UUID screenplayId);

    /**
     * Pull: rewrites the page tree from the linked flow.
     *
     * @throws uk.gegc.scriptflow.shared.exception.NotLinkedException   when the screenplay has no flow
     * @throws uk.gegc.scriptflow.shared.exception.NoEntryNodeException when the flow has no entry node
     */
    SyncReportDto syncFromFlow(UUID screenplayId);
}
