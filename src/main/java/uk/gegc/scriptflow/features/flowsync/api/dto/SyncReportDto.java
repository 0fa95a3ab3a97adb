package uk.gegc.scriptflow.features.flowsync.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.UUID;

@Schema(description = "Changes applied by one push or pull. All counts are zero when nothing changed.")
public record SyncReportDto(
        @Schema(description = "Root screenplay identifier")
        UUID screenplayId,

        @Schema(description = "Flow identifier")
        UUID flowId,

        @Schema(description = "Flow nodes created", example = "3")
        int nodesCreated,

        @Schema(description = "Synced flow nodes whose type or data changed", example = "1")
        int nodesUpdated,

        @Schema(description = "Synced flow nodes removed", example = "0")
        int nodesDeleted,

        @Schema(description = "Connections created", example = "2")
        int connectionsCreated,

        @Schema(description = "Connections removed", example = "0")
        int connectionsDeleted,

        @Schema(description = "Screenplay elements created", example = "0")
        int elementsCreated,

        @Schema(description = "Screenplay elements whose content, data or position changed", example = "0")
        int elementsUpdated,

        @Schema(description = "Screenplay elements removed", example = "0")
        int elementsDeleted,

        @Schema(description = "Child pages created for unlinked branches", example = "0")
        int pagesCreated
) {

    public boolean isNoop() {
        return nodesCreated == 0 && nodesUpdated == 0 && nodesDeleted == 0
                && connectionsCreated == 0 && connectionsDeleted == 0
                && elementsCreated == 0 && elementsUpdated == 0 && elementsDeleted == 0
                && pagesCreated == 0;
    }
}
