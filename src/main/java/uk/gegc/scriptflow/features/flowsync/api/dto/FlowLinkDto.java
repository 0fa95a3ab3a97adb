package uk.gegc.scriptflow.features.flowsync.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.UUID;

@Schema(description = "Association between a root screenplay page and a flow")
public record FlowLinkDto(
        @Schema(description = "Screenplay identifier")
        UUID screenplayId,

        @Schema(description = "Linked flow identifier, null when unlinked")
        UUID flowId,

        @Schema(description = "Linked flow name, null when unlinked", example = "Tavern Encounter")
        String flowName,

        @Schema(description = "Whether the screenplay is currently linked")
        boolean linked
) {

    public static FlowLinkDto unlinked(UUID screenplayId) {
        return new FlowLinkDto(screenplayId, null, null, false);
    }
}
