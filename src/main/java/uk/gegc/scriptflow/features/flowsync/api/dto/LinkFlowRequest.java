package uk.gegc.scriptflow.features.flowsync.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;

import java.util.UUID;

@Schema(description = "Request to bind a screenplay to an existing flow")
public record LinkFlowRequest(
        @Schema(description = "Flow identifier", example = "3f1c2a9e-5b7d-4c1e-8a2f-6d9e0b4c7a13")
        @NotNull(message = "flowId must not be null")
        UUID flowId
) {
}
