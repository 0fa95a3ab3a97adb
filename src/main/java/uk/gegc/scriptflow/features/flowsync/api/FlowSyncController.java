package uk.gegc.scriptflow.features.flowsync.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ProblemDetail;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import uk.gegc.scriptflow.features.flowsync.api.dto.FlowLinkDto;
import uk.gegc.scriptflow.features.flowsync.api.dto.LinkFlowRequest;
import uk.gegc.scriptflow.features.flowsync.api.dto.SyncReportDto;
import uk.gegc.scriptflow.features.flowsync.application.FlowSyncService;

import java.util.UUID;

@RestController
@RequestMapping("/api/v1/screenplays/{screenplayId}/flow")
@Validated
@RequiredArgsConstructor
@Tag(name = "Screenplay Flow Sync", description = "Link screenplays to flows and synchronize them in either direction")
public class FlowSyncController {

    private final FlowSyncService flowSyncService;

    @Operation(summary = "Get or create the linked flow",
            description = "Returns the flow linked to the screenplay, creating and linking an empty flow when none exists")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Flow linked",
                    content = @Content(schema = @Schema(implementation = FlowLinkDto.class))),
            @ApiResponse(responseCode = "404", description = "Screenplay or linked flow not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping
    public FlowLinkDto ensureFlow(
            @Parameter(description = "Root screenplay ID") @PathVariable UUID screenplayId) {
        return flowSyncService.ensureFlow(screenplayId);
    }

    @Operation(summary = "Link to an existing flow")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Flow linked",
                    content = @Content(schema = @Schema(implementation = FlowLinkDto.class))),
            @ApiResponse(responseCode = "400", description = "Invalid request body",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "404", description = "Screenplay or flow not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PutMapping
    public FlowLinkDto linkToFlow(
            @Parameter(description = "Root screenplay ID") @PathVariable UUID screenplayId,
            @Valid @RequestBody LinkFlowRequest request) {
        return flowSyncService.linkToFlow(screenplayId, request.flowId());
    }

    @Operation(summary = "Unlink from the flow",
            description = "Clears the flow link and all element node links. The flow and its nodes are kept.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Screenplay unlinked",
                    content = @Content(schema = @Schema(implementation = FlowLinkDto.class))),
            @ApiResponse(responseCode = "404", description = "Screenplay not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @DeleteMapping
    public FlowLinkDto unlinkFlow(
            @Parameter(description = "Root screenplay ID") @PathVariable UUID screenplayId) {
        return flowSyncService.unlinkFlow(screenplayId);
    }

    @Operation(summary = "Push screenplay to flow")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Flow updated",
                    content = @Content(schema = @Schema(implementation = SyncReportDto.class))),
            @ApiResponse(responseCode = "404", description = "Screenplay or linked flow not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "422", description = "Screenplay contains an element group that cannot be converted",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/push")
    public SyncReportDto push(
            @Parameter(description = "Root screenplay ID") @PathVariable UUID screenplayId) {
        return flowSyncService.syncToFlow(screenplayId);
    }

    @Operation(summary = "Pull flow into screenplay")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Screenplay updated",
                    content = @Content(schema = @Schema(implementation = SyncReportDto.class))),
            @ApiResponse(responseCode = "404", description = "Screenplay or linked flow not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "409", description = "Screenplay is not linked to a flow",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "422", description = "Flow has no entry node",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/pull")
    public SyncReportDto pull(
            @Parameter(description = "Root screenplay ID") @PathVariable UUID screenplayId) {
        return flowSyncService.syncFromFlow(screenplayId);
    }
}
