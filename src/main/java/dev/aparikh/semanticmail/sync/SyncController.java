package dev.aparikh.semanticmail.sync;

import dev.aparikh.semanticmail.api.ErrorResponse;
import dev.aparikh.semanticmail.api.SyncRequest;
import dev.aparikh.semanticmail.api.SyncResponse;
import dev.aparikh.semanticmail.mailbox.MailboxCredentials;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * REST Controller that triggers mailbox sync runs.
 */
@RestController
@RequestMapping("/api/indexing")
@Tag(name = "Indexing", description = "Mailbox sync runs")
public class SyncController {

    private static final String BEARER_PREFIX = "Bearer ";

    private final SyncOrchestrator orchestrator;

    public SyncController(SyncOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @PostMapping(value = "/sync", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(
            summary = "Sync a mailbox",
            description = "Fetches messages sent since the user's last sync (or since fromDate), filters, " +
                    "chunks and embeds them. Returns a summary even when some messages failed to embed."
    )
    @ApiResponses(value = {
            @ApiResponse(
                    responseCode = "200",
                    description = "Sync completed, possibly with per-message failures",
                    content = @Content(schema = @Schema(implementation = SyncResponse.class))
            ),
            @ApiResponse(
                    responseCode = "400",
                    description = "Invalid sync parameters",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class))
            ),
            @ApiResponse(
                    responseCode = "401",
                    description = "Missing or expired mailbox credentials",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class))
            ),
            @ApiResponse(
                    responseCode = "409",
                    description = "A sync is already running for this user",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class))
            ),
            @ApiResponse(
                    responseCode = "503",
                    description = "Mailbox, embedding provider or index unavailable",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class))
            )
    })
    public ResponseEntity<SyncResponse> sync(
            @Parameter(description = "Mailbox access token as 'Bearer <token>'", required = true)
            @RequestHeader(HttpHeaders.AUTHORIZATION) String authorization,
            @Parameter(description = "Sync request", required = true)
            @Valid @RequestBody SyncRequest request) {

        MailboxCredentials credentials = MailboxCredentials.bearer(bearerToken(authorization));
        SyncSummary summary = orchestrator.run(request.userId(), credentials, request.fromDate());
        return ResponseEntity.ok(SyncResponse.from(summary));
    }

    @GetMapping(value = "/state", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Current sync state", description = "Stage of the user's current or last sync run.")
    public ResponseEntity<Map<String, SyncState>> state(@RequestParam String userId) {
        return ResponseEntity.ok(Map.of("state", orchestrator.currentState(userId)));
    }

    private static String bearerToken(String authorization) {
        if (authorization == null || !authorization.startsWith(BEARER_PREFIX)
                || authorization.substring(BEARER_PREFIX.length()).isBlank()) {
            throw new SyncException(SyncException.Reason.AUTH_EXPIRED, "Authorization header must carry a bearer token");
        }
        return authorization.substring(BEARER_PREFIX.length()).trim();
    }
}
