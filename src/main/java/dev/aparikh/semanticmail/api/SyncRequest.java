package dev.aparikh.semanticmail.api;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;

import java.time.Instant;

/**
 * Request DTO for starting a mailbox sync.
 */
@Schema(description = "Mailbox sync request")
public record SyncRequest(
        @NotBlank(message = "userId is required")
        @Schema(description = "User whose mailbox is synced", example = "user-42",
                requiredMode = Schema.RequiredMode.REQUIRED)
        String userId,

        @Schema(description = "Sync messages sent after this instant instead of the stored cursor",
                example = "2025-01-01T00:00:00Z")
        Instant fromDate
) {
}
