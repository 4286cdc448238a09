package dev.aparikh.semanticmail.api;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;

/**
 * Request DTO for semantic email search.
 */
@Schema(description = "Semantic search request parameters")
public record SemanticSearchRequest(
        @NotBlank(message = "userId is required")
        @Schema(description = "User whose mail is searched", example = "user-42",
                requiredMode = Schema.RequiredMode.REQUIRED)
        String userId,

        @NotBlank(message = "query is required")
        @Schema(description = "Natural-language question", example = "when is the budget review?",
                requiredMode = Schema.RequiredMode.REQUIRED)
        String query,

        @Positive(message = "limit must be positive")
        @Max(value = 100, message = "limit must be at most 100")
        @Schema(description = "Maximum number of hits", example = "10", defaultValue = "10")
        Integer limit,

        @DecimalMin(value = "-1.0", message = "threshold must be >= -1")
        @DecimalMax(value = "1.0", message = "threshold must be <= 1")
        @Schema(description = "Minimum cosine similarity", example = "0.7", defaultValue = "0.7")
        Double threshold
) {
}
