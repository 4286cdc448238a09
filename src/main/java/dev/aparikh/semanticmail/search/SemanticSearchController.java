package dev.aparikh.semanticmail.search;

import dev.aparikh.semanticmail.api.ErrorResponse;
import dev.aparikh.semanticmail.api.SemanticSearchRequest;
import dev.aparikh.semanticmail.api.SemanticSearchResponse;
import dev.aparikh.semanticmail.api.StatsResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST Controller for semantic search over indexed mail.
 */
@RestController
@RequestMapping("/api/emails")
@Tag(name = "Semantic Search", description = "Nearest-neighbour search and vectorization statistics")
public class SemanticSearchController {

    private final SemanticSearchService searchService;

    public SemanticSearchController(SemanticSearchService searchService) {
        this.searchService = searchService;
    }

    @PostMapping(value = "/semantic-search", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(
            summary = "Semantic email search",
            description = "Embeds the query and returns the user's most similar emails, best first. " +
                    "Hits below the similarity threshold are left out (defaults: limit=10, threshold=0.7)."
    )
    @ApiResponses(value = {
            @ApiResponse(
                    responseCode = "200",
                    description = "Search completed successfully",
                    content = @Content(schema = @Schema(implementation = SemanticSearchResponse.class))
            ),
            @ApiResponse(
                    responseCode = "400",
                    description = "Invalid search parameters",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class))
            ),
            @ApiResponse(
                    responseCode = "503",
                    description = "Embedding provider or index temporarily unavailable",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class))
            )
    })
    public ResponseEntity<SemanticSearchResponse> search(
            @Parameter(description = "Semantic search request", required = true)
            @Valid @RequestBody SemanticSearchRequest request) {

        List<SearchHit> hits = searchService.search(request.userId(), request.query(),
                request.limit(), request.threshold());
        return ResponseEntity.ok(new SemanticSearchResponse(hits));
    }

    @GetMapping(value = "/stats", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(
            summary = "Vectorization statistics",
            description = "Counts the user's non-filtered emails and how many of them are searchable."
    )
    @ApiResponses(value = {
            @ApiResponse(
                    responseCode = "200",
                    description = "Statistics retrieved successfully",
                    content = @Content(schema = @Schema(implementation = StatsResponse.class))
            ),
            @ApiResponse(
                    responseCode = "400",
                    description = "Missing userId",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class))
            )
    })
    public ResponseEntity<StatsResponse> stats(
            @Parameter(description = "User whose statistics are returned", required = true)
            @RequestParam String userId) {
        return ResponseEntity.ok(StatsResponse.from(searchService.stats(userId)));
    }
}
