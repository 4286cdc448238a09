package dev.aparikh.semanticmail.api;

import dev.aparikh.semanticmail.search.SearchHit;
import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

@Schema(description = "Semantic search response")
public record SemanticSearchResponse(
        @Schema(description = "Hits ranked by similarity, best first")
        List<SearchHit> hits
) {
}
