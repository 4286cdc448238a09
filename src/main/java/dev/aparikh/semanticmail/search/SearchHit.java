package dev.aparikh.semanticmail.search;

import dev.aparikh.semanticmail.model.EmailMetadata;
import dev.aparikh.semanticmail.model.TextChunk;

import java.util.List;

/**
 * One ranked search result.
 */
public record SearchHit(
        String id,
        double similarity,
        EmailMetadata metadata,
        List<TextChunk> textChunks
) {
}
