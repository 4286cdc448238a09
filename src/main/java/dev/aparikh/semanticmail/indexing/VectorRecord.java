package dev.aparikh.semanticmail.indexing;

import dev.aparikh.semanticmail.model.TextChunk;

import java.util.List;
import java.util.Map;

/**
 * Embedding of one email plus the chunks it was computed from. {@code metadata} holds
 * free-form attributes of the vectorization such as the model name.
 */
public record VectorRecord(
        String id,
        float[] embedding,
        List<TextChunk> chunks,
        Map<String, String> metadata
) {
    public VectorRecord {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id must be provided");
        }
        if (embedding == null || embedding.length == 0) {
            throw new IllegalArgumentException("embedding must be provided");
        }
        chunks = chunks == null ? List.of() : List.copyOf(chunks);
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }
}
