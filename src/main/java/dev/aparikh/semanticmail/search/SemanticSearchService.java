package dev.aparikh.semanticmail.search;

import dev.aparikh.semanticmail.embedding.EmbeddingProvider;
import dev.aparikh.semanticmail.indexing.VectorStats;
import dev.aparikh.semanticmail.indexing.VectorStore;
import dev.aparikh.semanticmail.sync.RetryExecutor;
import dev.aparikh.semanticmail.text.TextNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Answers nearest-neighbour queries over a user's vectorized mail for the chat layer.
 */
@Service
public class SemanticSearchService {

    private static final Logger log = LoggerFactory.getLogger(SemanticSearchService.class);

    private final EmbeddingProvider embeddings;
    private final VectorStore vectorStore;
    private final RetryExecutor retry;
    private final TextNormalizer normalizer;

    public SemanticSearchService(EmbeddingProvider embeddings, VectorStore vectorStore, RetryExecutor retry,
                                 TextNormalizer normalizer) {
        this.embeddings = embeddings;
        this.vectorStore = vectorStore;
        this.retry = retry;
        this.normalizer = normalizer;
    }

    /**
     * Embeds {@code question} and returns the closest emails of {@code userId}.
     *
     * @param limit     maximum hits, {@link SearchOptions#DEFAULT_LIMIT} when {@code null}
     * @param threshold minimum similarity, {@link SearchOptions#DEFAULT_THRESHOLD} when {@code null}
     */
    public List<SearchHit> search(String userId, String question, Integer limit, Double threshold) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId must be provided");
        }
        String text = normalizer.normalize(question);
        if (text.isEmpty()) {
            throw new IllegalArgumentException("query must not be empty");
        }
        SearchOptions options = SearchOptions.builder()
                .userId(userId)
                .limit(limit != null ? limit : SearchOptions.DEFAULT_LIMIT)
                .threshold(threshold != null ? threshold : SearchOptions.DEFAULT_THRESHOLD)
                .build();

        float[] queryVector = retry.call(RetryExecutor.EMBEDDING, "embed search query", () -> embeddings.embed(text));
        List<SearchHit> hits = vectorStore.search(queryVector, options);
        log.debug("Semantic search for user {} returned {} hits (limit={}, threshold={})",
                userId, hits.size(), options.limit(), options.threshold());
        return hits;
    }

    public VectorStats stats(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId must be provided");
        }
        return vectorStore.stats(userId);
    }
}
