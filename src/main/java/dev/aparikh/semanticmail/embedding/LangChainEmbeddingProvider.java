package dev.aparikh.semanticmail.embedding;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.exception.AuthenticationException;
import dev.langchain4j.exception.NonRetriableException;
import dev.langchain4j.exception.RateLimitException;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * {@link EmbeddingProvider} backed by a LangChain4j {@link EmbeddingModel}. Requests larger
 * than {@code maxBatchSize} are split; LangChain4j exceptions are translated into
 * {@link EmbeddingException} reasons.
 */
public class LangChainEmbeddingProvider implements EmbeddingProvider {

    private static final Logger log = LoggerFactory.getLogger(LangChainEmbeddingProvider.class);

    private final EmbeddingModel model;
    private final int dimension;
    private final int maxBatchSize;

    public LangChainEmbeddingProvider(EmbeddingModel model, int dimension, int maxBatchSize) {
        if (dimension < 1 || maxBatchSize < 1) {
            throw new IllegalArgumentException("dimension and maxBatchSize must be >= 1");
        }
        this.model = model;
        this.dimension = dimension;
        this.maxBatchSize = maxBatchSize;
    }

    @Override
    public List<float[]> embedAll(List<String> texts) {
        if (texts == null || texts.isEmpty()) return List.of();
        for (String text : texts) {
            if (text == null || text.isBlank()) {
                throw new EmbeddingException(EmbeddingException.Reason.REJECTED, "Text cannot be empty");
            }
        }

        List<float[]> vectors = new ArrayList<>(texts.size());
        for (int i = 0; i < texts.size(); i += maxBatchSize) {
            List<TextSegment> batch = texts.subList(i, Math.min(i + maxBatchSize, texts.size())).stream()
                    .map(TextSegment::from)
                    .toList();
            vectors.addAll(embedBatch(batch));
        }
        return vectors;
    }

    private List<float[]> embedBatch(List<TextSegment> segments) {
        Response<List<Embedding>> response;
        try {
            response = model.embedAll(segments);
        } catch (AuthenticationException e) {
            throw new EmbeddingException(EmbeddingException.Reason.AUTH, "Embedding provider rejected the API key", e);
        } catch (RateLimitException e) {
            throw new EmbeddingException(EmbeddingException.Reason.RATE_LIMITED, "Embedding provider rate limit hit", e);
        } catch (NonRetriableException e) {
            throw new EmbeddingException(EmbeddingException.Reason.REJECTED, "Embedding request rejected: " + e.getMessage(), e);
        } catch (RuntimeException e) {
            throw new EmbeddingException(EmbeddingException.Reason.UNAVAILABLE, "Embedding provider failed: " + e.getMessage(), e);
        }

        List<Embedding> embeddings = response.content();
        if (embeddings == null || embeddings.size() != segments.size()) {
            throw new EmbeddingException(EmbeddingException.Reason.UNAVAILABLE,
                    "Embedding provider returned " + (embeddings == null ? 0 : embeddings.size())
                            + " vectors for " + segments.size() + " inputs");
        }
        List<float[]> vectors = new ArrayList<>(embeddings.size());
        for (Embedding e : embeddings) {
            float[] v = e.vector();
            if (v.length != dimension) {
                throw new EmbeddingException(EmbeddingException.Reason.REJECTED,
                        "Expected " + dimension + " dimensions but got " + v.length);
            }
            vectors.add(v);
        }
        log.debug("Embedded {} segments", segments.size());
        return vectors;
    }

    @Override
    public int dimension() {
        return dimension;
    }
}
