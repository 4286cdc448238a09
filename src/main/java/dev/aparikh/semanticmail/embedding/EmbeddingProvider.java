package dev.aparikh.semanticmail.embedding;

import java.util.List;

/**
 * Turns text into fixed-size vectors. Batched calls are preferred.
 */
public interface EmbeddingProvider {

    /**
     * Embeds every text, returning vectors in input order.
     *
     * @throws EmbeddingException when the provider fails
     */
    List<float[]> embedAll(List<String> texts);

    default float[] embed(String text) {
        return embedAll(List.of(text)).get(0);
    }

    int dimension();
}
