package dev.aparikh.semanticmail.indexing;

import dev.aparikh.semanticmail.model.IndexedEmail;
import dev.aparikh.semanticmail.model.TextChunk;
import dev.aparikh.semanticmail.search.SearchHit;
import dev.aparikh.semanticmail.search.SearchOptions;

import java.util.List;
import java.util.Map;

/**
 * Embeddings and similarity search over {@link IndexedEmail} rows.
 *
 * <p>Every write sets {@code vectorizedAt} to the time of persistence and replaces any earlier
 * embedding for the same row. Failures surface as {@link StoreException}.</p>
 */
public interface VectorStore {

    default void saveEmbedding(String id, float[] embedding, List<TextChunk> chunks, Map<String, String> metadata) {
        batchSaveEmbeddings(List.of(new VectorRecord(id, embedding, chunks, metadata)));
    }

    /**
     * Upserts each record on its own; a failure part way through may leave earlier records
     * written. Callers must not treat the batch as a transaction.
     */
    void batchSaveEmbeddings(List<VectorRecord> records);

    /**
     * Ranks vectorized, non-filtered rows by cosine similarity to {@code queryEmbedding},
     * highest first, newest {@code sentAt} first on ties. Rows below the threshold are left
     * out; an empty result is not an error.
     */
    List<SearchHit> search(float[] queryEmbedding, SearchOptions options);

    /** Non-filtered rows of the user that have no embedding yet, oldest first. */
    List<IndexedEmail> getPendingVectorization(String userId, int limit);

    VectorStats stats(String userId);

    boolean isVectorized(String id);

    /** Clears embedding, chunks and {@code vectorizedAt} so the row becomes pending again. */
    void deleteEmbedding(String id);
}
