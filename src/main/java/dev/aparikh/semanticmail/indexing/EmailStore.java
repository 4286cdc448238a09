package dev.aparikh.semanticmail.indexing;

import dev.aparikh.semanticmail.model.IndexedEmail;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Persistence for {@link IndexedEmail} rows.
 */
public interface EmailStore {

    /** Provider ids of every row the user already has. */
    Set<String> findExternalIds(String userId);

    /**
     * Creates or overwrites the rows and makes them durable before returning.
     */
    void saveAll(List<IndexedEmail> emails);

    Optional<IndexedEmail> findById(String id);
}
