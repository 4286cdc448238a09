package dev.aparikh.semanticmail.indexing;

import dev.aparikh.semanticmail.model.SyncCursor;

import java.util.Optional;

public interface SyncCursorStore {

    Optional<SyncCursor> load(String userId);

    void save(SyncCursor cursor);
}
