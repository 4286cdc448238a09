package dev.aparikh.semanticmail.indexing;

import dev.aparikh.semanticmail.config.SolrConfigurationProperties;
import dev.aparikh.semanticmail.model.RunStatus;
import dev.aparikh.semanticmail.model.SyncCursor;
import org.apache.solr.client.solrj.SolrClient;
import org.apache.solr.client.solrj.SolrServerException;
import org.apache.solr.common.SolrDocument;
import org.apache.solr.common.SolrException;
import org.apache.solr.common.SolrInputDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Instant;
import java.util.Date;
import java.util.Optional;

/**
 * Keeps one {@link SyncCursor} document per user in its own core, keyed by user id.
 */
@Service
public class SolrSyncCursorStore implements SyncCursorStore {

    private static final Logger log = LoggerFactory.getLogger(SolrSyncCursorStore.class);

    private final SolrClient solr;
    private final String core;

    public SolrSyncCursorStore(SolrClient solr, SolrConfigurationProperties properties) {
        this.solr = solr;
        this.core = properties.getCursorsCore();
    }

    @Override
    public Optional<SyncCursor> load(String userId) {
        SolrDocument d;
        try {
            d = solr.getById(core, userId);
        } catch (SolrServerException | IOException e) {
            throw new StoreException(StoreException.Reason.UNAVAILABLE, "Failed to load cursor of " + userId, e);
        } catch (SolrException e) {
            throw translate(e);
        }
        if (d == null) return Optional.empty();

        String status = (String) d.getFieldValue(SyncCursor.FIELD_LAST_RUN_STATUS);
        return Optional.of(new SyncCursor(
                userId,
                toInstant(d.getFieldValue(SyncCursor.FIELD_LAST_SYNCED_AT)),
                status == null ? null : RunStatus.valueOf(status),
                toInstant(d.getFieldValue(SyncCursor.FIELD_UPDATED_AT))));
    }

    @Override
    public void save(SyncCursor cursor) {
        SolrInputDocument d = new SolrInputDocument();
        d.addField(SyncCursor.FIELD_ID, cursor.userId());
        if (cursor.lastSyncedAt() != null) {
            d.addField(SyncCursor.FIELD_LAST_SYNCED_AT, Date.from(cursor.lastSyncedAt()));
        }
        if (cursor.lastRunStatus() != null) {
            d.addField(SyncCursor.FIELD_LAST_RUN_STATUS, cursor.lastRunStatus().name());
        }
        if (cursor.updatedAt() != null) {
            d.addField(SyncCursor.FIELD_UPDATED_AT, Date.from(cursor.updatedAt()));
        }
        try {
            solr.add(core, d);
            solr.commit(core);
        } catch (SolrServerException | IOException e) {
            throw new StoreException(StoreException.Reason.UNAVAILABLE, "Failed to save cursor of " + cursor.userId(), e);
        } catch (SolrException e) {
            throw translate(e);
        }
        log.debug("Saved cursor {} for user {}", cursor.lastSyncedAt(), cursor.userId());
    }

    private static StoreException translate(SolrException e) {
        StoreException.Reason reason = e.code() >= 500
                ? StoreException.Reason.UNAVAILABLE
                : StoreException.Reason.REJECTED;
        return new StoreException(reason, "Solr refused cursor request: " + e.getMessage(), e);
    }

    private static Instant toInstant(Object value) {
        return value instanceof Date date ? date.toInstant() : null;
    }
}
