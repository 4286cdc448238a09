package dev.aparikh.semanticmail.sync;

import dev.aparikh.semanticmail.config.SyncProperties;
import dev.aparikh.semanticmail.embedding.EmbeddingException;
import dev.aparikh.semanticmail.embedding.EmbeddingProvider;
import dev.aparikh.semanticmail.embedding.Vectors;
import dev.aparikh.semanticmail.error.ErrorKind;
import dev.aparikh.semanticmail.error.PipelineException;
import dev.aparikh.semanticmail.filter.FilterDecision;
import dev.aparikh.semanticmail.filter.FilterEngine;
import dev.aparikh.semanticmail.filter.FilterStats;
import dev.aparikh.semanticmail.indexing.EmailStore;
import dev.aparikh.semanticmail.indexing.SyncCursorStore;
import dev.aparikh.semanticmail.indexing.VectorRecord;
import dev.aparikh.semanticmail.indexing.VectorStore;
import dev.aparikh.semanticmail.mailbox.MailboxCredentials;
import dev.aparikh.semanticmail.mailbox.MailboxException;
import dev.aparikh.semanticmail.mailbox.MailboxSource;
import dev.aparikh.semanticmail.mailbox.MessagePage;
import dev.aparikh.semanticmail.model.FilterReason;
import dev.aparikh.semanticmail.model.IndexedEmail;
import dev.aparikh.semanticmail.model.MailboxMessage;
import dev.aparikh.semanticmail.model.RunStatus;
import dev.aparikh.semanticmail.model.SyncCursor;
import dev.aparikh.semanticmail.model.TextChunk;
import dev.aparikh.semanticmail.sync.MessagePreparer.PreparedEmail;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Drives one user's mailbox sync: fetch, classify, chunk, embed, persist, then commit the cursor.
 *
 * <p>Pages are processed in delivery order. Classification and chunking of the messages of a
 * page run on a bounded worker pool; everything else runs on the calling thread. The cursor
 * is written once at the end of a successful run and never moves backwards. A run-fatal
 * failure leaves {@code lastSyncedAt} where it was, so the next run replays the same window;
 * rows already stored are recognised as duplicates.</p>
 *
 * <p>At most one run per user is active at a time.</p>
 */
public class SyncOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(SyncOrchestrator.class);

    private static final String MDC_USER_ID = "userId";
    private static final String MDC_RUN_ID = "runId";

    private final MailboxSource mailbox;
    private final EmailStore emailStore;
    private final VectorStore vectorStore;
    private final SyncCursorStore cursorStore;
    private final FilterEngine filterEngine;
    private final MessagePreparer preparer;
    private final EmbeddingProvider embeddings;
    private final RetryExecutor retry;
    private final MdcTaskExecutor workers;
    private final SyncProperties properties;
    private final Clock clock;

    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final Map<String, SyncState> states = new ConcurrentHashMap<>();

    public SyncOrchestrator(MailboxSource mailbox, EmailStore emailStore, VectorStore vectorStore,
                            SyncCursorStore cursorStore, FilterEngine filterEngine, MessagePreparer preparer,
                            EmbeddingProvider embeddings, RetryExecutor retry, MdcTaskExecutor workers,
                            SyncProperties properties, Clock clock) {
        this.mailbox = mailbox;
        this.emailStore = emailStore;
        this.vectorStore = vectorStore;
        this.cursorStore = cursorStore;
        this.filterEngine = filterEngine;
        this.preparer = preparer;
        this.embeddings = embeddings;
        this.retry = retry;
        this.workers = workers;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Syncs messages sent after {@code fromOverride}, or after the stored cursor when no
     * override is given, or over the configured lookback for a user without a cursor.
     *
     * @throws SyncException when the run cannot complete; the cursor is unchanged
     */
    public SyncSummary run(String userId, MailboxCredentials credentials, Instant fromOverride) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId must be provided");
        }
        ReentrantLock lock = locks.computeIfAbsent(userId, k -> new ReentrantLock());
        if (!lock.tryLock()) {
            throw new SyncException(SyncException.Reason.ALREADY_RUNNING, "A sync is already running for " + userId);
        }
        MDC.put(MDC_USER_ID, userId);
        MDC.put(MDC_RUN_ID, UUID.randomUUID().toString().substring(0, 8));
        try {
            return new Run(userId, credentials).execute(fromOverride);
        } finally {
            MDC.remove(MDC_RUN_ID);
            MDC.remove(MDC_USER_ID);
            lock.unlock();
        }
    }

    public SyncState currentState(String userId) {
        return states.getOrDefault(userId, SyncState.IDLE);
    }

    /**
     * State of one run. Only touched by the thread that called {@link #run}.
     */
    private final class Run {

        private final String userId;
        private final MailboxCredentials credentials;

        private final Set<String> seen = new HashSet<>();
        private final Set<String> attempted = new HashSet<>();
        private final Map<FilterReason, Integer> filterReasons = new EnumMap<>(FilterReason.class);

        private SyncCursor cursor;
        private Instant latestPersisted;
        private int processed;
        private int filtered;
        private int vectorized;
        private int failed;
        private int skipped;

        Run(String userId, MailboxCredentials credentials) {
            this.userId = userId;
            this.credentials = credentials;
        }

        SyncSummary execute(Instant fromOverride) {
            try {
                enter(SyncState.FETCHING);
                cursor = storeCall("load sync cursor", () -> cursorStore.load(userId))
                        .orElseGet(() -> new SyncCursor(userId, null, null, null));
                Instant after = fromOverride != null ? fromOverride
                        : cursor.lastSyncedAt() != null ? cursor.lastSyncedAt()
                        : clock.instant().minus(properties.getLookback());
                log.info("Starting sync for user {} from {}", userId, after);

                seen.addAll(storeCall("load existing ids", () -> emailStore.findExternalIds(userId)));

                Set<String> folders = new LinkedHashSet<>(properties.getFolders());
                String pageToken = null;
                do {
                    checkCancelled();
                    enter(SyncState.FETCHING);
                    String token = pageToken;
                    MessagePage page = mailboxCall("fetch messages",
                            () -> mailbox.fetchPage(credentials, after, folders, token));
                    processBatch(page.messages());
                    pageToken = page.nextPageToken();
                } while (pageToken != null);

                retryPending();

                enter(SyncState.CURSOR_COMMIT);
                RunStatus status = failed == 0 ? RunStatus.SUCCESS : RunStatus.PARTIAL;
                // a window starting past the stored cursor leaves a gap the cursor must not skip
                boolean contiguous = cursor.lastSyncedAt() == null || !after.isAfter(cursor.lastSyncedAt());
                SyncCursor next = contiguous
                        ? cursor.advanceTo(latestPersisted, status, clock.instant())
                        : cursor.withStatus(status, clock.instant());
                if (!contiguous) {
                    log.info("Sync window started at {} after cursor {}; cursor left in place",
                            after, cursor.lastSyncedAt());
                }
                storeCall("save sync cursor", () -> {
                    cursorStore.save(next);
                    return null;
                });
                cursor = next;
                enter(SyncState.IDLE);

                SyncSummary summary = new SyncSummary(userId, after, processed, filtered, vectorized, failed,
                        skipped, status, next.lastSyncedAt(), filterReasons);
                log.info("Sync for user {} finished with {}: processed={}, filtered={}, vectorized={}, failed={}, skipped={}",
                        userId, status, processed, filtered, vectorized, failed, skipped);
                return summary;
            } catch (RuntimeException e) {
                fail(e);
                throw e;
            }
        }

        private void processBatch(List<MailboxMessage> messages) {
            if (messages.isEmpty()) return;

            enter(SyncState.CLASSIFYING);
            Set<String> known = Collections.unmodifiableSet(seen);
            List<FilterDecision> decisions = inParallel(messages, msg -> filterEngine.classify(msg, known));

            // repeats within the same run are only visible after the parallel step
            List<MailboxMessage> fresh = new ArrayList<>();
            List<FilterDecision> freshDecisions = new ArrayList<>();
            Set<String> inBatch = new HashSet<>();
            for (int i = 0; i < messages.size(); i++) {
                MailboxMessage msg = messages.get(i);
                FilterDecision decision = decisions.get(i);
                if (decision.isDuplicate() || (msg.externalId() != null && !inBatch.add(msg.externalId()))) {
                    skipped++;
                    continue;
                }
                if (msg.externalId() == null || msg.externalId().isBlank()) {
                    log.warn("Skipping message without provider id: {}", decision.detail());
                    failed++;
                    continue;
                }
                if (decision.isFiltered()) {
                    log.debug("Message {} filtered as {}: {}", msg.externalId(), decision.filterReason(),
                            decision.detail());
                }
                fresh.add(msg);
                freshDecisions.add(decision);
            }
            if (fresh.isEmpty()) return;
            FilterStats stats = FilterStats.of(freshDecisions);
            log.debug("Classified {} new messages: {} kept, {} filtered ({} %)",
                    stats.total(), stats.kept(), stats.filtered(), Math.round(stats.filterRate()));

            enter(SyncState.CHUNKING);
            Instant now = clock.instant();
            List<Integer> positions = new ArrayList<>();
            for (int i = 0; i < fresh.size(); i++) positions.add(i);
            List<PreparedEmail> prepared = inParallel(positions,
                    i -> preparer.prepare(userId, fresh.get(i), freshDecisions.get(i), now));

            enter(SyncState.EMBEDDING);
            List<PreparedEmail> toEmbed = prepared.stream().filter(PreparedEmail::needsEmbedding).toList();
            Map<String, float[]> vectors = vectorize(toEmbed);

            enter(SyncState.PERSISTING);
            Instant persistedAt = clock.instant();
            List<IndexedEmail> rows = new ArrayList<>(prepared.size());
            for (PreparedEmail p : prepared) {
                float[] vector = vectors.get(p.row().id());
                rows.add(vector == null ? p.row() : p.row().withVectors(vector, p.chunks(), persistedAt));
            }
            storeCall("save emails", () -> {
                emailStore.saveAll(rows);
                return null;
            });

            for (PreparedEmail p : prepared) {
                IndexedEmail row = p.row();
                seen.add(row.externalId());
                processed++;
                if (row.isFiltered()) {
                    filtered++;
                    filterReasons.merge(row.filterReason(), 1, Integer::sum);
                }
                if (p.needsEmbedding()) {
                    attempted.add(row.id());
                }
                if (row.sentAt() != null && (latestPersisted == null || row.sentAt().isAfter(latestPersisted))) {
                    latestPersisted = row.sentAt();
                }
            }
            vectorized += vectors.size();
            failed += toEmbed.size() - vectors.size();
            log.debug("Persisted batch of {} emails, {} vectorized", prepared.size(), vectors.size());
        }

        /**
         * Rows left without an embedding by earlier runs get another try. Rows handled in this
         * run are not retried.
         */
        private void retryPending() {
            List<IndexedEmail> pending = storeCall("load pending emails",
                    () -> vectorStore.getPendingVectorization(userId, properties.getPendingBatchLimit()));
            List<PreparedEmail> candidates = new ArrayList<>();
            for (IndexedEmail email : pending) {
                if (attempted.contains(email.id())) continue;
                List<TextChunk> chunks = preparer.rechunk(email);
                if (chunks.isEmpty()) {
                    log.warn("Pending email {} has no stored content to embed", email.id());
                    failed++;
                    continue;
                }
                candidates.add(new PreparedEmail(email, chunks));
            }
            if (candidates.isEmpty()) return;

            log.info("Retrying embeddings for {} pending emails", candidates.size());
            enter(SyncState.EMBEDDING);
            Map<String, float[]> vectors = vectorize(candidates);

            enter(SyncState.PERSISTING);
            List<VectorRecord> records = new ArrayList<>();
            for (PreparedEmail c : candidates) {
                float[] vector = vectors.get(c.row().id());
                if (vector == null) continue;
                records.add(new VectorRecord(c.row().id(), vector, c.chunks(),
                        Map.of("chunk_count", String.valueOf(c.chunks().size()), "source", "pending-retry")));
            }
            if (!records.isEmpty()) {
                storeCall("save pending embeddings", () -> {
                    vectorStore.batchSaveEmbeddings(records);
                    return null;
                });
            }
            vectorized += records.size();
            failed += candidates.size() - records.size();
        }

        /**
         * Embeds every chunk of the given emails and folds each email's chunk vectors into one
         * vector. Emails whose embedding failed are absent from the result.
         */
        private Map<String, float[]> vectorize(List<PreparedEmail> emails) {
            Map<String, float[]> out = new HashMap<>();
            for (List<PreparedEmail> batch : batches(emails)) {
                checkCancelled();
                try {
                    out.putAll(embedBatch(batch));
                } catch (PipelineException e) {
                    if (e.kind() == ErrorKind.FATAL) throw e;
                    if (e.kind() == ErrorKind.PERMANENT && batch.size() > 1) {
                        log.warn("Embedding batch of {} emails rejected, retrying one by one", batch.size());
                        for (PreparedEmail single : batch) {
                            try {
                                out.putAll(embedBatch(List.of(single)));
                            } catch (PipelineException inner) {
                                if (inner.kind() == ErrorKind.FATAL) throw inner;
                                log.warn("Embedding failed for email {}: {}", single.row().externalId(),
                                        inner.getMessage());
                            }
                        }
                    } else {
                        log.warn("Embedding failed for {} emails: {}", batch.size(), e.getMessage());
                    }
                }
            }
            return out;
        }

        private Map<String, float[]> embedBatch(List<PreparedEmail> batch) {
            List<String> texts = new ArrayList<>();
            for (PreparedEmail p : batch) {
                for (TextChunk chunk : p.chunks()) texts.add(chunk.content());
            }
            List<float[]> chunkVectors;
            try {
                chunkVectors = retry.call(RetryExecutor.EMBEDDING, "embed " + texts.size() + " chunks",
                        () -> embeddings.embedAll(texts));
            } catch (EmbeddingException e) {
                if (e.kind() == ErrorKind.FATAL) {
                    throw new SyncException(SyncException.Reason.EMBEDDING_UNAVAILABLE,
                            "Embedding provider refused credentials", e);
                }
                throw e;
            }

            Map<String, float[]> out = new HashMap<>();
            int offset = 0;
            for (PreparedEmail p : batch) {
                int n = p.chunks().size();
                out.put(p.row().id(), Vectors.meanNormalized(chunkVectors.subList(offset, offset + n)));
                offset += n;
            }
            return out;
        }

        /**
         * Groups emails so that a batch holds at most the configured number of chunks. An
         * email with more chunks than that is sent on its own.
         */
        private List<List<PreparedEmail>> batches(List<PreparedEmail> emails) {
            int max = properties.getEmbeddingBatchSize();
            List<List<PreparedEmail>> batches = new ArrayList<>();
            List<PreparedEmail> current = new ArrayList<>();
            int size = 0;
            for (PreparedEmail p : emails) {
                int n = p.chunks().size();
                if (!current.isEmpty() && size + n > max) {
                    batches.add(current);
                    current = new ArrayList<>();
                    size = 0;
                }
                current.add(p);
                size += n;
            }
            if (!current.isEmpty()) batches.add(current);
            return batches;
        }

        private <I, O> List<O> inParallel(List<I> inputs, Function<I, O> task) {
            List<Future<O>> futures = new ArrayList<>(inputs.size());
            for (I input : inputs) {
                Callable<O> c = () -> task.apply(input);
                futures.add(workers.submit(c));
            }
            List<O> results = new ArrayList<>(inputs.size());
            try {
                for (Future<O> f : futures) {
                    results.add(f.get());
                }
            } catch (InterruptedException e) {
                futures.forEach(f -> f.cancel(true));
                Thread.currentThread().interrupt();
                throw new SyncException(SyncException.Reason.CANCELLED, "Sync interrupted", e);
            } catch (ExecutionException e) {
                futures.forEach(f -> f.cancel(true));
                if (e.getCause() instanceof RuntimeException runtime) throw runtime;
                throw new IllegalStateException("Worker failed", e.getCause());
            }
            return results;
        }

        private <T> T mailboxCall(String what, Supplier<T> call) {
            try {
                return retry.call(RetryExecutor.MAILBOX, what, call);
            } catch (SyncException e) {
                throw e;
            } catch (MailboxException e) {
                if (e.reason() == MailboxException.Reason.AUTH_EXPIRED) {
                    throw new SyncException(SyncException.Reason.AUTH_EXPIRED, "Mailbox credentials expired", e);
                }
                throw new SyncException(SyncException.Reason.MAILBOX_UNAVAILABLE, "Failed to " + what, e);
            } catch (PipelineException e) {
                throw new SyncException(SyncException.Reason.MAILBOX_UNAVAILABLE, "Failed to " + what, e);
            }
        }

        private <T> T storeCall(String what, Supplier<T> call) {
            try {
                return retry.call(RetryExecutor.STORE, what, call);
            } catch (SyncException e) {
                throw e;
            } catch (PipelineException e) {
                throw new SyncException(SyncException.Reason.STORE_UNAVAILABLE, "Failed to " + what, e);
            }
        }

        private void checkCancelled() {
            if (Thread.currentThread().isInterrupted()) {
                throw new SyncException(SyncException.Reason.CANCELLED, "Sync interrupted");
            }
        }

        private void enter(SyncState state) {
            SyncState previous = states.put(userId, state);
            if (previous != state) {
                log.debug("Sync state {} -> {}", previous, state);
            }
        }

        private void fail(RuntimeException e) {
            states.put(userId, SyncState.FAILED);
            if (e instanceof SyncException sync) {
                log.error("Sync for user {} failed ({}): {}", userId, sync.reason(), e.getMessage());
                if (sync.reason() == SyncException.Reason.CANCELLED) return;
            } else {
                log.error("Sync for user {} failed unexpectedly", userId, e);
            }
            if (cursor == null) return;
            try {
                cursorStore.save(cursor.withStatus(RunStatus.FAILED, clock.instant()));
            } catch (RuntimeException statusFailure) {
                e.addSuppressed(statusFailure);
                log.warn("Could not record failed status for user {}: {}", userId, statusFailure.getMessage());
            }
        }
    }
}
