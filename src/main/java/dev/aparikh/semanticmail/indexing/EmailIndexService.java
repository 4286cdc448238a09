package dev.aparikh.semanticmail.indexing;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.aparikh.semanticmail.config.SolrConfigurationProperties;
import dev.aparikh.semanticmail.embedding.Vectors;
import dev.aparikh.semanticmail.model.FilterReason;
import dev.aparikh.semanticmail.model.IndexedEmail;
import dev.aparikh.semanticmail.model.TextChunk;
import dev.aparikh.semanticmail.search.SearchHit;
import dev.aparikh.semanticmail.search.SearchOptions;
import org.apache.solr.client.solrj.SolrClient;
import org.apache.solr.client.solrj.SolrQuery;
import org.apache.solr.client.solrj.SolrServerException;
import org.apache.solr.client.solrj.response.QueryResponse;
import org.apache.solr.client.solrj.util.ClientUtils;
import org.apache.solr.common.SolrDocument;
import org.apache.solr.common.SolrDocumentList;
import org.apache.solr.common.SolrException;
import org.apache.solr.common.SolrInputDocument;
import org.apache.solr.common.params.CursorMarkParams;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.Date;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Solr-backed {@link EmailStore} and {@link VectorStore}. Rows and their vectors live in one
 * core; vectors sit in a dense vector field queried through the {@code knn} parser.
 */
@Service
public class EmailIndexService implements EmailStore, VectorStore {

    private static final Logger log = LoggerFactory.getLogger(EmailIndexService.class);

    static final String FIELD_VECTOR_METADATA = "vector_metadata";
    private static final String FIELD_VERSION = "_version_";
    private static final int ID_PAGE_SIZE = 1000;

    private static final TypeReference<List<TextChunk>> CHUNK_LIST = new TypeReference<>() {
    };
    private static final TypeReference<Map<String, String>> STRING_MAP = new TypeReference<>() {
    };

    private final SolrClient solr;
    private final String core;
    private final int dimension;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public EmailIndexService(SolrClient solr, SolrConfigurationProperties properties,
                             ObjectMapper objectMapper, Clock clock) {
        this.solr = solr;
        this.core = properties.getEmailsCore();
        this.dimension = properties.getEmbeddingDimension();
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public Set<String> findExternalIds(String userId) {
        SolrQuery q = new SolrQuery("*:*");
        q.addFilterQuery(userFilter(userId));
        q.setFields(IndexedEmail.FIELD_ID, IndexedEmail.FIELD_EXTERNAL_ID);
        q.setRows(ID_PAGE_SIZE);
        q.setSort(SolrQuery.SortClause.asc(IndexedEmail.FIELD_ID));

        Set<String> ids = new HashSet<>();
        String cursorMark = CursorMarkParams.CURSOR_MARK_START;
        while (true) {
            q.set(CursorMarkParams.CURSOR_MARK_PARAM, cursorMark);
            QueryResponse resp = query(q, "load external ids");
            for (SolrDocument d : resp.getResults()) {
                String externalId = getFieldAsString(d, IndexedEmail.FIELD_EXTERNAL_ID);
                if (externalId != null) ids.add(externalId);
            }
            String next = resp.getNextCursorMark();
            if (next == null || next.equals(cursorMark)) break;
            cursorMark = next;
        }
        log.debug("User {} has {} indexed emails", userId, ids.size());
        return ids;
    }

    @Override
    public void saveAll(List<IndexedEmail> emails) {
        if (emails == null || emails.isEmpty()) return;
        List<SolrInputDocument> docs = emails.stream()
                .map(this::toSolrDoc)
                .toList();
        write(docs, "save emails");
    }

    @Override
    public Optional<IndexedEmail> findById(String id) {
        return Optional.ofNullable(getById(id)).map(this::fromSolrDoc);
    }

    @Override
    public void batchSaveEmbeddings(List<VectorRecord> records) {
        if (records == null || records.isEmpty()) return;
        for (VectorRecord r : records) {
            checkDimension(r.embedding());
        }

        List<String> ids = records.stream().map(VectorRecord::id).toList();
        Map<String, SolrDocument> existing = getByIds(ids);
        Date now = Date.from(clock.instant());

        List<SolrInputDocument> docs = new ArrayList<>();
        List<String> missing = new ArrayList<>();
        for (VectorRecord r : records) {
            SolrDocument current = existing.get(r.id());
            if (current == null) {
                missing.add(r.id());
                continue;
            }
            SolrInputDocument d = copyOf(current);
            d.setField(IndexedEmail.FIELD_EMBEDDING, toFloatList(r.embedding()));
            d.setField(IndexedEmail.FIELD_TEXT_CHUNKS, writeJson(r.chunks()));
            d.setField(FIELD_VECTOR_METADATA, writeJson(r.metadata()));
            d.setField(IndexedEmail.FIELD_VECTORIZED_AT, now);
            docs.add(d);
        }
        if (!docs.isEmpty()) {
            write(docs, "save embeddings");
        }
        if (!missing.isEmpty()) {
            throw new StoreException(StoreException.Reason.NOT_FOUND, "No email rows for ids " + missing);
        }
    }

    @Override
    public List<SearchHit> search(float[] queryEmbedding, SearchOptions options) {
        checkDimension(queryEmbedding);

        SolrQuery q = new SolrQuery("{!knn f=" + IndexedEmail.FIELD_EMBEDDING + " topK=" + options.limit() + "}"
                + vectorLiteral(queryEmbedding));
        options.userIdOpt().ifPresent(u -> q.addFilterQuery(userFilter(u)));
        q.addFilterQuery(IndexedEmail.FIELD_IS_FILTERED + ":false");
        q.addFilterQuery(IndexedEmail.FIELD_VECTORIZED_AT + ":[* TO *]");
        q.setFields("*", "score");
        q.setRows(options.limit());

        QueryResponse resp = query(q, "similarity search");

        // knn only selects candidates; similarity is recomputed from the stored vectors
        List<SearchHit> hits = new ArrayList<>();
        Map<String, Instant> sentAt = new HashMap<>();
        for (SolrDocument d : resp.getResults()) {
            float[] stored = toFloatArray(d.getFieldValues(IndexedEmail.FIELD_EMBEDDING));
            if (stored == null || stored.length != queryEmbedding.length) continue;
            double similarity = Vectors.cosine(queryEmbedding, stored);
            if (similarity < options.threshold()) continue;
            IndexedEmail email = fromSolrDoc(d);
            hits.add(new SearchHit(email.id(), similarity, email.metadata(), email.textChunks()));
            sentAt.put(email.id(), email.sentAt());
        }

        Comparator<SearchHit> bySimilarity = Comparator.comparingDouble(SearchHit::similarity).reversed();
        Comparator<SearchHit> byRecency = Comparator.comparing(
                (SearchHit h) -> sentAt.get(h.id()), Comparator.nullsLast(Comparator.reverseOrder()));
        return hits.stream()
                .sorted(bySimilarity.thenComparing(byRecency))
                .limit(options.limit())
                .toList();
    }

    @Override
    public List<IndexedEmail> getPendingVectorization(String userId, int limit) {
        SolrQuery q = new SolrQuery("*:*");
        q.addFilterQuery(userFilter(userId));
        q.addFilterQuery(IndexedEmail.FIELD_IS_FILTERED + ":false");
        q.addFilterQuery("-" + IndexedEmail.FIELD_VECTORIZED_AT + ":[* TO *]");
        q.setSort(SolrQuery.SortClause.asc(IndexedEmail.FIELD_SENT_AT));
        q.setRows(limit);
        return query(q, "load pending emails").getResults().stream()
                .map(this::fromSolrDoc)
                .toList();
    }

    @Override
    public VectorStats stats(String userId) {
        SolrQuery total = countQuery(userId);
        SolrQuery vectorized = countQuery(userId);
        vectorized.addFilterQuery(IndexedEmail.FIELD_VECTORIZED_AT + ":[* TO *]");

        long totalCount = query(total, "count emails").getResults().getNumFound();
        long vectorizedCount = query(vectorized, "count vectorized emails").getResults().getNumFound();
        return new VectorStats(totalCount, vectorizedCount, totalCount - vectorizedCount);
    }

    @Override
    public boolean isVectorized(String id) {
        SolrDocument d = getById(id);
        if (d == null) {
            throw new StoreException(StoreException.Reason.NOT_FOUND, "No email row for id " + id);
        }
        return d.getFieldValue(IndexedEmail.FIELD_VECTORIZED_AT) != null;
    }

    @Override
    public void deleteEmbedding(String id) {
        SolrDocument current = getById(id);
        if (current == null) {
            throw new StoreException(StoreException.Reason.NOT_FOUND, "No email row for id " + id);
        }
        SolrInputDocument d = copyOf(current);
        d.removeField(IndexedEmail.FIELD_EMBEDDING);
        d.removeField(IndexedEmail.FIELD_TEXT_CHUNKS);
        d.removeField(FIELD_VECTOR_METADATA);
        d.removeField(IndexedEmail.FIELD_VECTORIZED_AT);
        write(List.of(d), "delete embedding");
        log.info("Cleared embedding of email {}", id);
    }

    SolrInputDocument toSolrDoc(IndexedEmail e) {
        SolrInputDocument d = new SolrInputDocument();
        d.addField(IndexedEmail.FIELD_ID, e.id());
        d.addField(IndexedEmail.FIELD_USER_ID, e.userId());
        d.addField(IndexedEmail.FIELD_EXTERNAL_ID, e.externalId());
        if (e.threadId() != null) d.addField(IndexedEmail.FIELD_THREAD_ID, e.threadId());
        if (e.sender() != null) d.addField(IndexedEmail.FIELD_SENDER, e.sender());
        addAll(d, IndexedEmail.FIELD_RECIPIENTS, e.recipients());
        if (e.subject() != null) d.addField(IndexedEmail.FIELD_SUBJECT, e.subject());
        if (e.content() != null && !e.content().isEmpty()) d.addField(IndexedEmail.FIELD_CONTENT, e.content());
        if (e.sentAt() != null) d.addField(IndexedEmail.FIELD_SENT_AT, Date.from(e.sentAt()));
        addAll(d, IndexedEmail.FIELD_FOLDER_LABELS, e.folderLabels());
        d.addField(IndexedEmail.FIELD_IS_FILTERED, e.isFiltered());
        d.addField(IndexedEmail.FIELD_FILTER_REASON, e.filterReason().name());
        if (!e.textChunks().isEmpty()) d.addField(IndexedEmail.FIELD_TEXT_CHUNKS, writeJson(e.textChunks()));
        if (e.embedding() != null) d.addField(IndexedEmail.FIELD_EMBEDDING, toFloatList(e.embedding()));
        if (e.vectorizedAt() != null) d.addField(IndexedEmail.FIELD_VECTORIZED_AT, Date.from(e.vectorizedAt()));
        Instant created = e.createdAt() != null ? e.createdAt() : clock.instant();
        d.addField(IndexedEmail.FIELD_CREATED_AT, Date.from(created));
        return d;
    }

    IndexedEmail fromSolrDoc(SolrDocument d) {
        String chunksJson = getFieldAsString(d, IndexedEmail.FIELD_TEXT_CHUNKS);
        List<TextChunk> chunks = chunksJson == null ? List.of() : readJson(chunksJson, CHUNK_LIST);
        String reason = getFieldAsString(d, IndexedEmail.FIELD_FILTER_REASON);
        Object filtered = d.getFieldValue(IndexedEmail.FIELD_IS_FILTERED);

        return new IndexedEmail(
                getFieldAsString(d, IndexedEmail.FIELD_ID),
                getFieldAsString(d, IndexedEmail.FIELD_USER_ID),
                getFieldAsString(d, IndexedEmail.FIELD_EXTERNAL_ID),
                getFieldAsString(d, IndexedEmail.FIELD_THREAD_ID),
                getFieldAsString(d, IndexedEmail.FIELD_SENDER),
                toList(d.getFieldValues(IndexedEmail.FIELD_RECIPIENTS)),
                getFieldAsString(d, IndexedEmail.FIELD_SUBJECT),
                getFieldAsString(d, IndexedEmail.FIELD_CONTENT),
                toInstant(d.getFieldValue(IndexedEmail.FIELD_SENT_AT)),
                toList(d.getFieldValues(IndexedEmail.FIELD_FOLDER_LABELS)),
                filtered instanceof Boolean b ? b : Boolean.parseBoolean(String.valueOf(filtered)),
                reason == null ? FilterReason.NONE : FilterReason.valueOf(reason),
                chunks,
                toFloatArray(d.getFieldValues(IndexedEmail.FIELD_EMBEDDING)),
                toInstant(d.getFieldValue(IndexedEmail.FIELD_VECTORIZED_AT)),
                toInstant(d.getFieldValue(IndexedEmail.FIELD_CREATED_AT))
        );
    }

    Map<String, String> vectorMetadata(SolrDocument d) {
        String json = getFieldAsString(d, FIELD_VECTOR_METADATA);
        return json == null ? Map.of() : readJson(json, STRING_MAP);
    }

    private SolrQuery countQuery(String userId) {
        SolrQuery q = new SolrQuery("*:*");
        q.addFilterQuery(userFilter(userId));
        q.addFilterQuery(IndexedEmail.FIELD_IS_FILTERED + ":false");
        q.setRows(0);
        return q;
    }

    private void write(List<SolrInputDocument> docs, String what) {
        try {
            solr.add(core, docs);
            solr.commit(core);
        } catch (SolrServerException | IOException e) {
            throw new StoreException(StoreException.Reason.UNAVAILABLE, "Failed to " + what, e);
        } catch (SolrException e) {
            throw translate(e, what);
        }
    }

    private QueryResponse query(SolrQuery q, String what) {
        try {
            return solr.query(core, q);
        } catch (SolrServerException | IOException e) {
            throw new StoreException(StoreException.Reason.UNAVAILABLE, "Failed to " + what, e);
        } catch (SolrException e) {
            throw translate(e, what);
        }
    }

    private SolrDocument getById(String id) {
        try {
            return solr.getById(core, id);
        } catch (SolrServerException | IOException e) {
            throw new StoreException(StoreException.Reason.UNAVAILABLE, "Failed to load email " + id, e);
        } catch (SolrException e) {
            throw translate(e, "load email " + id);
        }
    }

    private Map<String, SolrDocument> getByIds(Collection<String> ids) {
        SolrDocumentList docs;
        try {
            docs = solr.getById(core, ids);
        } catch (SolrServerException | IOException e) {
            throw new StoreException(StoreException.Reason.UNAVAILABLE, "Failed to load emails", e);
        } catch (SolrException e) {
            throw translate(e, "load emails");
        }
        return docs.stream().collect(Collectors.toMap(
                d -> getFieldAsString(d, IndexedEmail.FIELD_ID), Function.identity(), (a, b) -> a));
    }

    private static StoreException translate(SolrException e, String what) {
        StoreException.Reason reason = e.code() >= 500
                ? StoreException.Reason.UNAVAILABLE
                : StoreException.Reason.REJECTED;
        return new StoreException(reason, "Solr refused to " + what + ": " + e.getMessage(), e);
    }

    private void checkDimension(float[] vector) {
        if (vector == null || vector.length != dimension) {
            throw new IllegalArgumentException("Expected a vector of " + dimension + " dimensions but got "
                    + (vector == null ? "null" : vector.length));
        }
    }

    private static SolrInputDocument copyOf(SolrDocument source) {
        SolrInputDocument d = new SolrInputDocument();
        for (String name : source.getFieldNames()) {
            if (FIELD_VERSION.equals(name) || "score".equals(name)) continue;
            d.setField(name, source.getFieldValue(name));
        }
        return d;
    }

    private static String userFilter(String userId) {
        return IndexedEmail.FIELD_USER_ID + ":" + ClientUtils.escapeQueryChars(userId);
    }

    private static String vectorLiteral(float[] vector) {
        StringBuilder sb = new StringBuilder(vector.length * 10).append('[');
        for (int i = 0; i < vector.length; i++) {
            if (i > 0) sb.append(',');
            sb.append(vector[i]);
        }
        return sb.append(']').toString();
    }

    private static List<Float> toFloatList(float[] vector) {
        List<Float> values = new ArrayList<>(vector.length);
        for (float f : vector) values.add(f);
        return values;
    }

    private static float[] toFloatArray(Collection<Object> values) {
        if (values == null || values.isEmpty()) return null;
        float[] out = new float[values.size()];
        int i = 0;
        for (Object v : values) {
            out[i++] = v instanceof Number n ? n.floatValue() : Float.parseFloat(String.valueOf(v));
        }
        return out;
    }

    private String writeJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new StoreException(StoreException.Reason.SERIALIZATION, "Failed to serialize " + value.getClass(), e);
        }
    }

    private <T> T readJson(String json, TypeReference<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new StoreException(StoreException.Reason.SERIALIZATION, "Failed to read stored JSON", e);
        }
    }

    private static void addAll(SolrInputDocument d, String field, List<String> values) {
        if (values == null) return;
        for (String v : values) {
            if (v != null && !v.isBlank()) d.addField(field, v);
        }
    }

    private static List<String> toList(Collection<?> values) {
        if (values == null) return List.of();
        return values.stream()
                .filter(Objects::nonNull)
                .map(Object::toString)
                .toList();
    }

    private static Instant toInstant(Object value) {
        if (value instanceof Date date) return date.toInstant();
        if (value instanceof String s) return Instant.parse(s);
        return null;
    }

    private static String getFieldAsString(SolrDocument d, String fieldName) {
        Object value = d.getFieldValue(fieldName);
        if (value == null) return null;
        if (value instanceof String) return (String) value;
        if (value instanceof Collection<?> collection && !collection.isEmpty()) {
            return String.valueOf(collection.iterator().next());
        }
        return String.valueOf(value);
    }
}
