package dev.aparikh.semanticmail.model;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Email row owned by the indexing pipeline. {@code vectorizedAt} being present is the only
 * signal that the row is searchable.
 */
public record IndexedEmail(
        String id,
        String userId,
        String externalId,
        String threadId,
        String sender,
        List<String> recipients,
        String subject,
        String content,
        Instant sentAt,
        List<String> folderLabels,
        boolean isFiltered,
        FilterReason filterReason,
        List<TextChunk> textChunks,
        float[] embedding,
        Instant vectorizedAt,
        Instant createdAt
) {
    // Solr field names - centralized constants for use across the application
    public static final String FIELD_ID = "id";
    public static final String FIELD_USER_ID = "user_id";
    public static final String FIELD_EXTERNAL_ID = "external_id";
    public static final String FIELD_THREAD_ID = "thread_id";
    public static final String FIELD_SENDER = "sender";
    public static final String FIELD_RECIPIENTS = "recipients";
    public static final String FIELD_SUBJECT = "subject";
    public static final String FIELD_CONTENT = "content";
    public static final String FIELD_SENT_AT = "sent_at";
    public static final String FIELD_FOLDER_LABELS = "folder_labels";
    public static final String FIELD_IS_FILTERED = "is_filtered";
    public static final String FIELD_FILTER_REASON = "filter_reason";
    public static final String FIELD_TEXT_CHUNKS = "text_chunks";
    public static final String FIELD_EMBEDDING = "embedding";
    public static final String FIELD_VECTORIZED_AT = "vectorized_at";
    public static final String FIELD_CREATED_AT = "created_at";

    public IndexedEmail {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId must be provided");
        }
        if (externalId == null || externalId.isBlank()) {
            throw new IllegalArgumentException("externalId must be provided");
        }
        if (id == null) {
            id = idFor(userId, externalId);
        }
        recipients = recipients == null ? List.of() : List.copyOf(recipients);
        folderLabels = folderLabels == null ? List.of() : List.copyOf(folderLabels);
        textChunks = textChunks == null ? List.of() : List.copyOf(textChunks);
        filterReason = filterReason == null ? FilterReason.NONE : filterReason;
    }

    /**
     * Internal id derived from the owning user and the provider id, so a replayed message
     * always lands on the same row.
     */
    public static String idFor(String userId, String externalId) {
        return UUID.nameUUIDFromBytes((userId + '\u0000' + externalId).getBytes(StandardCharsets.UTF_8)).toString();
    }

    public boolean isVectorized() {
        return vectorizedAt != null;
    }

    public boolean needsVectorization() {
        return !isFiltered && vectorizedAt == null;
    }

    public EmailMetadata metadata() {
        return new EmailMetadata(externalId, threadId, subject, sender, sentAt, folderLabels);
    }

    public IndexedEmail withVectors(float[] vector, List<TextChunk> chunks, Instant at) {
        return new IndexedEmail(id, userId, externalId, threadId, sender, recipients, subject, content,
                sentAt, folderLabels, isFiltered, filterReason, chunks, vector, at, createdAt);
    }

    public IndexedEmail withoutVectors() {
        return new IndexedEmail(id, userId, externalId, threadId, sender, recipients, subject, content,
                sentAt, folderLabels, isFiltered, filterReason, List.of(), null, null, createdAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String userId;
        private String externalId;
        private String threadId;
        private String sender;
        private List<String> recipients;
        private String subject;
        private String content;
        private Instant sentAt;
        private List<String> folderLabels;
        private boolean filtered;
        private FilterReason filterReason = FilterReason.NONE;
        private List<TextChunk> textChunks;
        private Instant createdAt;

        public Builder userId(String userId) {
            this.userId = userId;
            return this;
        }

        public Builder fromMessage(MailboxMessage message) {
            this.externalId = message.externalId();
            this.threadId = message.threadId();
            this.sender = message.sender();
            this.recipients = message.recipients();
            this.subject = message.subject();
            this.sentAt = message.sentAt();
            this.folderLabels = message.folderLabels();
            return this;
        }

        public Builder externalId(String externalId) {
            this.externalId = externalId;
            return this;
        }

        public Builder subject(String subject) {
            this.subject = subject;
            return this;
        }

        public Builder sender(String sender) {
            this.sender = sender;
            return this;
        }

        public Builder sentAt(Instant sentAt) {
            this.sentAt = sentAt;
            return this;
        }

        public Builder content(String content) {
            this.content = content;
            return this;
        }

        public Builder filtered(FilterReason reason) {
            this.filtered = reason != null && reason != FilterReason.NONE;
            this.filterReason = reason;
            return this;
        }

        public Builder textChunks(List<TextChunk> textChunks) {
            this.textChunks = textChunks;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public IndexedEmail build() {
            return new IndexedEmail(null, userId, externalId, threadId, sender, recipients, subject, content,
                    sentAt, folderLabels, filtered, filterReason, textChunks, null, null, createdAt);
        }
    }
}
