package dev.aparikh.semanticmail.sync;

import dev.aparikh.semanticmail.filter.FilterDecision;
import dev.aparikh.semanticmail.model.FilterReason;
import dev.aparikh.semanticmail.model.IndexedEmail;
import dev.aparikh.semanticmail.model.MailboxMessage;
import dev.aparikh.semanticmail.model.TextChunk;
import dev.aparikh.semanticmail.text.HtmlTextExtractor;
import dev.aparikh.semanticmail.text.SizeCheck;
import dev.aparikh.semanticmail.text.TextChunker;
import dev.aparikh.semanticmail.text.TextNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;

/**
 * Turns a classified message into the row to persist and the chunks to embed.
 * Stateless; safe to call from several worker threads.
 */
public class MessagePreparer {

    private static final Logger log = LoggerFactory.getLogger(MessagePreparer.class);

    private final TextNormalizer normalizer;
    private final TextChunker chunker;
    private final HtmlTextExtractor htmlExtractor;
    private final int maxChunkSize;

    public MessagePreparer(TextNormalizer normalizer, TextChunker chunker, HtmlTextExtractor htmlExtractor,
                           int maxChunkSize) {
        this.normalizer = normalizer;
        this.chunker = chunker;
        this.htmlExtractor = htmlExtractor;
        this.maxChunkSize = maxChunkSize;
    }

    /**
     * Filtered messages keep only their envelope. Messages whose text is empty or over the
     * token ceiling are stored as {@link FilterReason#PROCESSING_ERROR}.
     */
    public PreparedEmail prepare(String userId, MailboxMessage msg, FilterDecision decision, Instant now) {
        IndexedEmail.Builder row = IndexedEmail.builder()
                .userId(userId)
                .fromMessage(msg)
                .createdAt(now);
        if (!decision.isIndexable()) {
            return new PreparedEmail(row.filtered(decision.filterReason()).build(), List.of());
        }

        String combined = chunker.combine(primaryText(msg), msg.attachmentTexts());
        SizeCheck check = chunker.validateSize(combined);
        if (!check.isValid()) {
            log.warn("Message {} not indexable: {} (~{} tokens)",
                    msg.externalId(), check.reason(), check.estimatedTokens());
            return new PreparedEmail(row.filtered(FilterReason.PROCESSING_ERROR).build(), List.of());
        }

        List<TextChunk> chunks = chunker.chunk(combined, maxChunkSize);
        return new PreparedEmail(row.content(combined).build(), chunks);
    }

    /**
     * Chunks a stored row again from its saved content. Returns no chunks when the row has
     * no content to embed.
     */
    public List<TextChunk> rechunk(IndexedEmail email) {
        if (email.content() == null || email.content().isBlank()) {
            return List.of();
        }
        return chunker.chunk(email.content(), maxChunkSize);
    }

    private String primaryText(MailboxMessage msg) {
        String body = normalizer.normalize(msg.bodyText());
        if (body.isEmpty() && msg.bodyHtml() != null) {
            body = normalizer.normalize(htmlExtractor.toText(msg.bodyHtml()));
        }
        String subject = normalizer.normalize(msg.subject());
        if (subject.isEmpty()) return body;
        return body.isEmpty() ? "Subject: " + subject : "Subject: " + subject + "\n\n" + body;
    }

    /**
     * Row ready for persistence. {@code chunks} is empty when there is nothing to embed.
     */
    public record PreparedEmail(IndexedEmail row, List<TextChunk> chunks) {

        public PreparedEmail {
            chunks = List.copyOf(chunks);
        }

        public boolean needsEmbedding() {
            return !row.isFiltered() && !chunks.isEmpty();
        }
    }
}
