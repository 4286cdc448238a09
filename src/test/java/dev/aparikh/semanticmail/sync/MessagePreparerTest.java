package dev.aparikh.semanticmail.sync;

import dev.aparikh.semanticmail.filter.FilterDecision;
import dev.aparikh.semanticmail.model.Attachment;
import dev.aparikh.semanticmail.model.FilterReason;
import dev.aparikh.semanticmail.model.IndexedEmail;
import dev.aparikh.semanticmail.model.MailboxMessage;
import dev.aparikh.semanticmail.model.TextChunk;
import dev.aparikh.semanticmail.text.HtmlTextExtractor;
import dev.aparikh.semanticmail.text.TextChunker;
import dev.aparikh.semanticmail.text.TextNormalizer;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class MessagePreparerTest {

    private static final Instant NOW = Instant.parse("2025-03-01T12:00:00Z");
    private static final Instant SENT = Instant.parse("2025-01-01T10:00:00Z");

    private final TextNormalizer normalizer = new TextNormalizer();
    // 50 tokens is about 200 characters
    private final MessagePreparer preparer = new MessagePreparer(normalizer,
            new TextChunker(normalizer, 50, 0.2), new HtmlTextExtractor(), 60);

    @Test
    void filteredMessageKeepsOnlyItsEnvelope() {
        MailboxMessage msg = message("m1", "Big sale", "Everything must go", null, List.of());

        MessagePreparer.PreparedEmail prepared = preparer.prepare("u1", msg,
                FilterDecision.filtered(FilterReason.MARKETING, "unsubscribe link"), NOW);

        IndexedEmail row = prepared.row();
        assertThat(row.id()).isEqualTo(IndexedEmail.idFor("u1", "m1"));
        assertThat(row.isFiltered()).isTrue();
        assertThat(row.filterReason()).isEqualTo(FilterReason.MARKETING);
        assertThat(row.subject()).isEqualTo("Big sale");
        assertThat(row.content()).isNull();
        assertThat(row.createdAt()).isEqualTo(NOW);
        assertThat(prepared.chunks()).isEmpty();
        assertThat(prepared.needsEmbedding()).isFalse();
    }

    @Test
    void keptMessageEmbedsSubjectBodyAndAttachments() {
        MailboxMessage msg = message("m1", "Budget", "Numbers\tattached.", null,
                List.of(new Attachment("q1.csv", "text/csv", 6, "q1,100"),
                        new Attachment("logo.png", "image/png", 2048, null)));

        MessagePreparer.PreparedEmail prepared = preparer.prepare("u1", msg, FilterDecision.kept("personal"), NOW);

        assertThat(prepared.row().isFiltered()).isFalse();
        assertThat(prepared.row().content()).isEqualTo(
                "EMAIL CONTENT:\nSubject: Budget\n\nNumbers attached.\n\n---\n\nATTACHMENT 1:\nq1,100");
        assertThat(prepared.row().vectorizedAt()).isNull();
        assertThat(prepared.needsEmbedding()).isTrue();
        assertThat(prepared.chunks()).extracting(TextChunk::index).startsWith(0);
        assertThat(prepared.chunks().get(prepared.chunks().size() - 1).isComplete()).isTrue();
        assertThat(prepared.chunks()).allSatisfy(c -> assertThat(c.content().length()).isLessThanOrEqualTo(60));
    }

    @Test
    void htmlBodyIsUsedWhenPlainTextIsMissing() {
        MailboxMessage msg = message("m1", "Hello", "", "<p>Dinner at <b>eight</b></p>", List.of());

        MessagePreparer.PreparedEmail prepared = preparer.prepare("u1", msg, FilterDecision.kept("personal"), NOW);

        assertThat(prepared.row().content()).contains("Subject: Hello").contains("Dinner at eight");
        assertThat(prepared.row().content()).doesNotContain("<p>");
    }

    @Test
    void messageWithoutTextIsRecordedAsProcessingError() {
        MailboxMessage msg = message("m1", null, "   ", null, List.of());

        MessagePreparer.PreparedEmail prepared = preparer.prepare("u1", msg, FilterDecision.kept("personal"), NOW);

        assertThat(prepared.row().isFiltered()).isTrue();
        assertThat(prepared.row().filterReason()).isEqualTo(FilterReason.PROCESSING_ERROR);
        assertThat(prepared.needsEmbedding()).isFalse();
    }

    @Test
    void oversizedMessageIsRecordedAsProcessingError() {
        MailboxMessage msg = message("m1", "Log dump", "line of output. ".repeat(40), null, List.of());

        MessagePreparer.PreparedEmail prepared = preparer.prepare("u1", msg, FilterDecision.kept("personal"), NOW);

        assertThat(prepared.row().filterReason()).isEqualTo(FilterReason.PROCESSING_ERROR);
        assertThat(prepared.row().content()).isNull();
        assertThat(prepared.chunks()).isEmpty();
    }

    @Test
    void rechunkRebuildsChunksFromStoredContent() {
        IndexedEmail stored = IndexedEmail.builder()
                .userId("u1").externalId("m1").content("First sentence here. Second sentence follows it and keeps going.")
                .build();

        List<TextChunk> chunks = preparer.rechunk(stored);

        assertThat(chunks).hasSize(2);
        assertThat(chunks.get(0).content()).startsWith("First sentence here.");
        assertThat(chunks.get(1).isComplete()).isTrue();
        assertThat(preparer.rechunk(IndexedEmail.builder().userId("u1").externalId("m2").build())).isEmpty();
    }

    private static MailboxMessage message(String id, String subject, String body, String html,
                                          List<Attachment> attachments) {
        return new MailboxMessage(id, "t-" + id, "alice@friends.example", List.of("me@friends.example"),
                subject, body, html, attachments, SENT, List.of("INBOX"), Map.of());
    }
}
