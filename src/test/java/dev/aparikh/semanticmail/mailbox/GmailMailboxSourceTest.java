package dev.aparikh.semanticmail.mailbox;

import dev.aparikh.semanticmail.attachment.AttachmentExtractor;
import dev.aparikh.semanticmail.attachment.DocxDocumentParser;
import dev.aparikh.semanticmail.attachment.HtmlAttachmentParser;
import dev.aparikh.semanticmail.attachment.PdfDocumentParser;
import dev.aparikh.semanticmail.attachment.PlainTextParser;
import dev.aparikh.semanticmail.attachment.TestDocuments;
import dev.aparikh.semanticmail.model.Attachment;
import dev.aparikh.semanticmail.text.HtmlTextExtractor;
import dev.aparikh.semanticmail.model.MailboxMessage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Base64;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServiceUnavailable;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class GmailMailboxSourceTest {

    private static final String BASE = "https://gmail.test/gmail/v1/users/me";
    private static final Instant AFTER = Instant.parse("2025-01-01T00:00:00Z");
    private static final Set<String> FOLDERS = Set.of("INBOX", "SENT");
    private static final MailboxCredentials CREDENTIALS = MailboxCredentials.bearer("token-1");

    private MockRestServiceServer server;
    private GmailMailboxSource source;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder().baseUrl(BASE);
        server = MockRestServiceServer.bindTo(builder).build();
        AttachmentExtractor extractor = new AttachmentExtractor(List.of(
                new PdfDocumentParser(),
                new DocxDocumentParser(),
                new HtmlAttachmentParser(new HtmlTextExtractor()),
                new PlainTextParser()), 1024 * 1024);
        source = new GmailMailboxSource(builder.build(), 2, extractor);
    }

    @Test
    void buildsSearchQueryFromTimestampAndFolders() {
        assertThat(GmailMailboxSource.buildQuery(AFTER, FOLDERS))
                .isEqualTo("after:1735689600 {in:inbox in:sent}");
        assertThat(GmailMailboxSource.buildQuery(AFTER, Set.of())).isEqualTo("after:1735689600");
    }

    @Test
    void deliversMessagesOldestFirstInPages() {
        server.expect(requestTo(startsWith(BASE + "/messages?")))
                .andExpect(header(HttpHeaders.AUTHORIZATION, "Bearer token-1"))
                .andExpect(request -> assertThat(URLDecoder.decode(request.getURI().getRawQuery(), StandardCharsets.UTF_8))
                        .contains("q=after:1735689600 {in:inbox in:sent}"))
                .andRespond(withSuccess("{\"messages\":[{\"id\":\"m3\"},{\"id\":\"m2\"},{\"id\":\"m1\"}]}",
                        MediaType.APPLICATION_JSON));
        expectMessage("m1", 1000L);
        expectMessage("m2", 2000L);

        MessagePage first = source.fetchPage(CREDENTIALS, AFTER, FOLDERS, null);

        assertThat(first.messages()).extracting(MailboxMessage::externalId).containsExactly("m1", "m2");
        assertThat(first.hasNext()).isTrue();

        expectMessage("m3", 3000L);
        MessagePage second = source.fetchPage(CREDENTIALS, AFTER, FOLDERS, first.nextPageToken());

        assertThat(second.messages()).extracting(MailboxMessage::externalId).containsExactly("m3");
        assertThat(second.hasNext()).isFalse();
        server.verify();
    }

    @Test
    void followsGmailListPagination() {
        server.expect(requestTo(startsWith(BASE + "/messages?")))
                .andRespond(withSuccess("{\"messages\":[{\"id\":\"m2\"}],\"nextPageToken\":\"p2\"}",
                        MediaType.APPLICATION_JSON));
        server.expect(requestTo(startsWith(BASE + "/messages?")))
                .andExpect(request -> assertThat(request.getURI().getRawQuery()).contains("pageToken=p2"))
                .andRespond(withSuccess("{\"messages\":[{\"id\":\"m1\"}]}", MediaType.APPLICATION_JSON));
        expectMessage("m1", 1000L);
        expectMessage("m2", 2000L);

        MessagePage page = source.fetchPage(CREDENTIALS, AFTER, FOLDERS, null);

        assertThat(page.messages()).extracting(MailboxMessage::externalId).containsExactly("m1", "m2");
        server.verify();
    }

    @Test
    void parsesHeadersBodiesAndTextAttachments() {
        server.expect(requestTo(startsWith(BASE + "/messages?")))
                .andRespond(withSuccess("{\"messages\":[{\"id\":\"m1\"}]}", MediaType.APPLICATION_JSON));
        String json = """
                {
                  "id": "m1",
                  "threadId": "t1",
                  "labelIds": ["INBOX", "IMPORTANT"],
                  "internalDate": "1735725600000",
                  "payload": {
                    "mimeType": "multipart/mixed",
                    "headers": [
                      {"name": "From", "value": "Alice <alice@friends.example>"},
                      {"name": "To", "value": "me@friends.example, bob@friends.example"},
                      {"name": "Cc", "value": "carol@friends.example"},
                      {"name": "Subject", "value": "Budget"},
                      {"name": "List-Id", "value": "team.friends.example"}
                    ],
                    "parts": [
                      {"mimeType": "multipart/alternative", "parts": [
                        {"mimeType": "text/plain", "body": {"data": "%s"}},
                        {"mimeType": "text/html", "body": {"data": "%s"}}
                      ]},
                      {"mimeType": "text/csv", "filename": "numbers.csv",
                       "body": {"attachmentId": "a1", "size": 12}},
                      {"mimeType": "application/pdf", "filename": "report.pdf",
                       "body": {"attachmentId": "a2", "size": 2048}}
                    ]
                  }
                }
                """.formatted(encode("Plain body"), encode("<p>Html body</p>"));
        server.expect(requestTo(BASE + "/messages/m1?format=full"))
                .andRespond(withSuccess(json, MediaType.APPLICATION_JSON));
        server.expect(requestTo(BASE + "/messages/m1/attachments/a1"))
                .andRespond(withSuccess("{\"data\":\"" + encode("q1,100") + "\"}", MediaType.APPLICATION_JSON));
        server.expect(requestTo(BASE + "/messages/m1/attachments/a2"))
                .andRespond(withSuccess("{\"data\":\"" + encode(TestDocuments.pdf("Revenue grew")) + "\"}",
                        MediaType.APPLICATION_JSON));

        MailboxMessage msg = source.fetchPage(CREDENTIALS, AFTER, FOLDERS, null).messages().get(0);

        assertThat(msg.threadId()).isEqualTo("t1");
        assertThat(msg.sender()).isEqualTo("Alice <alice@friends.example>");
        assertThat(msg.recipients()).containsExactly("me@friends.example", "bob@friends.example", "carol@friends.example");
        assertThat(msg.subject()).isEqualTo("Budget");
        assertThat(msg.bodyText()).isEqualTo("Plain body");
        assertThat(msg.bodyHtml()).isEqualTo("<p>Html body</p>");
        assertThat(msg.sentAt()).isEqualTo(Instant.parse("2025-01-01T10:00:00Z"));
        assertThat(msg.folderLabels()).containsExactly("INBOX", "IMPORTANT");
        assertThat(msg.header("list-id")).contains("team.friends.example");
        assertThat(msg.attachments()).extracting(Attachment::filename).containsExactly("numbers.csv", "report.pdf");
        assertThat(msg.attachmentTexts()).hasSize(2);
        assertThat(msg.attachmentTexts().get(0)).isEqualTo("q1,100");
        assertThat(msg.attachmentTexts().get(1)).contains("Revenue grew");
        server.verify();
    }

    @Test
    void skipsUnsupportedAndOversizedAttachmentsWithoutDownloading() {
        server.expect(requestTo(startsWith(BASE + "/messages?")))
                .andRespond(withSuccess("{\"messages\":[{\"id\":\"m1\"}]}", MediaType.APPLICATION_JSON));
        String json = """
                {
                  "id": "m1",
                  "internalDate": "1735725600000",
                  "payload": {
                    "mimeType": "multipart/mixed",
                    "headers": [{"name": "From", "value": "alice@friends.example"}],
                    "parts": [
                      {"mimeType": "text/plain", "body": {"data": "%s"}},
                      {"mimeType": "image/jpeg", "filename": "photo.jpg",
                       "body": {"attachmentId": "a1", "size": 1000}},
                      {"mimeType": "application/pdf", "filename": "scan.pdf",
                       "body": {"attachmentId": "a2", "size": 11534336}},
                      {"mimeType": "application/octet-stream", "filename": "minutes.docx",
                       "body": {"attachmentId": "a3", "size": 4096}}
                    ]
                  }
                }
                """.formatted(encode("See attached"));
        server.expect(requestTo(BASE + "/messages/m1?format=full"))
                .andRespond(withSuccess(json, MediaType.APPLICATION_JSON));
        server.expect(requestTo(BASE + "/messages/m1/attachments/a3"))
                .andRespond(withSuccess("{\"data\":\"" + encode(TestDocuments.docx("Agenda for Monday")) + "\"}",
                        MediaType.APPLICATION_JSON));

        MailboxMessage msg = source.fetchPage(CREDENTIALS, AFTER, FOLDERS, null).messages().get(0);

        assertThat(msg.attachments()).extracting(Attachment::status).containsExactly(
                Attachment.Status.SKIPPED, Attachment.Status.SKIPPED, Attachment.Status.EXTRACTED);
        assertThat(msg.attachments().get(0).detail()).isEqualTo("Unsupported attachment type: image/jpeg");
        assertThat(msg.attachments().get(1).detail()).startsWith("Attachment too large");
        assertThat(msg.attachments().get(2).mimeType()).isEqualTo(DocxDocumentParser.MIME_TYPE);
        assertThat(msg.attachmentTexts()).hasSize(1);
        assertThat(msg.attachmentTexts().get(0)).contains("Agenda for Monday");
        server.verify();
    }

    @Test
    void unreadableAttachmentIsRecordedAsFailed() {
        server.expect(requestTo(startsWith(BASE + "/messages?")))
                .andRespond(withSuccess("{\"messages\":[{\"id\":\"m1\"}]}", MediaType.APPLICATION_JSON));
        String json = """
                {
                  "id": "m1",
                  "internalDate": "1735725600000",
                  "payload": {
                    "mimeType": "multipart/mixed",
                    "parts": [
                      {"mimeType": "application/pdf", "filename": "broken.pdf",
                       "body": {"attachmentId": "a1", "size": 20}},
                      {"mimeType": "application/pdf", "filename": "gone.pdf",
                       "body": {"attachmentId": "a2", "size": 20}}
                    ]
                  }
                }
                """;
        server.expect(requestTo(BASE + "/messages/m1?format=full"))
                .andRespond(withSuccess(json, MediaType.APPLICATION_JSON));
        server.expect(requestTo(BASE + "/messages/m1/attachments/a1"))
                .andRespond(withSuccess("{\"data\":\"" + encode("not really a pdf") + "\"}",
                        MediaType.APPLICATION_JSON));
        server.expect(requestTo(BASE + "/messages/m1/attachments/a2"))
                .andRespond(withStatus(HttpStatus.NOT_FOUND));

        MailboxMessage msg = source.fetchPage(CREDENTIALS, AFTER, FOLDERS, null).messages().get(0);

        assertThat(msg.attachments()).extracting(Attachment::status)
                .containsExactly(Attachment.Status.FAILED, Attachment.Status.FAILED);
        assertThat(msg.attachments().get(0).detail()).isEqualTo("Validation failed: Invalid PDF header");
        assertThat(msg.attachmentTexts()).isEmpty();
        server.verify();
    }

    @Test
    void skipsMessagesDeletedAfterListing() {
        server.expect(requestTo(startsWith(BASE + "/messages?")))
                .andRespond(withSuccess("{\"messages\":[{\"id\":\"m2\"},{\"id\":\"m1\"}]}", MediaType.APPLICATION_JSON));
        server.expect(requestTo(BASE + "/messages/m1?format=full")).andRespond(withStatus(HttpStatus.NOT_FOUND));
        expectMessage("m2", 2000L);

        MessagePage page = source.fetchPage(CREDENTIALS, AFTER, FOLDERS, null);

        assertThat(page.messages()).extracting(MailboxMessage::externalId).containsExactly("m2");
    }

    @Test
    void unauthorizedMeansExpiredCredentials() {
        server.expect(requestTo(startsWith(BASE + "/messages?"))).andRespond(withStatus(HttpStatus.UNAUTHORIZED));

        assertThatThrownBy(() -> source.fetchPage(CREDENTIALS, AFTER, FOLDERS, null))
                .isInstanceOfSatisfying(MailboxException.class, e -> {
                    assertThat(e.reason()).isEqualTo(MailboxException.Reason.AUTH_EXPIRED);
                    assertThat(e.isTransient()).isFalse();
                });
    }

    @Test
    void serverErrorIsTransient() {
        server.expect(requestTo(startsWith(BASE + "/messages?"))).andRespond(withServiceUnavailable());

        assertThatThrownBy(() -> source.fetchPage(CREDENTIALS, AFTER, FOLDERS, null))
                .isInstanceOfSatisfying(MailboxException.class, e -> {
                    assertThat(e.reason()).isEqualTo(MailboxException.Reason.UNAVAILABLE);
                    assertThat(e.isTransient()).isTrue();
                });
    }

    @Test
    void quotaErrorIsRateLimited() {
        server.expect(requestTo(startsWith(BASE + "/messages?"))).andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS));

        assertThatThrownBy(() -> source.fetchPage(CREDENTIALS, AFTER, FOLDERS, null))
                .isInstanceOfSatisfying(MailboxException.class,
                        e -> assertThat(e.reason()).isEqualTo(MailboxException.Reason.RATE_LIMITED));
    }

    @Test
    void rejectsForeignPageToken() {
        assertThatThrownBy(() -> source.fetchPage(CREDENTIALS, AFTER, FOLDERS, "something-else"))
                .isInstanceOfSatisfying(MailboxException.class,
                        e -> assertThat(e.reason()).isEqualTo(MailboxException.Reason.MALFORMED));
    }

    @Test
    void lazyStreamWalksAllPages() {
        server.expect(requestTo(startsWith(BASE + "/messages?")))
                .andRespond(withSuccess("{\"messages\":[{\"id\":\"m3\"},{\"id\":\"m2\"},{\"id\":\"m1\"}]}",
                        MediaType.APPLICATION_JSON));
        expectMessage("m1", 1000L);
        expectMessage("m2", 2000L);
        expectMessage("m3", 3000L);

        List<String> ids = source.fetchMessagesSince(CREDENTIALS, AFTER, FOLDERS)
                .map(MailboxMessage::externalId)
                .toList();

        assertThat(ids).containsExactly("m1", "m2", "m3");
        server.verify();
    }

    private void expectMessage(String id, long internalDate) {
        String json = """
                {"id": "%s", "threadId": "t-%s", "internalDate": "%d", "labelIds": ["INBOX"],
                 "payload": {"mimeType": "text/plain",
                   "headers": [{"name": "From", "value": "alice@friends.example"}, {"name": "Subject", "value": "Hi"}],
                   "body": {"data": "%s"}}}
                """.formatted(id, id, internalDate, encode("Body of " + id));
        server.expect(requestTo(BASE + "/messages/" + id + "?format=full"))
                .andRespond(withSuccess(json, MediaType.APPLICATION_JSON));
    }

    private static String encode(String text) {
        return encode(text.getBytes(StandardCharsets.UTF_8));
    }

    private static String encode(byte[] content) {
        return Base64.getUrlEncoder().encodeToString(content);
    }
}
