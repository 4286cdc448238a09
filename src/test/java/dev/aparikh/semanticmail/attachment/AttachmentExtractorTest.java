package dev.aparikh.semanticmail.attachment;

import dev.aparikh.semanticmail.model.Attachment;
import dev.aparikh.semanticmail.text.HtmlTextExtractor;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AttachmentExtractorTest {

    private static final String DOCX = DocxDocumentParser.MIME_TYPE;
    private static final long LIMIT = 1024 * 1024;

    private final AttachmentExtractor extractor = new AttachmentExtractor(List.of(
            new PdfDocumentParser(),
            new DocxDocumentParser(),
            new HtmlAttachmentParser(new HtmlTextExtractor()),
            new PlainTextParser()), LIMIT);

    @Test
    void extractsTextFromPdf() {
        Attachment a = extractor.extract("report.pdf", "application/pdf", TestDocuments.pdf("Quarterly report for Q1"));

        assertThat(a.status()).isEqualTo(Attachment.Status.EXTRACTED);
        assertThat(a.text()).contains("Quarterly report for Q1");
        assertThat(a.detail()).isNull();
    }

    @Test
    void extractsTextFromDocx() {
        Attachment a = extractor.extract("minutes.docx", DOCX, TestDocuments.docx("Minutes of the meeting", "Action items"));

        assertThat(a.status()).isEqualTo(Attachment.Status.EXTRACTED);
        assertThat(a.text()).contains("Minutes of the meeting").contains("Action items");
    }

    @Test
    void plainAndHtmlAttachmentsAreRead() {
        Attachment csv = extractor.extract("q1.csv", "text/csv", "q1,100".getBytes(StandardCharsets.UTF_8));
        Attachment html = extractor.extract("page.html", "text/html",
                "<html><body><p>Hello</p><script>x()</script></body></html>".getBytes(StandardCharsets.UTF_8));

        assertThat(csv.text()).isEqualTo("q1,100");
        assertThat(html.text()).isEqualTo("Hello");
    }

    @Test
    void unsupportedTypesAreSkipped() {
        Attachment a = extractor.extract("logo.png", "image/png", new byte[]{1, 2, 3});

        assertThat(a.status()).isEqualTo(Attachment.Status.SKIPPED);
        assertThat(a.text()).isNull();
        assertThat(a.detail()).isEqualTo("Unsupported attachment type: image/png");
        assertThat(extractor.isSupported("image/png")).isFalse();
        assertThat(extractor.isSupported("application/pdf")).isTrue();
    }

    @Test
    void oversizedAttachmentsAreSkippedBeforeDownload() {
        assertThat(extractor.skipReason("application/pdf", 11L * 1024 * 1024))
                .startsWith("Attachment too large");
        assertThat(extractor.skipReason("application/pdf", 2048)).isNull();

        Attachment a = extractor.extract("big.txt", "text/plain", new byte[(int) LIMIT + 1]);
        assertThat(a.status()).isEqualTo(Attachment.Status.SKIPPED);
        assertThat(a.detail()).startsWith("Attachment too large");
    }

    @Test
    void invalidPdfHeaderFailsValidation() {
        Attachment a = extractor.extract("fake.pdf", "application/pdf", "not a pdf".getBytes(StandardCharsets.UTF_8));

        assertThat(a.status()).isEqualTo(Attachment.Status.FAILED);
        assertThat(a.detail()).isEqualTo("Validation failed: Invalid PDF header");
    }

    @Test
    void docxThatIsNotAZipFailsValidation() {
        Attachment a = extractor.extract("fake.docx", DOCX, "plain words".getBytes(StandardCharsets.UTF_8));

        assertThat(a.status()).isEqualTo(Attachment.Status.FAILED);
        assertThat(a.detail()).isEqualTo("Validation failed: Not a ZIP archive");
    }

    @Test
    void corruptDocumentIsRecordedAsFailed() {
        byte[] truncated = {0x50, 0x4B, 0x03, 0x04, 0x00, 0x01, 0x02};

        Attachment a = extractor.extract("broken.docx", DOCX, truncated);

        assertThat(a.status()).isEqualTo(Attachment.Status.FAILED);
        assertThat(a.detail()).isNotBlank();
    }

    @Test
    void resolvesMimeTypeFromFilenameWhenMissingOrGeneric() {
        assertThat(extractor.resolveMimeType("report.pdf", "application/octet-stream")).isEqualTo("application/pdf");
        assertThat(extractor.resolveMimeType("minutes.docx", "")).isEqualTo(DOCX);
        assertThat(extractor.resolveMimeType("notes.txt", "Text/Plain; charset=UTF-8")).isEqualTo("text/plain");
        assertThat(extractor.resolveMimeType("blob", null)).isEqualTo("application/octet-stream");
    }

    @Test
    void rejectsNonPositiveLimit() {
        assertThatThrownBy(() -> new AttachmentExtractor(List.of(), 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void statsCountEachOutcome() {
        AttachmentStats stats = AttachmentStats.of(List.of(
                extractor.extract("q1.csv", "text/csv", "q1,100".getBytes(StandardCharsets.UTF_8)),
                extractor.extract("logo.png", "image/png", new byte[]{1}),
                extractor.extract("fake.pdf", "application/pdf", new byte[]{1, 2})));

        assertThat(stats).isEqualTo(new AttachmentStats(3, 1, 1, 1));
    }
}
