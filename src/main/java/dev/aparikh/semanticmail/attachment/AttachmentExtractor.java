package dev.aparikh.semanticmail.attachment;

import dev.aparikh.semanticmail.model.Attachment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.MediaTypeFactory;

import java.io.IOException;
import java.util.List;
import java.util.Locale;

/**
 * Picks a {@link DocumentParser} for each attachment and records the outcome on the
 * returned {@link Attachment}: extracted text, or why it was skipped or failed.
 *
 * <p>When the mailbox reports no usable MIME type, the type is looked up from the file
 * extension. Attachments above {@code maxBytes} are skipped without being parsed, so callers
 * can ask {@link #skipReason} before downloading the content at all.</p>
 */
public class AttachmentExtractor {

    private static final Logger log = LoggerFactory.getLogger(AttachmentExtractor.class);

    private static final String OCTET_STREAM = MediaType.APPLICATION_OCTET_STREAM_VALUE;

    private final List<DocumentParser> parsers;
    private final long maxBytes;

    public AttachmentExtractor(List<DocumentParser> parsers, long maxBytes) {
        if (maxBytes < 1) {
            throw new IllegalArgumentException("maxBytes must be >= 1");
        }
        this.parsers = List.copyOf(parsers);
        this.maxBytes = maxBytes;
    }

    public String resolveMimeType(String filename, String declared) {
        String type = declared == null ? "" : declared.trim().toLowerCase(Locale.ROOT);
        int params = type.indexOf(';');
        if (params >= 0) {
            type = type.substring(0, params).trim();
        }
        if (!type.isEmpty() && !type.equals(OCTET_STREAM)) {
            return type;
        }
        if (filename == null || filename.isBlank()) {
            return type.isEmpty() ? OCTET_STREAM : type;
        }
        return MediaTypeFactory.getMediaType(filename)
                .map(MediaType::toString)
                .map(t -> t.toLowerCase(Locale.ROOT))
                .orElse(type.isEmpty() ? OCTET_STREAM : type);
    }

    public boolean isSupported(String mimeType) {
        return parserFor(mimeType) != null;
    }

    /**
     * Returns why an attachment of this type and declared size will not be parsed, or
     * {@code null} when it should be downloaded and extracted.
     */
    public String skipReason(String mimeType, long size) {
        if (!isSupported(mimeType)) {
            return "Unsupported attachment type: " + mimeType;
        }
        if (size > maxBytes) {
            return "Attachment too large: " + size + " bytes (limit " + maxBytes + ")";
        }
        return null;
    }

    public Attachment extract(String filename, String mimeType, byte[] content) {
        long size = content == null ? 0 : content.length;
        String skip = skipReason(mimeType, size);
        if (skip != null) {
            return Attachment.skipped(filename, mimeType, size, skip);
        }
        if (size == 0) {
            return Attachment.skipped(filename, mimeType, 0, "Empty attachment");
        }

        DocumentParser parser = parserFor(mimeType);
        List<String> errors = parser.validate(content);
        if (!errors.isEmpty()) {
            log.warn("Attachment {} ({}) failed validation: {}", filename, mimeType, errors);
            return Attachment.failed(filename, mimeType, size, "Validation failed: " + String.join(", ", errors));
        }
        try {
            String text = parser.parse(content);
            if (text == null || text.isBlank()) {
                return Attachment.skipped(filename, mimeType, size, "No text content");
            }
            return new Attachment(filename, mimeType, size, text.strip(), Attachment.Status.EXTRACTED, null);
        } catch (IOException | RuntimeException e) {
            log.warn("Could not extract text from attachment {} ({}): {}", filename, mimeType, e.getMessage());
            return Attachment.failed(filename, mimeType, size, e.getMessage() == null ? e.toString() : e.getMessage());
        }
    }

    private DocumentParser parserFor(String mimeType) {
        if (mimeType == null) return null;
        for (DocumentParser parser : parsers) {
            if (parser.supports(mimeType)) return parser;
        }
        return null;
    }
}
