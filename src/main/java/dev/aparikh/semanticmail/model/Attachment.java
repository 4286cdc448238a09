package dev.aparikh.semanticmail.model;

/**
 * Attachment of a fetched message. {@code text} holds the extracted plain text and is
 * {@code null} unless {@code status} is {@link Status#EXTRACTED}; {@code detail} says why
 * an attachment was skipped or failed.
 */
public record Attachment(
        String filename,
        String mimeType,
        long size,
        String text,
        Status status,
        String detail
) {
    public enum Status {
        EXTRACTED,
        SKIPPED,
        FAILED
    }

    public Attachment {
        if (status == null) {
            status = text != null ? Status.EXTRACTED : Status.SKIPPED;
        }
    }

    public Attachment(String filename, String mimeType, long size, String text) {
        this(filename, mimeType, size, text, null, null);
    }

    public static Attachment skipped(String filename, String mimeType, long size, String reason) {
        return new Attachment(filename, mimeType, size, null, Status.SKIPPED, reason);
    }

    public static Attachment failed(String filename, String mimeType, long size, String error) {
        return new Attachment(filename, mimeType, size, null, Status.FAILED, error);
    }

    public boolean hasText() {
        return text != null && !text.isBlank();
    }
}
