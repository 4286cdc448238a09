package dev.aparikh.semanticmail.attachment;

import dev.aparikh.semanticmail.model.Attachment;

import java.util.Collection;

/**
 * Counts of attachment outcomes for one message or batch.
 */
public record AttachmentStats(
        int total,
        int extracted,
        int skipped,
        int failed
) {
    public static AttachmentStats of(Collection<Attachment> attachments) {
        int extracted = 0;
        int skipped = 0;
        int failed = 0;
        for (Attachment a : attachments) {
            switch (a.status()) {
                case EXTRACTED -> extracted++;
                case SKIPPED -> skipped++;
                case FAILED -> failed++;
            }
        }
        return new AttachmentStats(attachments.size(), extracted, skipped, failed);
    }
}
