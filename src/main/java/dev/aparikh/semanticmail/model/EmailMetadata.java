package dev.aparikh.semanticmail.model;

import java.time.Instant;
import java.util.List;

/**
 * Descriptive fields returned alongside a search hit.
 */
public record EmailMetadata(
        String externalId,
        String threadId,
        String subject,
        String sender,
        Instant sentAt,
        List<String> folderLabels
) {
}
