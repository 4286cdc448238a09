package dev.aparikh.semanticmail.model;

import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * A message as delivered by the mailbox provider. Immutable once fetched.
 * Header lookups are case-insensitive.
 */
public record MailboxMessage(
        String externalId,
        String threadId,
        String sender,
        List<String> recipients,
        String subject,
        String bodyText,
        String bodyHtml,
        List<Attachment> attachments,
        Instant sentAt,
        List<String> folderLabels,
        Map<String, String> headers
) {
    public MailboxMessage {
        recipients = recipients == null ? List.of() : List.copyOf(recipients);
        attachments = attachments == null ? List.of() : List.copyOf(attachments);
        folderLabels = folderLabels == null ? List.of() : List.copyOf(folderLabels);
        TreeMap<String, String> h = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (headers != null) {
            headers.forEach((k, v) -> {
                if (k != null && v != null) h.put(k, v);
            });
        }
        headers = Collections.unmodifiableMap(h);
    }

    public Optional<String> header(String name) {
        return Optional.ofNullable(headers.get(name));
    }

    public List<String> attachmentTexts() {
        return attachments.stream()
                .filter(Attachment::hasText)
                .map(Attachment::text)
                .toList();
    }
}
