package dev.aparikh.semanticmail.mailbox;

import dev.aparikh.semanticmail.model.MailboxMessage;

import java.util.List;

/**
 * One page of messages in ascending send-time order. {@code nextPageToken} is opaque to
 * callers and {@code null} on the last page.
 */
public record MessagePage(
        List<MailboxMessage> messages,
        String nextPageToken
) {
    public MessagePage {
        messages = messages == null ? List.of() : List.copyOf(messages);
    }

    public static MessagePage empty() {
        return new MessagePage(List.of(), null);
    }

    public boolean hasNext() {
        return nextPageToken != null;
    }
}
