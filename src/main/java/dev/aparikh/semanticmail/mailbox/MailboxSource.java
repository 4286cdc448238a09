package dev.aparikh.semanticmail.mailbox;

import dev.aparikh.semanticmail.model.MailboxMessage;

import java.time.Instant;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Read access to a user's remote mailbox.
 *
 * <p>Messages come back in ascending send-time order and the listing can be restarted from
 * any timestamp. Delivery is at-least-once: a message may show up again on a later call.
 * Failures are reported as {@link MailboxException} so callers can tell an expired login from
 * a network problem.</p>
 */
public interface MailboxSource {

    /**
     * Fetches one page of messages sent after {@code after} in any of {@code folders}.
     *
     * @param pageToken token from the previous page, or {@code null} for the first page
     * @throws MailboxException on any provider failure
     */
    MessagePage fetchPage(MailboxCredentials credentials, Instant after, Set<String> folders, String pageToken);

    /**
     * Lazy sequence over all pages. Each page is requested only when the stream reaches it.
     */
    default Stream<MailboxMessage> fetchMessagesSince(MailboxCredentials credentials, Instant after,
                                                      Set<String> folders) {
        Iterator<MessagePage> pages = new Iterator<>() {
            private MessagePage current;

            @Override
            public boolean hasNext() {
                return current == null || current.hasNext();
            }

            @Override
            public MessagePage next() {
                if (!hasNext()) throw new NoSuchElementException();
                String token = current == null ? null : current.nextPageToken();
                current = fetchPage(credentials, after, folders, token);
                return current;
            }
        };
        return StreamSupport.stream(Spliterators.spliteratorUnknownSize(pages, Spliterator.ORDERED), false)
                .flatMap(page -> page.messages().stream());
    }
}
