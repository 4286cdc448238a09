package dev.aparikh.semanticmail.mailbox;

import com.fasterxml.jackson.databind.JsonNode;
import dev.aparikh.semanticmail.attachment.AttachmentExtractor;
import dev.aparikh.semanticmail.attachment.AttachmentStats;
import dev.aparikh.semanticmail.model.Attachment;
import dev.aparikh.semanticmail.model.MailboxMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Base64;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * {@link MailboxSource} over the Gmail REST API.
 *
 * <p>Gmail lists message ids newest first, so the first call collects every id in the window,
 * reverses them and hands them out in pages of {@code pageSize}. The page token carries the
 * ids still to deliver, which keeps the source stateless between calls.</p>
 *
 * <p>Attachment text comes from the {@link AttachmentExtractor}. Attachments it cannot parse,
 * or that exceed its size limit, are never downloaded and are delivered as skipped.</p>
 */
public class GmailMailboxSource implements MailboxSource {

    private static final Logger log = LoggerFactory.getLogger(GmailMailboxSource.class);

    private static final String TOKEN_PREFIX = "ids:";
    private static final int LIST_PAGE_SIZE = 500;

    private final RestClient restClient;
    private final int pageSize;
    private final AttachmentExtractor attachmentExtractor;

    public GmailMailboxSource(RestClient restClient, int pageSize, AttachmentExtractor attachmentExtractor) {
        if (pageSize < 1) {
            throw new IllegalArgumentException("pageSize must be >= 1");
        }
        this.restClient = restClient;
        this.pageSize = pageSize;
        this.attachmentExtractor = attachmentExtractor;
    }

    @Override
    public MessagePage fetchPage(MailboxCredentials credentials, Instant after, Set<String> folders, String pageToken) {
        List<String> pending = pageToken == null
                ? listIdsAscending(credentials, after, folders)
                : decodeToken(pageToken);

        List<String> pageIds = pending.subList(0, Math.min(pageSize, pending.size()));
        List<MailboxMessage> messages = new ArrayList<>(pageIds.size());
        for (String id : pageIds) {
            MailboxMessage message = fetchMessage(credentials, id);
            if (message != null) messages.add(message);
        }

        List<String> rest = pending.subList(pageIds.size(), pending.size());
        String next = rest.isEmpty() ? null : TOKEN_PREFIX + String.join(",", rest);
        return new MessagePage(messages, next);
    }

    List<String> listIdsAscending(MailboxCredentials credentials, Instant after, Set<String> folders) {
        String query = buildQuery(after, folders);
        List<String> ids = new ArrayList<>();
        String gmailToken = null;
        do {
            String token = gmailToken;
            JsonNode resp = call(() -> restClient.get()
                    .uri(b -> {
                        b.path("/messages")
                                .queryParam("q", "{query}")
                                .queryParam("maxResults", LIST_PAGE_SIZE);
                        if (token != null) b.queryParam("pageToken", token);
                        return b.build(query);
                    })
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + credentials.accessToken())
                    .retrieve()
                    .body(JsonNode.class), "list messages");
            if (resp == null) break;
            for (JsonNode m : resp.path("messages")) {
                ids.add(m.path("id").asText());
            }
            gmailToken = resp.hasNonNull("nextPageToken") ? resp.get("nextPageToken").asText() : null;
        } while (gmailToken != null);

        Collections.reverse(ids);
        log.debug("Listed {} message ids for query '{}'", ids.size(), query);
        return ids;
    }

    static String buildQuery(Instant after, Set<String> folders) {
        StringBuilder q = new StringBuilder("after:").append(after.getEpochSecond());
        if (folders != null && !folders.isEmpty()) {
            String in = folders.stream()
                    .sorted()
                    .map(f -> "in:" + f.toLowerCase(Locale.ROOT))
                    .collect(Collectors.joining(" "));
            q.append(" {").append(in).append('}');
        }
        return q.toString();
    }

    private MailboxMessage fetchMessage(MailboxCredentials credentials, String id) {
        JsonNode msg;
        try {
            msg = call(() -> restClient.get()
                    .uri("/messages/{id}?format=full", id)
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + credentials.accessToken())
                    .retrieve()
                    .body(JsonNode.class), "get message " + id);
        } catch (MailboxException e) {
            if (e.reason() == MailboxException.Reason.MALFORMED) {
                // typically deleted between listing and fetching
                log.warn("Skipping message {}: {}", id, e.getMessage());
                return null;
            }
            throw e;
        }
        if (msg == null) return null;
        return toMessage(credentials, msg);
    }

    private MailboxMessage toMessage(MailboxCredentials credentials, JsonNode msg) {
        String id = msg.path("id").asText();
        JsonNode payload = msg.path("payload");

        Map<String, String> headers = new LinkedHashMap<>();
        for (JsonNode h : payload.path("headers")) {
            headers.putIfAbsent(h.path("name").asText(), h.path("value").asText());
        }
        List<String> labels = new ArrayList<>();
        msg.path("labelIds").forEach(l -> labels.add(l.asText()));

        StringBuilder text = new StringBuilder();
        StringBuilder html = new StringBuilder();
        List<Attachment> attachments = new ArrayList<>();
        collectParts(credentials, id, payload, text, html, attachments);
        if (!attachments.isEmpty()) {
            AttachmentStats stats = AttachmentStats.of(attachments);
            log.debug("Message {} attachments: {} extracted, {} skipped, {} failed",
                    id, stats.extracted(), stats.skipped(), stats.failed());
        }

        Instant sentAt = msg.hasNonNull("internalDate")
                ? Instant.ofEpochMilli(msg.get("internalDate").asLong())
                : null;

        return new MailboxMessage(
                id,
                msg.path("threadId").asText(null),
                headerValue(headers, "From"),
                recipients(headers),
                headerValue(headers, "Subject"),
                text.toString(),
                html.toString(),
                attachments,
                sentAt,
                labels,
                headers);
    }

    private void collectParts(MailboxCredentials credentials, String messageId, JsonNode part,
                              StringBuilder text, StringBuilder html, List<Attachment> attachments) {
        String mimeType = part.path("mimeType").asText("").toLowerCase(Locale.ROOT);
        String filename = part.path("filename").asText("");
        JsonNode body = part.path("body");

        if (!filename.isEmpty()) {
            attachments.add(readAttachment(credentials, messageId, filename, mimeType, body));
        } else if (mimeType.equals("text/plain")) {
            text.append(decode(body.path("data").asText(null)));
        } else if (mimeType.equals("text/html")) {
            html.append(decode(body.path("data").asText(null)));
        }

        for (JsonNode child : part.path("parts")) {
            collectParts(credentials, messageId, child, text, html, attachments);
        }
    }

    private Attachment readAttachment(MailboxCredentials credentials, String messageId, String filename,
                                      String declaredType, JsonNode body) {
        String mimeType = attachmentExtractor.resolveMimeType(filename, declaredType);
        long size = body.path("size").asLong(0);
        String skip = attachmentExtractor.skipReason(mimeType, size);
        if (skip != null) {
            log.debug("Skipping attachment {} of message {}: {}", filename, messageId, skip);
            return Attachment.skipped(filename, mimeType, size, skip);
        }

        byte[] data;
        try {
            data = attachmentData(credentials, messageId, body);
        } catch (MailboxException e) {
            if (e.reason() != MailboxException.Reason.MALFORMED) throw e;
            log.warn("Could not download attachment {} of message {}: {}", filename, messageId, e.getMessage());
            return Attachment.failed(filename, mimeType, size, e.getMessage());
        }
        if (data == null) {
            return Attachment.failed(filename, mimeType, size, "Attachment has no content");
        }
        return attachmentExtractor.extract(filename, mimeType, data);
    }

    private byte[] attachmentData(MailboxCredentials credentials, String messageId, JsonNode body) {
        if (body.hasNonNull("data")) {
            return decodeBytes(body.get("data").asText());
        }
        if (!body.hasNonNull("attachmentId")) return null;
        String attachmentId = body.get("attachmentId").asText();
        JsonNode resp = call(() -> restClient.get()
                .uri("/messages/{id}/attachments/{attachmentId}", messageId, attachmentId)
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + credentials.accessToken())
                .retrieve()
                .body(JsonNode.class), "get attachment of " + messageId);
        if (resp == null || !resp.hasNonNull("data")) return null;
        return decodeBytes(resp.get("data").asText());
    }

    private static List<String> recipients(Map<String, String> headers) {
        List<String> all = new ArrayList<>();
        for (String name : List.of("To", "Cc")) {
            String value = headerValue(headers, name);
            if (value == null) continue;
            Arrays.stream(value.split(","))
                    .map(String::trim)
                    .filter(s -> !s.isEmpty())
                    .forEach(all::add);
        }
        return all;
    }

    private static String headerValue(Map<String, String> headers, String name) {
        for (Map.Entry<String, String> e : headers.entrySet()) {
            if (e.getKey().equalsIgnoreCase(name)) return e.getValue();
        }
        return null;
    }

    static String decode(String base64Url) {
        return new String(decodeBytes(base64Url), StandardCharsets.UTF_8);
    }

    static byte[] decodeBytes(String base64Url) {
        if (base64Url == null || base64Url.isEmpty()) return new byte[0];
        try {
            return Base64.getUrlDecoder().decode(base64Url);
        } catch (IllegalArgumentException e) {
            throw new MailboxException(MailboxException.Reason.MALFORMED, "Invalid base64url content", e);
        }
    }

    private static List<String> decodeToken(String pageToken) {
        if (!pageToken.startsWith(TOKEN_PREFIX)) {
            throw new MailboxException(MailboxException.Reason.MALFORMED, "Unrecognised page token");
        }
        String ids = pageToken.substring(TOKEN_PREFIX.length());
        return ids.isEmpty() ? List.of() : Arrays.asList(ids.split(","));
    }

    private static <T> T call(Supplier<T> request, String what) {
        try {
            return request.get();
        } catch (RestClientResponseException e) {
            throw translate(e.getStatusCode(), what, e);
        } catch (ResourceAccessException e) {
            throw new MailboxException(MailboxException.Reason.UNAVAILABLE, "Gmail unreachable: " + what, e);
        } catch (RestClientException | IllegalArgumentException e) {
            throw new MailboxException(MailboxException.Reason.MALFORMED, "Unreadable Gmail response: " + what, e);
        }
    }

    static MailboxException translate(HttpStatusCode status, String what, Throwable cause) {
        int code = status.value();
        if (code == 401 || code == 403) {
            return new MailboxException(MailboxException.Reason.AUTH_EXPIRED,
                    "Gmail rejected the credentials (" + code + ") during " + what, cause);
        }
        if (code == 429) {
            return new MailboxException(MailboxException.Reason.RATE_LIMITED, "Gmail quota exceeded during " + what, cause);
        }
        if (status.is5xxServerError()) {
            return new MailboxException(MailboxException.Reason.UNAVAILABLE,
                    "Gmail error " + code + " during " + what, cause);
        }
        return new MailboxException(MailboxException.Reason.MALFORMED, "Gmail returned " + code + " for " + what, cause);
    }
}
