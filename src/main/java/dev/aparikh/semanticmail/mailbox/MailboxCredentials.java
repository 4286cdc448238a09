package dev.aparikh.semanticmail.mailbox;

import java.time.Instant;

/**
 * Opaque tokens handed over by the authentication layer. Refreshing them is not this
 * module's concern; an expired token surfaces as {@link MailboxException.Reason#AUTH_EXPIRED}.
 */
public record MailboxCredentials(
        String accessToken,
        String refreshToken,
        Instant expiresAt
) {
    public MailboxCredentials {
        if (accessToken == null || accessToken.isBlank()) {
            throw new IllegalArgumentException("accessToken must be provided");
        }
    }

    public static MailboxCredentials bearer(String accessToken) {
        return new MailboxCredentials(accessToken, null, null);
    }

    @Override
    public String toString() {
        return "MailboxCredentials[expiresAt=" + expiresAt + "]";
    }
}
