package dev.aparikh.semanticmail.filter;

import java.util.List;

/**
 * Immutable switches and lists that drive {@link FilterEngine}.
 */
public record FilterPolicy(
        boolean domainFiltering,
        boolean contentFiltering,
        boolean sizeFiltering,
        boolean strictMode,
        long maxEmailSizeBytes,
        List<String> blacklistedDomains,
        List<String> whitelistedDomains
) {
    public static final long DEFAULT_MAX_EMAIL_SIZE = 10L * 1024 * 1024;

    /** Marketing, social and automated senders that rarely carry personal correspondence */
    public static final List<String> DEFAULT_BLACKLISTED_DOMAINS = List.of(
            "no-reply.com", "noreply.com", "mailer-daemon.com", "do-not-reply.com", "donotreply.com",
            "marketing.com", "newsletter.com", "promo.com", "updates.com", "notifications.com",
            "facebookmail.com", "mail.twitter.com", "linkedin.com", "instagram.com", "tiktok.com",
            "snapchat.com",
            "amazon.com", "amazonses.com", "ebay.com", "paypal.com", "stripe.com", "shopify.com",
            "mailchimp.com", "constantcontact.com",
            "substack.com", "medium.com", "beehiiv.com", "convertkit.com", "mailerlite.com",
            "github.com", "gitlab.com", "bitbucket.org", "atlassian.com", "slack.com", "discord.com",
            "zoom.us", "calendly.com"
    );

    public FilterPolicy {
        blacklistedDomains = blacklistedDomains == null ? List.of() : List.copyOf(blacklistedDomains);
        whitelistedDomains = whitelistedDomains == null ? List.of() : List.copyOf(whitelistedDomains);
        if (maxEmailSizeBytes <= 0) {
            throw new IllegalArgumentException("maxEmailSizeBytes must be > 0");
        }
    }

    public static FilterPolicy defaults() {
        return new FilterPolicy(true, true, true, false, DEFAULT_MAX_EMAIL_SIZE,
                DEFAULT_BLACKLISTED_DOMAINS, List.of());
    }
}
