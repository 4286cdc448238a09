package dev.aparikh.semanticmail.filter;

import dev.aparikh.semanticmail.model.FilterReason;
import dev.aparikh.semanticmail.model.MailboxMessage;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Decides whether a fetched message is new and whether it is worth indexing.
 *
 * <p>The decision depends only on the message, the id set passed in and the immutable
 * {@link FilterPolicy}, so classifying the same message twice gives the same answer.</p>
 *
 * <p>Checks run in this order: missing provider id, duplicate, size, whitelisted domain,
 * blacklisted domain, bulk-mail headers, auto-reply headers, content patterns.</p>
 */
public class FilterEngine {

    private static final List<Pattern> AUTOMATED_PATTERNS = patterns(
            "do[-_. ]?not[-_. ]?reply", "no[-_. ]?reply", "mailer[-_. ]?daemon", "postmaster",
            "\\bautomated\\b", "\\bauto[-_ ]?reply\\b", "\\bout of (the )?office\\b");

    private static final List<Pattern> MARKETING_PATTERNS = patterns(
            "\\bunsubscribe\\b", "\\bmarketing\\b", "\\bpromotional\\b", "\\bnewsletter\\b",
            "\\bcampaign\\b", "\\boffers?\\b", "\\bdeals?\\b", "\\bsale\\b", "\\bdiscounts?\\b");

    private static final List<Pattern> NOTIFICATION_PATTERNS = patterns(
            "\\bnotifications?\\b", "\\balerts?\\b", "\\breminders?\\b", "\\bupdates?\\b",
            "\\bdigest\\b", "\\bsummary\\b");

    private static final int MARKETING_THRESHOLD = 2;
    private static final int NOTIFICATION_THRESHOLD = 3;

    private final FilterPolicy policy;
    private final DomainMatcher blacklist;
    private final DomainMatcher whitelist;

    public FilterEngine(FilterPolicy policy) {
        this.policy = policy;
        this.blacklist = new DomainMatcher(policy.blacklistedDomains());
        this.whitelist = new DomainMatcher(policy.whitelistedDomains());
    }

    public FilterDecision classify(MailboxMessage msg, Set<String> existingIds) {
        if (msg.externalId() == null || msg.externalId().isBlank()) {
            return FilterDecision.filtered(FilterReason.PROCESSING_ERROR, "missing provider id");
        }
        if (existingIds != null && existingIds.contains(msg.externalId())) {
            return FilterDecision.duplicate();
        }

        if (policy.sizeFiltering()) {
            long size = byteLength(msg.bodyText()) + byteLength(msg.bodyHtml());
            if (size > policy.maxEmailSizeBytes()) {
                return FilterDecision.filtered(FilterReason.PROCESSING_ERROR,
                        "email size exceeds limit: " + size + " bytes");
            }
        }

        String domain = DomainMatcher.extractDomain(msg.sender());
        if (policy.domainFiltering() && !domain.isEmpty()) {
            if (whitelist.matches(domain)) {
                return FilterDecision.kept("whitelisted domain: " + domain);
            }
            if (blacklist.matches(domain)) {
                return FilterDecision.filtered(FilterReason.MARKETING, "blacklisted domain: " + domain);
            }
        }

        if (isBulkMail(msg)) {
            return FilterDecision.filtered(FilterReason.MARKETING, "bulk mail headers");
        }
        if (isAutoReply(msg)) {
            return FilterDecision.filtered(FilterReason.AUTOMATED, "auto-reply headers");
        }

        if (policy.contentFiltering()) {
            FilterDecision byContent = checkContent(msg);
            if (byContent != null) return byContent;
        }
        return FilterDecision.kept(null);
    }

    private FilterDecision checkContent(MailboxMessage msg) {
        String envelope = lower(msg.sender()) + " " + lower(msg.subject());
        if (countMatches(AUTOMATED_PATTERNS, envelope) > 0) {
            return FilterDecision.filtered(FilterReason.AUTOMATED, "automated sender or subject");
        }

        String full = envelope + " " + lower(msg.bodyText());
        int marketing = countMatches(MARKETING_PATTERNS, full);
        if (marketing >= MARKETING_THRESHOLD) {
            return FilterDecision.filtered(FilterReason.MARKETING, "marketing content score " + marketing);
        }

        if (policy.strictMode()) {
            int notifications = countMatches(NOTIFICATION_PATTERNS, full);
            if (notifications >= NOTIFICATION_THRESHOLD) {
                return FilterDecision.filtered(FilterReason.AUTOMATED,
                        "notification content score " + notifications);
            }
        }
        return null;
    }

    private static boolean isBulkMail(MailboxMessage msg) {
        if (msg.header("List-Unsubscribe").isPresent() || msg.header("List-Id").isPresent()) {
            return true;
        }
        String precedence = msg.header("Precedence").map(FilterEngine::lower).orElse("");
        return precedence.equals("bulk") || precedence.equals("list");
    }

    private static boolean isAutoReply(MailboxMessage msg) {
        String autoSubmitted = msg.header("Auto-Submitted").map(FilterEngine::lower).orElse("no");
        if (!autoSubmitted.equals("no")) return true;
        if (msg.header("X-Autoreply").isPresent() || msg.header("X-Autorespond").isPresent()) {
            return true;
        }
        return msg.header("Precedence").map(FilterEngine::lower).orElse("").equals("auto_reply");
    }

    private static int countMatches(List<Pattern> patterns, String text) {
        int count = 0;
        for (Pattern p : patterns) {
            if (p.matcher(text).find()) count++;
        }
        return count;
    }

    private static long byteLength(String s) {
        return s == null ? 0 : s.getBytes(StandardCharsets.UTF_8).length;
    }

    private static String lower(String s) {
        return s == null ? "" : s.trim().toLowerCase(Locale.ROOT);
    }

    private static List<Pattern> patterns(String... regexes) {
        return Arrays.stream(regexes).map(Pattern::compile).toList();
    }
}
