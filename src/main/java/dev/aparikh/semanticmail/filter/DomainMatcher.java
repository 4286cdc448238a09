package dev.aparikh.semanticmail.filter;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Matches sender domains against configured patterns. A plain pattern matches the domain
 * itself and its sub-domains; {@code *} is a wildcard over any characters.
 */
final class DomainMatcher {

    private final List<Pattern> patterns;

    DomainMatcher(List<String> domainPatterns) {
        this.patterns = domainPatterns.stream()
                .filter(p -> p != null && !p.isBlank())
                .map(DomainMatcher::compile)
                .toList();
    }

    boolean matches(String domain) {
        if (domain == null || domain.isEmpty()) return false;
        for (Pattern p : patterns) {
            if (p.matcher(domain).matches()) return true;
        }
        return false;
    }

    /**
     * Extracts the lower-cased domain of an address such as {@code "Jane <jane@example.com>"}.
     * Returns an empty string when there is no domain.
     */
    static String extractDomain(String sender) {
        if (sender == null) return "";
        int at = sender.lastIndexOf('@');
        if (at == -1 || at == sender.length() - 1) return "";
        String domain = sender.substring(at + 1);
        int close = domain.indexOf('>');
        if (close != -1) domain = domain.substring(0, close);
        return domain.trim().toLowerCase(Locale.ROOT);
    }

    private static Pattern compile(String pattern) {
        String p = pattern.trim().toLowerCase(Locale.ROOT);
        String[] parts = p.split("\\*", -1);
        StringBuilder regex = new StringBuilder("(?:.*\\.)?");
        for (int i = 0; i < parts.length; i++) {
            if (i > 0) regex.append(".*");
            regex.append(Pattern.quote(parts[i]));
        }
        return Pattern.compile(regex.toString());
    }
}
