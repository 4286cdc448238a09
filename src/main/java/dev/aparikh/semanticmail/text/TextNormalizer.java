package dev.aparikh.semanticmail.text;

import java.util.regex.Pattern;

/**
 * Cleans raw message bodies and attachment text before chunking.
 *
 * <p>Pure and total: never throws, {@code null} or blank input yields an empty string.
 * Tabs become spaces; every other control character below 0x20 except {@code \n}, and DEL,
 * is removed. Non-ASCII content is left alone.</p>
 */
public class TextNormalizer {

    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\x00-\\x09\\x0B-\\x1F\\x7F]");
    private static final Pattern SPACE_RUNS = Pattern.compile(" {2,}");
    private static final Pattern SPACES_AROUND_NEWLINE = Pattern.compile(" *\n *");
    private static final Pattern EXCESS_NEWLINES = Pattern.compile("\n{3,}");

    public String normalize(String raw) {
        if (raw == null || raw.isBlank()) return "";

        String text = raw.replace("\r\n", "\n").replace('\r', '\n');
        text = text.replace('\t', ' ');
        text = CONTROL_CHARS.matcher(text).replaceAll("");
        text = SPACE_RUNS.matcher(text).replaceAll(" ");
        text = SPACES_AROUND_NEWLINE.matcher(text).replaceAll("\n");
        text = EXCESS_NEWLINES.matcher(text).replaceAll("\n\n");
        return text.strip();
    }
}
