package dev.aparikh.semanticmail.text;

import dev.aparikh.semanticmail.model.TextChunk;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits normalized text into embedding-sized chunks and assembles the text of a message
 * with its attachments.
 *
 * <p>Chunking is greedy. Each window is at most {@code maxChunkSize} characters; when a
 * sentence end ({@code .}, {@code !} or {@code ?} followed by whitespace) falls inside the
 * trailing {@code boundaryWindow} fraction of the window, the cut moves back to it. Chunks
 * are trimmed at the cut points and nothing else is dropped.</p>
 *
 * <p>Stateless and safe for concurrent use.</p>
 */
public class TextChunker {

    private static final Logger log = LoggerFactory.getLogger(TextChunker.class);

    static final String EMAIL_SECTION = "EMAIL CONTENT:";
    static final String ATTACHMENT_SECTION = "ATTACHMENT %d:";
    static final String SECTION_DELIMITER = "\n\n---\n\n";

    /** Rough estimate: one token per four characters of English text */
    private static final int CHARS_PER_TOKEN = 4;

    private final TextNormalizer normalizer;
    private final int maxTokens;
    private final double boundaryWindow;

    public TextChunker(TextNormalizer normalizer, int maxTokens, double boundaryWindow) {
        if (maxTokens < 1) {
            throw new IllegalArgumentException("maxTokens must be >= 1");
        }
        if (boundaryWindow < 0 || boundaryWindow > 1) {
            throw new IllegalArgumentException("boundaryWindow must be within [0, 1]");
        }
        this.normalizer = normalizer;
        this.maxTokens = maxTokens;
        this.boundaryWindow = boundaryWindow;
    }

    public List<TextChunk> chunk(String text, int maxChunkSize) {
        if (maxChunkSize < 1) {
            throw new IllegalArgumentException("maxChunkSize must be >= 1");
        }
        String source = text == null ? "" : text;
        int length = source.length();
        if (length <= maxChunkSize) {
            return List.of(new TextChunk(0, source, true));
        }

        List<String> pieces = new ArrayList<>();
        int start = 0;
        while (start < length) {
            int end = Math.min(start + maxChunkSize, length);
            if (end < length) {
                int cut = findSentenceBreak(source, start, end, maxChunkSize);
                if (cut > start) {
                    end = cut;
                }
            }
            String piece = source.substring(start, end).strip();
            if (!piece.isEmpty()) {
                pieces.add(piece);
            }
            start = end;
        }

        List<TextChunk> chunks = new ArrayList<>(pieces.size());
        for (int i = 0; i < pieces.size(); i++) {
            chunks.add(new TextChunk(i, pieces.get(i), i == pieces.size() - 1));
        }
        log.debug("Split {} chars into {} chunks (max {})", length, chunks.size(), maxChunkSize);
        return chunks;
    }

    /**
     * Builds the text that gets embedded for one message. Empty sections are left out and
     * attachments are numbered over the non-empty ones only.
     */
    public String combine(String primaryText, List<String> attachmentTexts) {
        List<String> parts = new ArrayList<>();
        String primary = normalizer.normalize(primaryText);
        if (!primary.isEmpty()) {
            parts.add(EMAIL_SECTION + "\n" + primary);
        }
        if (attachmentTexts != null) {
            int n = 0;
            for (String attachment : attachmentTexts) {
                String clean = normalizer.normalize(attachment);
                if (clean.isEmpty()) continue;
                n++;
                parts.add(String.format(ATTACHMENT_SECTION, n) + "\n" + clean);
            }
        }
        return String.join(SECTION_DELIMITER, parts);
    }

    public SizeCheck validateSize(String text) {
        String clean = normalizer.normalize(text);
        if (clean.isEmpty()) {
            return SizeCheck.invalid(SizeCheck.EMPTY, 0);
        }
        int estimatedTokens = (clean.length() + CHARS_PER_TOKEN - 1) / CHARS_PER_TOKEN;
        if (estimatedTokens > maxTokens) {
            return SizeCheck.invalid(SizeCheck.TOO_LONG, estimatedTokens);
        }
        return SizeCheck.valid(estimatedTokens);
    }

    /**
     * Returns the position just after the last sentence end within the trailing part of
     * {@code [start, end)}, or -1 when there is none.
     */
    private int findSentenceBreak(String text, int start, int end, int maxChunkSize) {
        int span = Math.max(1, (int) Math.ceil(maxChunkSize * boundaryWindow));
        int floor = Math.max(start + 1, end - span);
        for (int cut = end; cut >= floor; cut--) {
            char punctuation = text.charAt(cut - 1);
            if ((punctuation == '.' || punctuation == '!' || punctuation == '?')
                    && Character.isWhitespace(text.charAt(cut))) {
                return cut;
            }
        }
        return -1;
    }
}
