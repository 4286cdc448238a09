package dev.aparikh.semanticmail.text;

/**
 * Outcome of {@link TextChunker#validateSize(String)}.
 */
public record SizeCheck(
        boolean isValid,
        String reason,
        int estimatedTokens
) {
    public static final String EMPTY = "empty";
    public static final String TOO_LONG = "too long";

    static SizeCheck valid(int estimatedTokens) {
        return new SizeCheck(true, null, estimatedTokens);
    }

    static SizeCheck invalid(String reason, int estimatedTokens) {
        return new SizeCheck(false, reason, estimatedTokens);
    }
}
