package dev.aparikh.semanticmail.model;

/**
 * Bounded segment of normalized text sized for one embedding request.
 */
public record TextChunk(
        int index,
        String content,
        boolean isComplete
) {
}
