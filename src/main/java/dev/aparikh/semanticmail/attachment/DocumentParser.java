package dev.aparikh.semanticmail.attachment;

import java.io.IOException;
import java.util.List;

/**
 * Turns the raw bytes of one attachment format into plain text.
 */
public interface DocumentParser {

    boolean supports(String mimeType);

    /**
     * Cheap structural checks run before parsing. An empty list means the content looks
     * parseable.
     */
    default List<String> validate(byte[] content) {
        return List.of();
    }

    String parse(byte[] content) throws IOException;
}
