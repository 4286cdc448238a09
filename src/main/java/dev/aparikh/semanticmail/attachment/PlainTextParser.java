package dev.aparikh.semanticmail.attachment;

import java.nio.charset.StandardCharsets;

/**
 * {@code text/*} attachments other than HTML, read as UTF-8.
 */
public class PlainTextParser implements DocumentParser {

    @Override
    public boolean supports(String mimeType) {
        return mimeType != null && mimeType.startsWith("text/") && !mimeType.equals(HtmlAttachmentParser.MIME_TYPE);
    }

    @Override
    public String parse(byte[] content) {
        return new String(content, StandardCharsets.UTF_8);
    }
}
