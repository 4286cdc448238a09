package dev.aparikh.semanticmail.attachment;

import dev.aparikh.semanticmail.text.HtmlTextExtractor;

import java.nio.charset.StandardCharsets;

/**
 * HTML attachments reduced to their visible text.
 */
public class HtmlAttachmentParser implements DocumentParser {

    public static final String MIME_TYPE = "text/html";

    private final HtmlTextExtractor html;

    public HtmlAttachmentParser(HtmlTextExtractor html) {
        this.html = html;
    }

    @Override
    public boolean supports(String mimeType) {
        return MIME_TYPE.equals(mimeType);
    }

    @Override
    public String parse(byte[] content) {
        return html.toText(new String(content, StandardCharsets.UTF_8));
    }
}
