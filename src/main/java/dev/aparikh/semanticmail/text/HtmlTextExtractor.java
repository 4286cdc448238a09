package dev.aparikh.semanticmail.text;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

/**
 * Renders an HTML mail body as plain text for messages that carry no text/plain part.
 */
public class HtmlTextExtractor {

    private static final String LINE_BREAK_MARKER = "\\n";

    public String toText(String html) {
        if (html == null || html.isBlank()) return "";

        Document doc = Jsoup.parse(html);
        doc.select("script, style, meta, link, title").remove();
        doc.select("[style~=(?i)display\\s*:\\s*none], [style~=(?i)visibility\\s*:\\s*hidden]").remove();

        for (Element link : doc.select("a[href]")) {
            String text = link.text().trim();
            String href = link.attr("href");
            if (!text.isEmpty() && !href.isEmpty() && !href.equals(text)) {
                link.text(text + " (" + href + ")");
            }
        }

        // jsoup collapses whitespace in text(), so block boundaries travel as a literal marker
        doc.select("br").after(LINE_BREAK_MARKER);
        doc.select("p, div, li, tr, h1, h2, h3, h4, h5, h6, blockquote").prepend(LINE_BREAK_MARKER);

        return doc.text().replace(LINE_BREAK_MARKER, "\n");
    }
}
