package dev.aparikh.semanticmail.attachment;

import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * PDF text through PDFBox. Encrypted documents fail with an {@link IOException}.
 */
public class PdfDocumentParser implements DocumentParser {

    public static final String MIME_TYPE = "application/pdf";

    private static final byte[] HEADER = "%PDF-".getBytes(StandardCharsets.US_ASCII);

    @Override
    public boolean supports(String mimeType) {
        return MIME_TYPE.equals(mimeType);
    }

    @Override
    public List<String> validate(byte[] content) {
        List<String> errors = new ArrayList<>();
        if (!startsWith(content, HEADER)) {
            errors.add("Invalid PDF header");
        }
        return errors;
    }

    @Override
    public String parse(byte[] content) throws IOException {
        try (PDDocument document = Loader.loadPDF(content)) {
            PDFTextStripper stripper = new PDFTextStripper();
            stripper.setSortByPosition(true);
            return stripper.getText(document);
        }
    }

    static boolean startsWith(byte[] content, byte[] prefix) {
        if (content == null || content.length < prefix.length) return false;
        for (int i = 0; i < prefix.length; i++) {
            if (content[i] != prefix[i]) return false;
        }
        return true;
    }
}
