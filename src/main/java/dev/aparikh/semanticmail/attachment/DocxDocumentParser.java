package dev.aparikh.semanticmail.attachment;

import org.apache.poi.ooxml.POIXMLException;
import org.apache.poi.openxml4j.exceptions.NotOfficeXmlFileException;
import org.apache.poi.xwpf.extractor.XWPFWordExtractor;
import org.apache.poi.xwpf.usermodel.XWPFDocument;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Word (OOXML) text through Apache POI.
 */
public class DocxDocumentParser implements DocumentParser {

    public static final String MIME_TYPE = "application/vnd.openxmlformats-officedocument.wordprocessingml.document";

    // OOXML documents are ZIP archives
    private static final byte[] ZIP_HEADER = {0x50, 0x4B, 0x03, 0x04};

    @Override
    public boolean supports(String mimeType) {
        return MIME_TYPE.equals(mimeType);
    }

    @Override
    public List<String> validate(byte[] content) {
        List<String> errors = new ArrayList<>();
        if (!PdfDocumentParser.startsWith(content, ZIP_HEADER)) {
            errors.add("Not a ZIP archive");
        }
        return errors;
    }

    @Override
    public String parse(byte[] content) throws IOException {
        // closing the extractor closes the document
        try (XWPFWordExtractor extractor = new XWPFWordExtractor(new XWPFDocument(new ByteArrayInputStream(content)))) {
            return extractor.getText();
        } catch (NotOfficeXmlFileException | POIXMLException e) {
            throw new IOException("Unreadable DOCX: " + e.getMessage(), e);
        }
    }
}
