package com.williamcallahan.memorypipeline.service.extraction;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.encryption.InvalidPasswordException;
import org.apache.pdfbox.text.PDFTextStripper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Extracts text from PDF documents using Apache PDFBox, one section per page.
 *
 * <p>Pages are treated as sentence boundaries so partitions never straddle two pages.
 */
@Component
@Order(30)
public class PdfDecoder implements ContentDecoder {
    private static final Logger log = LoggerFactory.getLogger(PdfDecoder.class);

    @Override
    public boolean supports(String mimeType) {
        return MimeTypes.PDF.equals(MimeTypes.normalize(mimeType));
    }

    @Override
    public ExtractedContent decode(byte[] content, String mimeType) {
        try (PDDocument document = Loader.loadPDF(content)) {
            int pageCount = document.getNumberOfPages();
            List<ContentSection> pages = new ArrayList<>(pageCount);
            PDFTextStripper stripper = new PDFTextStripper();
            stripper.setSortByPosition(true);
            for (int pageNumber = 1; pageNumber <= pageCount; pageNumber++) {
                stripper.setStartPage(pageNumber);
                stripper.setEndPage(pageNumber);
                String text = stripper.getText(document);
                pages.add(new ContentSection(pageNumber, text == null ? "" : text, true));
            }
            log.debug("Extracted text from {} PDF pages", pageCount);
            return new ExtractedContent(MimeTypes.PLAIN_TEXT, pages);
        } catch (InvalidPasswordException encrypted) {
            throw new UnsupportedContentException("PDF is password protected", encrypted);
        } catch (IOException unreadable) {
            // PDFBox reports malformed documents as IOException; the bytes are already in memory.
            throw new UnsupportedContentException("PDF could not be parsed: " + unreadable.getMessage(), unreadable);
        }
    }
}
