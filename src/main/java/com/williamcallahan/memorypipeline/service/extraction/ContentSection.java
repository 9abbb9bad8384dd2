package com.williamcallahan.memorypipeline.service.extraction;

/**
 * One section of extracted content, typically a page.
 *
 * @param number 1-based position in the source
 * @param content extracted text
 * @param sentencesAreComplete true when the section boundary also ends a sentence, e.g. a PDF page break
 */
public record ContentSection(int number, String content, boolean sentencesAreComplete) {

    public ContentSection {
        content = content == null ? "" : content;
    }
}
