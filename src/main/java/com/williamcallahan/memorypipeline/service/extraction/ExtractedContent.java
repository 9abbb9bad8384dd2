package com.williamcallahan.memorypipeline.service.extraction;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.util.List;

/**
 * Structured output of a decoder.
 */
public record ExtractedContent(String mimeType, List<ContentSection> sections) {

    public ExtractedContent {
        sections = sections == null ? List.of() : List.copyOf(sections);
    }

    public static ExtractedContent singleSection(String mimeType, String text) {
        return new ExtractedContent(mimeType, List.of(new ContentSection(1, text, true)));
    }

    /**
     * Joins the non-blank sections, separating those that end a sentence with a blank line.
     */
    @JsonIgnore
    public String text() {
        StringBuilder text = new StringBuilder();
        for (ContentSection section : sections) {
            String sectionText = section.content().trim();
            if (sectionText.isEmpty()) {
                continue;
            }
            text.append(sectionText);
            text.append(section.sentencesAreComplete() ? "\n\n" : " ");
        }
        return text.toString().trim();
    }

    /**
     * True when any section boundary is also a sentence boundary.
     */
    @JsonIgnore
    public boolean pagesEndSentences() {
        return sections.size() > 1 && sections.stream().allMatch(ContentSection::sentencesAreComplete);
    }
}
