package com.williamcallahan.memorypipeline.service.extraction;

import java.nio.charset.StandardCharsets;
import java.util.Set;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Passes text-like formats through unchanged.
 */
@Component
@Order(10)
public class PlainTextDecoder implements ContentDecoder {
    private static final Set<String> SUPPORTED = Set.of(
            MimeTypes.PLAIN_TEXT,
            MimeTypes.MARKDOWN,
            MimeTypes.MARKDOWN_LEGACY,
            MimeTypes.JSON,
            MimeTypes.CSV,
            MimeTypes.XML);

    @Override
    public boolean supports(String mimeType) {
        return SUPPORTED.contains(MimeTypes.normalize(mimeType));
    }

    @Override
    public ExtractedContent decode(byte[] content, String mimeType) {
        String text = new String(content, StandardCharsets.UTF_8);
        if (!text.isEmpty() && text.charAt(0) == '\uFEFF') {
            text = text.substring(1);
        }
        return ExtractedContent.singleSection(MimeTypes.normalize(mimeType), text);
    }
}
