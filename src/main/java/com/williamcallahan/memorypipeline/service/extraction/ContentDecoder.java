package com.williamcallahan.memorypipeline.service.extraction;

import java.io.IOException;

/**
 * Turns the bytes of an uploaded file into text sections.
 */
public interface ContentDecoder {

    boolean supports(String mimeType);

    /**
     * @throws UnsupportedContentException if the content is corrupt or cannot be decoded by this decoder
     * @throws IOException if reading the content failed in a way that may succeed on retry
     */
    ExtractedContent decode(byte[] content, String mimeType) throws IOException;
}
