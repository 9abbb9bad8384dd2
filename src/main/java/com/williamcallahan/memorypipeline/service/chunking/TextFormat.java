package com.williamcallahan.memorypipeline.service.chunking;

import java.util.List;

/**
 * Boundary rules for line splitting. Each separator entry is a set of characters tried together,
 * in priority order.
 */
public enum TextFormat {
    PLAIN_TEXT(List.of(".", "?!", ";", ":", ",", ")]}", " ", "-")),
    MARKDOWN(List.of(".", "?!", ";", ":", ",", ")]}", " ", "-", "\n"));

    private final List<String> separators;

    TextFormat(List<String> separators) {
        this.separators = separators;
    }

    List<String> separators() {
        return separators;
    }

    public static TextFormat forMimeType(String mimeType) {
        return mimeType != null && mimeType.startsWith("text/markdown") ? MARKDOWN : PLAIN_TEXT;
    }
}
