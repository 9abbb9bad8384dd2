package com.williamcallahan.memorypipeline.service.extraction;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * MIME type constants and extension-based detection for uploaded files.
 */
public final class MimeTypes {
    public static final String PLAIN_TEXT = "text/plain";
    public static final String MARKDOWN = "text/markdown";
    public static final String MARKDOWN_LEGACY = "text/x-markdown";
    public static final String HTML = "text/html";
    public static final String XHTML = "application/xhtml+xml";
    public static final String JSON = "application/json";
    public static final String CSV = "text/csv";
    public static final String XML = "application/xml";
    public static final String PDF = "application/pdf";
    public static final String WEB_PAGE_URL = "text/x-uri";
    public static final String TEXT_EMBEDDING_VECTOR = "float[]";
    public static final String OCTET_STREAM = "application/octet-stream";

    private static final Map<String, String> EXTENSION_TYPES = Map.ofEntries(
            Map.entry("txt", PLAIN_TEXT),
            Map.entry("text", PLAIN_TEXT),
            Map.entry("md", MARKDOWN),
            Map.entry("markdown", MARKDOWN),
            Map.entry("htm", HTML),
            Map.entry("html", HTML),
            Map.entry("xhtml", XHTML),
            Map.entry("json", JSON),
            Map.entry("csv", CSV),
            Map.entry("xml", XML),
            Map.entry("pdf", PDF),
            Map.entry("url", WEB_PAGE_URL),
            Map.entry("text_embedding", TEXT_EMBEDDING_VECTOR));

    private MimeTypes() {}

    /**
     * Detects the type from the file extension, case-insensitively.
     */
    public static Optional<String> tryDetect(String fileName) {
        if (fileName == null) {
            return Optional.empty();
        }
        int dot = fileName.lastIndexOf('.');
        if (dot < 0 || dot == fileName.length() - 1) {
            return Optional.empty();
        }
        String extension = fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
        return Optional.ofNullable(EXTENSION_TYPES.get(extension));
    }

    public static String detect(String fileName) {
        return tryDetect(fileName).orElse(OCTET_STREAM);
    }

    public static boolean isMarkdown(String mimeType) {
        return MARKDOWN.equals(mimeType) || MARKDOWN_LEGACY.equals(mimeType);
    }

    /**
     * Strips parameters such as {@code ; charset=utf-8} and lowercases the type.
     */
    public static String normalize(String mimeType) {
        if (mimeType == null) {
            return "";
        }
        int separator = mimeType.indexOf(';');
        String bare = separator >= 0 ? mimeType.substring(0, separator) : mimeType;
        return bare.trim().toLowerCase(Locale.ROOT);
    }
}
