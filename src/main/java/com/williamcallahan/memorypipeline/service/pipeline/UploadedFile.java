package com.williamcallahan.memorypipeline.service.pipeline;

import com.williamcallahan.memorypipeline.service.extraction.MimeTypes;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * One file of an upload.
 */
public record UploadedFile(String name, String mimeType, byte[] content) {
    static final String TEXT_FILE_NAME = "content.txt";
    static final String URL_FILE_NAME = "content.url";

    public UploadedFile {
        Objects.requireNonNull(name, "name");
        content = content == null ? new byte[0] : content.clone();
        mimeType = mimeType == null || mimeType.isBlank() ? MimeTypes.detect(name) : MimeTypes.normalize(mimeType);
    }

    /**
     * File whose type is detected from its extension.
     */
    public static UploadedFile of(String name, byte[] content) {
        return new UploadedFile(name, null, content);
    }

    public static UploadedFile ofText(String text) {
        return new UploadedFile(TEXT_FILE_NAME, MimeTypes.PLAIN_TEXT, text.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * A web page to download and ingest during extraction.
     */
    public static UploadedFile ofUrl(String url) {
        return new UploadedFile(URL_FILE_NAME, MimeTypes.WEB_PAGE_URL, url.getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public byte[] content() {
        return content.clone();
    }
}
