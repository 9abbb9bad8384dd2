package com.williamcallahan.memorypipeline.service.extraction;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.Locale;
import org.jsoup.Connection;
import org.jsoup.HttpStatusException;
import org.jsoup.Jsoup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Downloads the page behind a URL upload so it can be decoded like any other file.
 */
@Component
public class WebPageFetcher {
    private static final Logger log = LoggerFactory.getLogger(WebPageFetcher.class);

    private static final Duration FETCH_TIMEOUT = Duration.ofSeconds(30);
    private static final int MAX_BODY_BYTES = 20 * 1024 * 1024;

    /**
     * Downloaded page body and its declared content type.
     */
    public record FetchedPage(String url, String mimeType, byte[] content) {}

    /**
     * @throws UnsupportedContentException for invalid URLs and client errors that retrying cannot fix
     * @throws IOException for connection problems, throttling and server errors
     */
    public FetchedPage fetch(String url) throws IOException {
        String target = validate(url);
        try {
            Connection.Response response = Jsoup.connect(target)
                    .timeout((int) FETCH_TIMEOUT.toMillis())
                    .maxBodySize(MAX_BODY_BYTES)
                    .ignoreContentType(true)
                    .followRedirects(true)
                    .execute();
            String mimeType = MimeTypes.normalize(response.contentType());
            log.debug("Fetched {} ({} bytes, {})", target, response.bodyAsBytes().length, mimeType);
            return new FetchedPage(target, mimeType.isEmpty() ? MimeTypes.HTML : mimeType, response.bodyAsBytes());
        } catch (HttpStatusException statusException) {
            int status = statusException.getStatusCode();
            if (status >= 400 && status < 500 && status != 408 && status != 429) {
                throw new UnsupportedContentException(
                        "Web page " + target + " returned HTTP " + status, statusException);
            }
            throw statusException;
        }
    }

    private static String validate(String url) {
        String trimmed = url == null ? "" : url.trim();
        if (trimmed.isEmpty()) {
            throw new UnsupportedContentException("Web page URL is empty");
        }
        try {
            String scheme = URI.create(trimmed).getScheme();
            if (scheme == null) {
                throw new UnsupportedContentException("Web page URL has no scheme: " + trimmed);
            }
            String normalizedScheme = scheme.toLowerCase(Locale.ROOT);
            if (!normalizedScheme.equals("http") && !normalizedScheme.equals("https")) {
                throw new UnsupportedContentException("Only http and https URLs can be fetched: " + trimmed);
            }
        } catch (IllegalArgumentException invalid) {
            throw new UnsupportedContentException("Invalid web page URL: " + trimmed, invalid);
        }
        return trimmed;
    }
}
