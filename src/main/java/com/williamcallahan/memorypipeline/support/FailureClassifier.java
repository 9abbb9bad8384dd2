package com.williamcallahan.memorypipeline.support;

import com.williamcallahan.memorypipeline.service.embedding.EmbeddingProviderRejectedException;
import com.williamcallahan.memorypipeline.service.embedding.EmbeddingServiceUnavailableException;
import java.io.IOException;
import java.util.Locale;
import org.springframework.dao.TransientDataAccessException;

/**
 * Classifies step failures and builds reason strings without leaking raw error payloads.
 */
public final class FailureClassifier {
    private static final int MAX_REASON_LENGTH = 512;

    private FailureClassifier() {}

    /**
     * Determine a stable error category based on exception messages and causes.
     *
     * @param error failure encountered while running a step
     * @return normalized error category label
     */
    public static String determineErrorType(Throwable error) {
        String message = collectMessages(error).toLowerCase(Locale.ROOT);

        if (message.contains("404") || message.contains("not found")) {
            return "404 Not Found";
        } else if (message.contains("401") || message.contains("unauthorized")) {
            return "401 Unauthorized";
        } else if (message.contains("403") || message.contains("forbidden")) {
            return "403 Forbidden";
        } else if (message.contains("429") || message.contains("too many requests")) {
            return "429 Rate Limited";
        } else if (message.contains("connection") || message.contains("timeout") || message.contains("timed out")) {
            return "Connection Error";
        } else if (message.contains("database is locked") || message.contains("busy")) {
            return "Storage Busy";
        } else if (message.contains("unavailable") || message.contains("503") || message.contains("502")) {
            return "Service Unavailable";
        }
        return "Unknown Error";
    }

    /**
     * Determines whether a failure is worth retrying later.
     *
     * <p>I/O problems, provider throttling, connection failures and busy storage are transient.
     * Programming errors such as invalid arguments are not.
     *
     * @param error the exception to classify
     * @return true if the error is transient
     */
    public static boolean isTransient(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof EmbeddingServiceUnavailableException
                    || current instanceof IOException
                    || current instanceof TransientDataAccessException) {
                return true;
            }
            if (current instanceof IllegalArgumentException
                    || current instanceof EmbeddingProviderRejectedException) {
                return false;
            }
            current = current.getCause();
        }

        String errorType = determineErrorType(error);
        return "Connection Error".equals(errorType)
                || "429 Rate Limited".equals(errorType)
                || "Storage Busy".equals(errorType)
                || "Service Unavailable".equals(errorType);
    }

    /**
     * Builds a single-line failure reason suitable for persisting on an operation.
     */
    public static String describe(Throwable error) {
        String details = collectMessages(error).replace("\r", " ").replace("\n", " ").trim();
        String reason = error.getClass().getSimpleName() + (details.isEmpty() ? "" : ": " + details);
        if (reason.length() > MAX_REASON_LENGTH) {
            return reason.substring(0, MAX_REASON_LENGTH) + "...";
        }
        return reason;
    }

    private static String collectMessages(Throwable error) {
        StringBuilder messageBuilder = new StringBuilder();
        Throwable current = error;
        while (current != null) {
            String currentMessage = current.getMessage();
            if (currentMessage != null && !currentMessage.isBlank()) {
                if (messageBuilder.length() > 0) {
                    messageBuilder.append(' ');
                }
                messageBuilder.append(currentMessage);
            }
            current = current.getCause();
        }
        return messageBuilder.toString();
    }
}
