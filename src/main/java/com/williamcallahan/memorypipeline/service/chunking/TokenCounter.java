package com.williamcallahan.memorypipeline.service.chunking;

/**
 * Counts tokens the way the target embedding model would.
 */
@FunctionalInterface
public interface TokenCounter {

    int countTokens(String text);
}
