package com.williamcallahan.memorypipeline.service.storage;

import java.io.IOException;

/**
 * Stores uploaded files and the artifacts generated from them, grouped by index and document.
 */
public interface DocumentStorage {

    void writeFile(String index, String documentId, String fileName, byte[] content) throws IOException;

    void writeText(String index, String documentId, String fileName, String content) throws IOException;

    byte[] readFile(String index, String documentId, String fileName) throws IOException;

    String readText(String index, String documentId, String fileName) throws IOException;

    boolean exists(String index, String documentId, String fileName);

    /**
     * Removes every file stored for the document. Missing directories are not an error.
     */
    void deleteDocument(String index, String documentId) throws IOException;

    /**
     * Removes every file stored under the index. Missing directories are not an error.
     */
    void deleteIndex(String index) throws IOException;
}
