package com.williamcallahan.memorypipeline.service.storage;

import com.williamcallahan.memorypipeline.support.ContentHasher;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Filesystem-backed document storage laid out as {@code root/index/document/file}.
 *
 * <p>Path segments are sanitized to filesystem-safe names, and every resolved path is checked to stay
 * under the root. Writes go through a temp file and a move so readers never observe partial content.
 */
public class LocalDocumentStorage implements DocumentStorage {
    private static final Logger log = LoggerFactory.getLogger(LocalDocumentStorage.class);

    private static final int MAX_SAFE_NAME_LENGTH = 150;
    private static final int SAFE_NAME_PREFIX_LENGTH = 80;
    private static final int SAFE_NAME_SUFFIX_LENGTH = 40;

    private final Path root;
    private final ContentHasher hasher;

    public LocalDocumentStorage(Path root, ContentHasher hasher) throws IOException {
        this.root = Objects.requireNonNull(root, "root").toAbsolutePath().normalize();
        this.hasher = Objects.requireNonNull(hasher, "hasher");
        Files.createDirectories(this.root);
    }

    @Override
    public void writeFile(String index, String documentId, String fileName, byte[] content) throws IOException {
        Path target = resolve(index, documentId, fileName);
        Files.createDirectories(target.getParent());
        Path temp = Files.createTempFile(target.getParent(), ".upload-", ".tmp");
        try {
            Files.write(temp, content);
            moveIntoPlace(temp, target);
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    @Override
    public void writeText(String index, String documentId, String fileName, String content) throws IOException {
        writeFile(index, documentId, fileName, content.getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public byte[] readFile(String index, String documentId, String fileName) throws IOException {
        return Files.readAllBytes(resolve(index, documentId, fileName));
    }

    @Override
    public String readText(String index, String documentId, String fileName) throws IOException {
        return Files.readString(resolve(index, documentId, fileName), StandardCharsets.UTF_8);
    }

    @Override
    public boolean exists(String index, String documentId, String fileName) {
        return Files.isRegularFile(resolve(index, documentId, fileName));
    }

    @Override
    public void deleteDocument(String index, String documentId) throws IOException {
        deleteRecursively(resolveDirectory(index, documentId));
    }

    @Override
    public void deleteIndex(String index) throws IOException {
        deleteRecursively(resolveDirectory(index));
    }

    Path root() {
        return root;
    }

    /**
     * Converts an arbitrary identifier into a filesystem-safe name, hashing long ones so they stay unique.
     */
    String safeName(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Storage path segment must not be blank");
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9._-]", "_");
        if (sanitized.equals(".") || sanitized.equals("..")) {
            sanitized = sanitized.replace('.', '_');
        }
        if (sanitized.length() <= MAX_SAFE_NAME_LENGTH) {
            return sanitized;
        }
        String prefix = sanitized.substring(0, SAFE_NAME_PREFIX_LENGTH);
        String suffix = sanitized.substring(sanitized.length() - SAFE_NAME_SUFFIX_LENGTH);
        return prefix + "_" + hasher.shortSha256(value) + "_" + suffix;
    }

    private Path resolve(String index, String documentId, String fileName) {
        return contained(resolveDirectory(index, documentId).resolve(safeName(fileName)));
    }

    private Path resolveDirectory(String... segments) {
        Path current = root;
        for (String segment : List.of(segments)) {
            current = current.resolve(safeName(segment));
        }
        return contained(current);
    }

    private Path contained(Path candidate) {
        Path normalized = candidate.normalize();
        if (!normalized.startsWith(root) || normalized.equals(root)) {
            throw new IllegalArgumentException("Resolved storage path escapes the storage root: " + candidate);
        }
        return normalized;
    }

    private static void moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException atomicMoveNotSupported) {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteRecursively(Path directory) throws IOException {
        if (!Files.exists(directory)) {
            return;
        }
        List<Path> paths;
        try (Stream<Path> walk = Files.walk(directory)) {
            paths = walk.sorted(Comparator.reverseOrder()).toList();
        }
        for (Path path : paths) {
            try {
                Files.delete(path);
            } catch (NoSuchFileException alreadyGone) {
                log.debug("Path already removed: {}", path);
            }
        }
    }
}
