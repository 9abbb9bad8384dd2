package com.williamcallahan.memorypipeline.service.embedding;

import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.sqlite.SQLiteConfig;
import org.sqlite.SQLiteDataSource;

/**
 * SQLite-backed embedding cache.
 *
 * <p>The database runs in WAL mode with a busy timeout so concurrent pipeline workers can read and
 * write the same keys. Entries are upserted wholesale. A database file that cannot be opened is moved
 * aside with a timestamp and a fresh one is created.
 */
public class EmbeddingCacheService implements EmbeddingCache {
    private static final Logger CACHE_LOG = LoggerFactory.getLogger("EMBEDDING_CACHE");
    private static final String CORRUPT_CACHE_PREFIX = "embeddings_cache.corrupt.";
    private static final DateTimeFormatter CACHE_TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
    private static final int BUSY_TIMEOUT_MILLIS = 5_000;

    private static final String CREATE_TABLE = """
            CREATE TABLE IF NOT EXISTS embeddings_cache (
                key TEXT NOT NULL PRIMARY KEY,
                vector BLOB NOT NULL,
                token_count INTEGER NULL,
                timestamp TEXT NOT NULL
            )""";
    private static final String SELECT_ENTRY =
            "SELECT vector, token_count, timestamp FROM embeddings_cache WHERE key = ?";
    private static final String UPSERT_ENTRY = """
            INSERT INTO embeddings_cache (key, vector, token_count, timestamp) VALUES (?, ?, ?, ?)
            ON CONFLICT(key) DO UPDATE SET
                vector = excluded.vector,
                token_count = excluded.token_count,
                timestamp = excluded.timestamp""";

    private final Path databasePath;
    private final EmbeddingCacheMode mode;
    private final Clock clock;
    private final AtomicLong cacheHits = new AtomicLong();
    private final AtomicLong cacheMisses = new AtomicLong();
    private final AtomicLong cacheWrites = new AtomicLong();
    private volatile JdbcTemplate jdbc;

    /**
     * Cache counters.
     *
     * @param cacheHits lookups that found an entry
     * @param cacheMisses lookups that found nothing
     * @param cacheWrites entries written
     * @param hitRate hits divided by lookups, 0 when nothing was looked up
     * @param databasePath cache database location
     * @param mode read/write mode
     */
    public record CacheStats(
            long cacheHits, long cacheMisses, long cacheWrites, double hitRate, String databasePath,
            EmbeddingCacheMode mode) {}

    /**
     * Wraps cache persistence failures as a runtime exception suitable for Spring initialization paths.
     */
    private static final class EmbeddingCacheOperationException extends IllegalStateException {
        private EmbeddingCacheOperationException(String message, Exception cause) {
            super(message, cause);
        }
    }

    public EmbeddingCacheService(Path databasePath, EmbeddingCacheMode mode, Clock clock) {
        this.databasePath = Objects.requireNonNull(databasePath, "databasePath").toAbsolutePath().normalize();
        this.mode = Objects.requireNonNull(mode, "mode");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Opens the database and creates the table, quarantining an unreadable database file first.
     */
    @PostConstruct
    public void initializeCache() {
        try {
            Files.createDirectories(databasePath.getParent());
        } catch (IOException exception) {
            throw new EmbeddingCacheOperationException("Failed to create cache directory", exception);
        }

        jdbc = new JdbcTemplate(openDataSource());
        try {
            jdbc.execute(CREATE_TABLE);
        } catch (DataAccessException exception) {
            if (!isCorruptDatabase(exception)) {
                throw exception;
            }
            quarantineDatabase();
            jdbc = new JdbcTemplate(openDataSource());
            jdbc.execute(CREATE_TABLE);
        }
        CACHE_LOG.info("Embedding cache ready (mode={}, path={})", mode, databasePath);
    }

    @Override
    public Optional<CachedEmbedding> tryGet(EmbeddingCacheKey key) {
        if (!mode.canRead()) {
            return Optional.empty();
        }
        List<CachedEmbedding> rows = requireJdbc().query(
                SELECT_ENTRY,
                (resultSet, rowNumber) -> {
                    int tokenCount = resultSet.getInt("token_count");
                    OptionalInt reportedTokens =
                            resultSet.wasNull() ? OptionalInt.empty() : OptionalInt.of(tokenCount);
                    return new CachedEmbedding(
                            decodeVector(resultSet.getBytes("vector")),
                            reportedTokens,
                            Instant.parse(resultSet.getString("timestamp")));
                },
                key.toCompositeKey());
        if (rows.isEmpty()) {
            cacheMisses.incrementAndGet();
            CACHE_LOG.debug("Cache MISS");
            return Optional.empty();
        }
        cacheHits.incrementAndGet();
        CACHE_LOG.debug("Cache HIT");
        return Optional.of(rows.get(0));
    }

    @Override
    public void store(EmbeddingCacheKey key, float[] vector, OptionalInt tokenCount) {
        Objects.requireNonNull(vector, "vector");
        if (!mode.canWrite()) {
            return;
        }
        Integer reportedTokens = tokenCount.isPresent() ? tokenCount.getAsInt() : null;
        requireJdbc().update(
                UPSERT_ENTRY,
                key.toCompositeKey(),
                encodeVector(vector),
                reportedTokens,
                clock.instant().toString());
        cacheWrites.incrementAndGet();
    }

    @Override
    public EmbeddingCacheMode mode() {
        return mode;
    }

    public CacheStats getStats() {
        long hits = cacheHits.get();
        long misses = cacheMisses.get();
        long lookups = hits + misses;
        double hitRate = lookups == 0 ? 0.0 : (double) hits / lookups;
        return new CacheStats(hits, misses, cacheWrites.get(), hitRate, databasePath.toString(), mode);
    }

    static byte[] encodeVector(float[] vector) {
        ByteBuffer buffer = ByteBuffer.allocate(vector.length * Float.BYTES).order(ByteOrder.LITTLE_ENDIAN);
        for (float value : vector) {
            buffer.putFloat(value);
        }
        return buffer.array();
    }

    static float[] decodeVector(byte[] bytes) {
        if (bytes == null || bytes.length % Float.BYTES != 0) {
            throw new IllegalStateException("Cached vector has an invalid byte length");
        }
        ByteBuffer buffer = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
        float[] vector = new float[bytes.length / Float.BYTES];
        for (int index = 0; index < vector.length; index++) {
            vector[index] = buffer.getFloat();
        }
        return vector;
    }

    private SQLiteDataSource openDataSource() {
        SQLiteConfig config = new SQLiteConfig();
        config.setJournalMode(SQLiteConfig.JournalMode.WAL);
        config.setBusyTimeout(BUSY_TIMEOUT_MILLIS);
        SQLiteDataSource dataSource = new SQLiteDataSource(config);
        dataSource.setUrl("jdbc:sqlite:" + databasePath);
        return dataSource;
    }

    private JdbcTemplate requireJdbc() {
        JdbcTemplate current = jdbc;
        if (current == null) {
            throw new IllegalStateException("Embedding cache has not been initialized");
        }
        return current;
    }

    private static boolean isCorruptDatabase(DataAccessException exception) {
        String message = String.valueOf(exception.getMostSpecificCause().getMessage()).toLowerCase(Locale.ROOT);
        return message.contains("not a database") || message.contains("malformed");
    }

    private void quarantineDatabase() {
        String timestamp = LocalDateTime.now(clock).format(CACHE_TIMESTAMP_FORMAT);
        Path quarantined = databasePath.resolveSibling(CORRUPT_CACHE_PREFIX + timestamp + ".db");
        try {
            Files.move(databasePath, quarantined);
            Files.deleteIfExists(databasePath.resolveSibling(databasePath.getFileName() + "-wal"));
            Files.deleteIfExists(databasePath.resolveSibling(databasePath.getFileName() + "-shm"));
        } catch (IOException exception) {
            throw new EmbeddingCacheOperationException("Failed to quarantine corrupt embedding cache", exception);
        }
        CACHE_LOG.warn("Embedding cache database was unreadable; moved to {}", quarantined.getFileName());
    }
}
