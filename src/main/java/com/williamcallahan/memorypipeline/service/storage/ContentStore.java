package com.williamcallahan.memorypipeline.service.storage;

import com.williamcallahan.memorypipeline.domain.content.ContentRecord;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;

/**
 * Source-of-truth store for ingested content and its readiness flag.
 */
@Service
public class ContentStore {
    private static final Logger log = LoggerFactory.getLogger(ContentStore.class);

    private static final String UPSERT_SQL = """
            INSERT INTO content_records
                (id, index_name, content, mime_type, byte_size, ready, tags, metadata, created_at, updated_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT(id) DO UPDATE SET
                index_name = excluded.index_name,
                content = excluded.content,
                mime_type = excluded.mime_type,
                byte_size = excluded.byte_size,
                ready = excluded.ready,
                tags = excluded.tags,
                metadata = excluded.metadata,
                updated_at = excluded.updated_at
            """;

    private final JdbcTemplate jdbcTemplate;
    private final StorageJson json;
    private final Clock clock;
    private final RowMapper<ContentRecord> rowMapper = this::mapRow;

    public ContentStore(JdbcTemplate jdbcTemplate, StorageJson json, Clock clock) {
        this.jdbcTemplate = Objects.requireNonNull(jdbcTemplate, "jdbcTemplate");
        this.json = Objects.requireNonNull(json, "json");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Inserts the record, or replaces an existing one with the same id. The original creation time is kept.
     */
    public void upsert(ContentRecord record) {
        try {
            jdbcTemplate.update(
                    UPSERT_SQL,
                    record.id(),
                    record.index(),
                    record.content(),
                    record.mimeType(),
                    record.byteSize(),
                    record.ready() ? 1 : 0,
                    json.write(record.tags()),
                    json.write(record.metadata()),
                    record.createdAt().toString(),
                    record.updatedAt().toString());
        } catch (DataAccessException exception) {
            throw new StorageOperationException("Failed to save content record " + record.id(), exception);
        }
    }

    public Optional<ContentRecord> find(String id) {
        List<ContentRecord> records = jdbcTemplate.query("SELECT * FROM content_records WHERE id = ?", rowMapper, id);
        return records.stream().findFirst();
    }

    public List<ContentRecord> findByIndex(String index) {
        return jdbcTemplate.query(
                "SELECT * FROM content_records WHERE index_name = ? ORDER BY id", rowMapper, index);
    }

    public List<String> findNotReadyIds() {
        return jdbcTemplate.queryForList(
                "SELECT id FROM content_records WHERE ready = 0 ORDER BY id", String.class);
    }

    /**
     * Stores the extracted text and extraction metadata without touching readiness.
     *
     * @return false if the record no longer exists
     */
    public boolean updateContent(String id, String content, Map<String, String> metadata) {
        int updated = jdbcTemplate.update(
                "UPDATE content_records SET content = ?, metadata = ?, updated_at = ? WHERE id = ?",
                content == null ? "" : content,
                json.write(metadata == null ? Map.of() : metadata),
                now().toString(),
                id);
        return updated > 0;
    }

    /**
     * Flips the readiness flag from false to true.
     *
     * @return true only for the call that actually performed the transition
     */
    public boolean markReady(String id) {
        int updated = jdbcTemplate.update(
                "UPDATE content_records SET ready = 1, updated_at = ? WHERE id = ? AND ready = 0",
                now().toString(),
                id);
        if (updated > 0) {
            log.info("[PIPELINE] Content {} is ready", id);
        }
        return updated > 0;
    }

    public boolean isReady(String id) {
        List<Integer> flags = jdbcTemplate.queryForList(
                "SELECT ready FROM content_records WHERE id = ?", Integer.class, id);
        return !flags.isEmpty() && flags.get(0) == 1;
    }

    public boolean delete(String id) {
        return jdbcTemplate.update("DELETE FROM content_records WHERE id = ?", id) > 0;
    }

    /**
     * @return number of records removed
     */
    public int deleteIndex(String index) {
        return jdbcTemplate.update("DELETE FROM content_records WHERE index_name = ?", index);
    }

    private Instant now() {
        return clock.instant();
    }

    private ContentRecord mapRow(ResultSet resultSet, int rowNumber) throws SQLException {
        return new ContentRecord(
                resultSet.getString("id"),
                resultSet.getString("index_name"),
                resultSet.getString("content"),
                resultSet.getString("mime_type"),
                resultSet.getLong("byte_size"),
                resultSet.getInt("ready") == 1,
                json.read(resultSet.getString("tags"), StorageJson.STRING_MAP),
                json.read(resultSet.getString("metadata"), StorageJson.STRING_MAP),
                Instant.parse(resultSet.getString("created_at")),
                Instant.parse(resultSet.getString("updated_at")));
    }
}
