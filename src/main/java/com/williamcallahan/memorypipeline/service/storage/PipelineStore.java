package com.williamcallahan.memorypipeline.service.storage;

import com.williamcallahan.memorypipeline.domain.pipeline.Pipeline;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

/**
 * Durable pipeline state, one row per document.
 *
 * <p>The full {@link Pipeline} is stored as JSON; id, scope, execution and completion are mirrored
 * into columns so stale writes and recovery scans can be filtered in SQL.
 */
@Service
public class PipelineStore {
    private static final Logger log = LoggerFactory.getLogger(PipelineStore.class);

    private static final String UPSERT_SQL = """
            INSERT INTO pipelines (id, owner_scope, execution_id, complete, payload, created_at, updated_at)
            VALUES (?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT(id) DO UPDATE SET
                owner_scope = excluded.owner_scope,
                execution_id = excluded.execution_id,
                complete = excluded.complete,
                payload = excluded.payload,
                created_at = excluded.created_at,
                updated_at = excluded.updated_at
            """;

    private static final String UPDATE_CURRENT_SQL = """
            UPDATE pipelines SET complete = ?, payload = ?, updated_at = ?
            WHERE id = ? AND execution_id = ?
            """;

    private final JdbcTemplate jdbcTemplate;
    private final StorageJson json;

    public PipelineStore(JdbcTemplate jdbcTemplate, StorageJson json) {
        this.jdbcTemplate = Objects.requireNonNull(jdbcTemplate, "jdbcTemplate");
        this.json = Objects.requireNonNull(json, "json");
    }

    /**
     * Inserts or replaces the pipeline, whatever execution is currently stored.
     */
    public void save(Pipeline pipeline) {
        try {
            jdbcTemplate.update(
                    UPSERT_SQL,
                    pipeline.id(),
                    pipeline.ownerScope(),
                    pipeline.executionId(),
                    pipeline.isComplete() ? 1 : 0,
                    json.write(pipeline),
                    pipeline.createdAt().toString(),
                    pipeline.lastUpdatedAt().toString());
        } catch (DataAccessException exception) {
            throw new StorageOperationException("Failed to save pipeline " + pipeline.id(), exception);
        }
    }

    /**
     * Persists the pipeline only if its execution is still the stored one.
     *
     * @return false if a newer execution replaced it in the meantime
     */
    public boolean saveIfCurrentExecution(Pipeline pipeline) {
        int updated;
        try {
            updated = jdbcTemplate.update(
                    UPDATE_CURRENT_SQL,
                    pipeline.isComplete() ? 1 : 0,
                    json.write(pipeline),
                    pipeline.lastUpdatedAt().toString(),
                    pipeline.id(),
                    pipeline.executionId());
        } catch (DataAccessException exception) {
            throw new StorageOperationException("Failed to update pipeline " + pipeline.id(), exception);
        }
        if (updated == 0) {
            log.debug("[PIPELINE] Skipped stale write for pipeline={} execution={}",
                    pipeline.id(), pipeline.executionId());
        }
        return updated == 1;
    }

    public Optional<Pipeline> find(String pipelineId) {
        List<String> payloads = jdbcTemplate.queryForList(
                "SELECT payload FROM pipelines WHERE id = ?", String.class, pipelineId);
        return payloads.stream().findFirst().map(payload -> json.read(payload, Pipeline.class));
    }

    /**
     * Pipelines that still have remaining steps, oldest first.
     */
    public List<Pipeline> findIncomplete() {
        return jdbcTemplate
                .queryForList("SELECT payload FROM pipelines WHERE complete = 0 ORDER BY created_at", String.class)
                .stream()
                .map(payload -> json.read(payload, Pipeline.class))
                .toList();
    }

    public List<Pipeline> findByScope(String ownerScope) {
        return jdbcTemplate
                .queryForList("SELECT payload FROM pipelines WHERE owner_scope = ? ORDER BY id",
                        String.class, ownerScope)
                .stream()
                .map(payload -> json.read(payload, Pipeline.class))
                .toList();
    }

    public boolean delete(String pipelineId) {
        return jdbcTemplate.update("DELETE FROM pipelines WHERE id = ?", pipelineId) > 0;
    }

    /**
     * Removes every pipeline of an index except the one given, typically the index deletion pipeline itself.
     *
     * @return number of pipelines removed
     */
    public int deleteByScopeExcept(String ownerScope, String keptPipelineId) {
        return jdbcTemplate.update(
                "DELETE FROM pipelines WHERE owner_scope = ? AND id <> ?", ownerScope, keptPipelineId);
    }
}
