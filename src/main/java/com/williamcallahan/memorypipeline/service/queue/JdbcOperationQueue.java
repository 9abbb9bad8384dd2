package com.williamcallahan.memorypipeline.service.queue;

import com.williamcallahan.memorypipeline.domain.queue.Operation;
import com.williamcallahan.memorypipeline.service.storage.StorageJson;
import com.williamcallahan.memorypipeline.service.storage.StorageOperationException;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;

/**
 * Operation queue backed by the {@code operations} table.
 *
 * <p>Claiming is a compare-and-set per candidate row: the update only matches while the row is still
 * unlocked (or its lock expired), so two workers racing for the same operation cannot both get an update
 * count of one. Completed operations stay in the table so their failure history remains queryable.
 */
@Service
public class JdbcOperationQueue implements OperationQueue {
    private static final Logger log = LoggerFactory.getLogger(JdbcOperationQueue.class);

    private static final String INSERT_SQL = """
            INSERT INTO operations
                (id, content_id, execution_id, queue_name, planned_steps, completed_steps, remaining_steps,
                 complete, cancelled, failure_count, last_failure_reason, last_attempt_ms, not_before_ms, created_ms)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT(id) DO NOTHING
            """;

    private static final String CANDIDATES_SQL = """
            SELECT id FROM operations
            WHERE queue_name = ? AND complete = 0 AND cancelled = 0
              AND (last_attempt_ms IS NULL OR last_attempt_ms < ?)
              AND (not_before_ms IS NULL OR not_before_ms <= ?)
            ORDER BY created_ms, id
            LIMIT ?
            """;

    private static final String CLAIM_SQL = """
            UPDATE operations SET last_attempt_ms = ?
            WHERE id = ? AND queue_name = ? AND complete = 0 AND cancelled = 0
              AND (last_attempt_ms IS NULL OR last_attempt_ms < ?)
              AND (not_before_ms IS NULL OR not_before_ms <= ?)
            """;

    private static final String COMPLETE_SQL = """
            UPDATE operations SET complete = 1
            WHERE id = ? AND complete = 0 AND last_attempt_ms = ?
            """;

    private static final String RELEASE_SQL = """
            UPDATE operations SET last_attempt_ms = NULL
            WHERE id = ? AND complete = 0 AND last_attempt_ms = ?
            """;

    private static final String REQUEUE_SQL = """
            UPDATE operations
            SET failure_count = failure_count + 1, last_failure_reason = ?, last_attempt_ms = NULL, not_before_ms = ?
            WHERE id = ? AND complete = 0 AND last_attempt_ms = ?
            """;

    private static final String POISON_SQL = """
            UPDATE operations
            SET queue_name = ?, failure_count = failure_count + 1, last_failure_reason = ?, last_attempt_ms = NULL
            WHERE id = ? AND complete = 0 AND last_attempt_ms = ?
            """;

    private static final String FORCE_POISON_SQL = """
            UPDATE operations SET queue_name = ?, last_failure_reason = ?, last_attempt_ms = NULL
            WHERE id = ? AND complete = 0
            """;

    private final JdbcTemplate jdbcTemplate;
    private final StorageJson json;
    private final QueueOptions options;
    private final Clock clock;
    private final RowMapper<Operation> rowMapper = this::mapRow;

    public JdbcOperationQueue(JdbcTemplate jdbcTemplate, StorageJson json, QueueOptions options, Clock clock) {
        this.jdbcTemplate = Objects.requireNonNull(jdbcTemplate, "jdbcTemplate");
        this.json = Objects.requireNonNull(json, "json");
        this.options = Objects.requireNonNull(options, "options");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public boolean enqueue(Operation operation) {
        try {
            int inserted = jdbcTemplate.update(
                    INSERT_SQL,
                    operation.id(),
                    operation.contentId(),
                    operation.executionId(),
                    operation.queueName(),
                    json.write(operation.plannedSteps()),
                    json.write(operation.completedSteps()),
                    json.write(operation.remainingSteps()),
                    operation.complete() ? 1 : 0,
                    operation.cancelled() ? 1 : 0,
                    operation.failureCount(),
                    operation.lastFailureReason().orElse(null),
                    operation.lastAttemptTimestamp().map(Instant::toEpochMilli).orElse(null),
                    operation.notBefore().map(Instant::toEpochMilli).orElse(null),
                    operation.timestamp().toEpochMilli());
            if (inserted == 0) {
                log.debug("[QUEUE] Operation {} already enqueued", operation.id());
            }
            return inserted == 1;
        } catch (DataAccessException exception) {
            throw new StorageOperationException("Failed to enqueue operation " + operation.id(), exception);
        }
    }

    @Override
    public List<Operation> claim(int batchSize) {
        if (batchSize < 1) {
            return List.of();
        }
        long nowMillis = clock.millis();
        long lockCutoff = nowMillis - options.lockDuration().toMillis();
        List<String> candidates = jdbcTemplate.queryForList(
                CANDIDATES_SQL, String.class, options.queueName(), lockCutoff, nowMillis, batchSize * 2);

        List<Operation> claimed = new ArrayList<>(batchSize);
        for (String candidateId : candidates) {
            if (claimed.size() >= batchSize) {
                break;
            }
            int updated = jdbcTemplate.update(
                    CLAIM_SQL, nowMillis, candidateId, options.queueName(), lockCutoff, nowMillis);
            if (updated != 1) {
                log.debug("[QUEUE] Lost claim race for operation {}", candidateId);
                continue;
            }
            find(candidateId).ifPresent(operation -> {
                if (operation.failureCount() > 0) {
                    log.info("[QUEUE] Claimed operation {} step={} attempt={}",
                            operation.id(), operation.currentStep(), operation.failureCount() + 1);
                }
                claimed.add(operation);
            });
        }
        return List.copyOf(claimed);
    }

    @Override
    public void complete(Operation claimed) {
        settle(claimed, "complete", jdbcTemplate.update(COMPLETE_SQL, claimed.id(), claimToken(claimed)));
    }

    @Override
    public void release(Operation claimed) {
        settle(claimed, "release", jdbcTemplate.update(RELEASE_SQL, claimed.id(), claimToken(claimed)));
    }

    @Override
    public void requeue(Operation claimed, String reason, Instant notBefore) {
        int updated = jdbcTemplate.update(
                REQUEUE_SQL, reason, notBefore.toEpochMilli(), claimed.id(), claimToken(claimed));
        settle(claimed, "requeue", updated);
    }

    @Override
    public void toPoison(Operation claimed, String reason) {
        int updated = jdbcTemplate.update(
                POISON_SQL, options.poisonQueueName(), reason, claimed.id(), claimToken(claimed));
        settle(claimed, "poison", updated);
        if (updated == 1) {
            log.warn("[QUEUE] Operation {} moved to {}: {}", claimed.id(), options.poisonQueueName(), reason);
        }
    }

    @Override
    public void forcePoison(String operationId, String reason) {
        int updated = jdbcTemplate.update(FORCE_POISON_SQL, options.poisonQueueName(), reason, operationId);
        if (updated == 1) {
            log.warn("[QUEUE] Operation {} forced to {}: {}", operationId, options.poisonQueueName(), reason);
        }
    }

    @Override
    public int cancelAll(String contentId) {
        int cancelled = jdbcTemplate.update(
                "UPDATE operations SET cancelled = 1 WHERE content_id = ? AND complete = 0 AND cancelled = 0",
                contentId);
        if (cancelled > 0) {
            log.info("[QUEUE] Cancelled {} outstanding operation(s) for {}", cancelled, contentId);
        }
        return cancelled;
    }

    @Override
    public Optional<Operation> find(String operationId) {
        return jdbcTemplate.query("SELECT * FROM operations WHERE id = ?", rowMapper, operationId).stream()
                .findFirst();
    }

    @Override
    public List<Operation> findByContent(String contentId) {
        return jdbcTemplate.query(
                "SELECT * FROM operations WHERE content_id = ? ORDER BY created_ms, id", rowMapper, contentId);
    }

    @Override
    public boolean isCancelled(String operationId) {
        List<Integer> flags = jdbcTemplate.queryForList(
                "SELECT cancelled FROM operations WHERE id = ?", Integer.class, operationId);
        return !flags.isEmpty() && flags.get(0) == 1;
    }

    @Override
    public boolean isPoisoned(Operation operation) {
        return options.poisonQueueName().equals(operation.queueName());
    }

    private static long claimToken(Operation claimed) {
        return claimed.lastAttemptTimestamp()
                .orElseThrow(() -> new IllegalArgumentException("Operation " + claimed.id() + " was not claimed"))
                .toEpochMilli();
    }

    private void settle(Operation claimed, String action, int updated) {
        if (updated == 1) {
            return;
        }
        Optional<Operation> current = find(claimed.id());
        if (current.isPresent() && current.get().complete()) {
            log.debug("[QUEUE] Ignoring {} of already completed operation {}", action, claimed.id());
            return;
        }
        throw new LockContentionAnomaly(claimed.id(), "Cannot " + action + " operation " + claimed.id()
                + ": claim " + claimed.lastAttemptTimestamp().orElse(null) + " is no longer held (current lock "
                + current.flatMap(Operation::lastAttemptTimestamp).orElse(null) + ")");
    }

    private Operation mapRow(ResultSet resultSet, int rowNumber) throws SQLException {
        return new Operation(
                resultSet.getString("id"),
                resultSet.getString("content_id"),
                resultSet.getString("execution_id"),
                resultSet.getString("queue_name"),
                json.read(resultSet.getString("planned_steps"), StorageJson.STRING_LIST),
                json.read(resultSet.getString("completed_steps"), StorageJson.STRING_LIST),
                json.read(resultSet.getString("remaining_steps"), StorageJson.STRING_LIST),
                resultSet.getInt("complete") == 1,
                resultSet.getInt("cancelled") == 1,
                resultSet.getInt("failure_count"),
                Optional.ofNullable(resultSet.getString("last_failure_reason")),
                optionalInstant(resultSet, "last_attempt_ms"),
                optionalInstant(resultSet, "not_before_ms"),
                Instant.ofEpochMilli(resultSet.getLong("created_ms")));
    }

    private static Optional<Instant> optionalInstant(ResultSet resultSet, String column) throws SQLException {
        long millis = resultSet.getLong(column);
        return resultSet.wasNull() ? Optional.empty() : Optional.of(Instant.ofEpochMilli(millis));
    }
}
