package com.gtmalpha.research.orchestration.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gtmalpha.research.orchestration.delivery.DeliveryRecordStore;
import com.gtmalpha.research.orchestration.model.AttemptOutcome;
import com.gtmalpha.research.orchestration.model.DeliveryRecord;
import com.gtmalpha.research.orchestration.model.ProviderAttempt;
import com.gtmalpha.research.orchestration.model.ResearchRunMeta;
import com.gtmalpha.research.orchestration.model.StoredTask;
import com.gtmalpha.research.orchestration.model.TaskState;
import com.gtmalpha.research.orchestration.model.TerminalOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

@Repository
public class ResearchJdbcRepository implements DeliveryRecordStore {
    private static final Logger log = LoggerFactory.getLogger(ResearchJdbcRepository.class);
    private static final TypeReference<Map<String, Object>> CONTENT_MAP = new TypeReference<>() {};
    private static final int MAX_REASON_LENGTH = 200;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final NamedParameterJdbcTemplate jdbc;
    private final boolean postgres;

    public ResearchJdbcRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
        this.postgres = detectPostgres(jdbc);
    }

    public long insertRun(Instant startedAt, String status, String notes, int entityCount) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("startedAt", toTimestamp(startedAt))
            .addValue("status", status)
            .addValue("notes", notes)
            .addValue("entityCount", entityCount);
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(
            """
                INSERT INTO research_runs (
                    started_at,
                    status,
                    notes,
                    entity_count,
                    delivered_count,
                    failed_count,
                    cancelled_count,
                    last_heartbeat_at
                )
                VALUES (
                    :startedAt,
                    :status,
                    :notes,
                    :entityCount,
                    0,
                    0,
                    0,
                    :startedAt
                )
                """,
            params,
            keyHolder,
            new String[]{"id"}
        );
        Number key = keyHolder.getKey();
        if (key == null) {
            throw new IllegalStateException("Failed to insert research run");
        }
        return key.longValue();
    }

    public void updateRunProgress(long runId, int delivered, int failed, int cancelled, Instant heartbeatAt) {
        jdbc.update(
            """
                UPDATE research_runs
                SET delivered_count = :delivered,
                    failed_count = :failed,
                    cancelled_count = :cancelled,
                    last_heartbeat_at = :heartbeatAt
                WHERE id = :runId
                """,
            new MapSqlParameterSource()
                .addValue("runId", runId)
                .addValue("delivered", delivered)
                .addValue("failed", failed)
                .addValue("cancelled", cancelled)
                .addValue("heartbeatAt", toTimestamp(heartbeatAt))
        );
    }

    public void completeRun(long runId, Instant finishedAt, String status, String notes) {
        jdbc.update(
            """
                UPDATE research_runs
                SET finished_at = :finishedAt,
                    status = :status,
                    notes = COALESCE(:notes, notes),
                    last_heartbeat_at = :finishedAt
                WHERE id = :runId
                """,
            new MapSqlParameterSource()
                .addValue("runId", runId)
                .addValue("finishedAt", toTimestamp(finishedAt))
                .addValue("status", status)
                .addValue("notes", notes)
        );
    }

    public List<ResearchRunMeta> findRunningRuns() {
        return jdbc.query(
            """
                SELECT id, started_at, finished_at, status
                FROM research_runs
                WHERE status = 'RUNNING'
                ORDER BY started_at ASC, id ASC
                """,
            new MapSqlParameterSource(),
            RUN_META_MAPPER
        );
    }

    public Optional<ResearchRunMeta> findLatestRun() {
        List<ResearchRunMeta> rows = jdbc.query(
            """
                SELECT id, started_at, finished_at, status
                FROM research_runs
                ORDER BY id DESC
                LIMIT 1
                """,
            new MapSqlParameterSource(),
            RUN_META_MAPPER
        );
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    public int abortStaleRuns(Instant cutoff, Instant now) {
        return jdbc.update(
            """
                UPDATE research_runs
                SET status = 'ABORTED',
                    finished_at = :now,
                    notes = 'stale heartbeat'
                WHERE status = 'RUNNING'
                  AND last_heartbeat_at < :cutoff
                """,
            new MapSqlParameterSource()
                .addValue("cutoff", toTimestamp(cutoff))
                .addValue("now", toTimestamp(now))
        );
    }

    public void upsertTask(StoredTask task) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("entityId", task.entityId())
            .addValue("runId", task.runId())
            .addValue("name", task.name())
            .addValue("domain", task.domain())
            .addValue("state", task.state().name())
            .addValue("outcome", task.outcome() == null ? null : task.outcome().name())
            .addValue("lastProvider", task.lastProvider())
            .addValue("lastFailureKind", truncate(task.lastFailureKind()))
            .addValue("recordJson", task.canonicalRecordJson())
            .addValue("totalCost", task.totalCost() == null ? BigDecimal.ZERO : task.totalCost())
            .addValue("updatedAt", toTimestamp(task.updatedAt() == null ? Instant.now() : task.updatedAt()));
        if (postgres) {
            jdbc.update(
                """
                    INSERT INTO research_tasks (
                        entity_id,
                        run_id,
                        name,
                        domain,
                        state,
                        terminal_outcome,
                        last_provider,
                        last_failure_kind,
                        canonical_record_json,
                        total_cost,
                        updated_at
                    )
                    VALUES (
                        :entityId,
                        :runId,
                        :name,
                        :domain,
                        :state,
                        :outcome,
                        :lastProvider,
                        :lastFailureKind,
                        :recordJson,
                        :totalCost,
                        :updatedAt
                    )
                    ON CONFLICT (entity_id)
                    DO UPDATE SET
                        run_id = EXCLUDED.run_id,
                        name = EXCLUDED.name,
                        domain = EXCLUDED.domain,
                        state = EXCLUDED.state,
                        terminal_outcome = EXCLUDED.terminal_outcome,
                        last_provider = EXCLUDED.last_provider,
                        last_failure_kind = EXCLUDED.last_failure_kind,
                        canonical_record_json = EXCLUDED.canonical_record_json,
                        total_cost = EXCLUDED.total_cost,
                        updated_at = EXCLUDED.updated_at
                    """,
                params
            );
            return;
        }
        jdbc.update(
            """
                MERGE INTO research_tasks (
                    entity_id,
                    run_id,
                    name,
                    domain,
                    state,
                    terminal_outcome,
                    last_provider,
                    last_failure_kind,
                    canonical_record_json,
                    total_cost,
                    updated_at
                )
                KEY(entity_id)
                VALUES (
                    :entityId,
                    :runId,
                    :name,
                    :domain,
                    :state,
                    :outcome,
                    :lastProvider,
                    :lastFailureKind,
                    :recordJson,
                    :totalCost,
                    :updatedAt
                )
                """,
            params
        );
    }

    public Optional<StoredTask> findTask(String entityId) {
        List<StoredTask> rows = jdbc.query(
            """
                SELECT entity_id, run_id, name, domain, state, terminal_outcome, last_provider,
                       last_failure_kind, canonical_record_json, total_cost, updated_at
                FROM research_tasks
                WHERE entity_id = :entityId
                """,
            new MapSqlParameterSource("entityId", entityId),
            (rs, rowNum) -> new StoredTask(
                rs.getString("entity_id"),
                rs.getObject("run_id") == null ? null : rs.getLong("run_id"),
                rs.getString("name"),
                rs.getString("domain"),
                TaskState.valueOf(rs.getString("state")),
                rs.getString("terminal_outcome") == null ? null : TerminalOutcome.valueOf(rs.getString("terminal_outcome")),
                rs.getString("last_provider"),
                rs.getString("last_failure_kind"),
                rs.getString("canonical_record_json"),
                rs.getBigDecimal("total_cost"),
                toInstant(rs.getTimestamp("updated_at"))
            )
        );
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    public Set<String> findDeliveredEntityIds(Collection<String> entityIds) {
        Set<String> delivered = new LinkedHashSet<>();
        if (entityIds == null || entityIds.isEmpty()) {
            return delivered;
        }
        jdbc.query(
            """
                SELECT entity_id
                FROM research_tasks
                WHERE state = 'DELIVERED'
                  AND entity_id IN (:entityIds)
                UNION
                SELECT entity_id
                FROM delivery_records
                WHERE acknowledged = TRUE
                  AND entity_id IN (:entityIds)
                """,
            new MapSqlParameterSource("entityIds", entityIds),
            rs -> {
                delivered.add(rs.getString("entity_id"));
            }
        );
        return delivered;
    }

    public Map<TaskState, Long> countTasksByState(long runId) {
        Map<TaskState, Long> counts = new EnumMap<>(TaskState.class);
        jdbc.query(
            """
                SELECT state, COUNT(*) AS total
                FROM research_tasks
                WHERE run_id = :runId
                GROUP BY state
                """,
            new MapSqlParameterSource("runId", runId),
            rs -> {
                counts.put(TaskState.valueOf(rs.getString("state")), rs.getLong("total"));
            }
        );
        return counts;
    }

    public long insertAttempt(String entityId, Long runId, ProviderAttempt attempt, String rawPayload) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("entityId", entityId)
            .addValue("runId", runId)
            .addValue("providerId", attempt.providerId())
            .addValue("costClass", attempt.costClass())
            .addValue("attemptNumber", attempt.attemptNumber())
            .addValue("startedAt", toTimestamp(attempt.startedAt()))
            .addValue("finishedAt", toTimestamp(attempt.finishedAt()))
            .addValue("outcome", attempt.outcome().name())
            .addValue("reasonCode", truncate(attempt.reasonCode()))
            .addValue("cost", attempt.cost())
            .addValue("qualityAccepted", attempt.qualityAccepted())
            .addValue("contentJson", toJson(attempt.content()))
            .addValue("payload", rawPayload);
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(
            """
                INSERT INTO provider_attempts (
                    entity_id,
                    run_id,
                    provider_id,
                    cost_class,
                    attempt_number,
                    started_at,
                    finished_at,
                    outcome,
                    reason_code,
                    cost,
                    quality_accepted,
                    content_json,
                    raw_payload
                )
                VALUES (
                    :entityId,
                    :runId,
                    :providerId,
                    :costClass,
                    :attemptNumber,
                    :startedAt,
                    :finishedAt,
                    :outcome,
                    :reasonCode,
                    :cost,
                    :qualityAccepted,
                    :contentJson,
                    :payload
                )
                """,
            params,
            keyHolder,
            new String[]{"id"}
        );
        Number key = keyHolder.getKey();
        if (key == null) {
            throw new IllegalStateException("Failed to insert provider attempt for " + entityId);
        }
        return key.longValue();
    }

    public List<ProviderAttempt> findAttempts(String entityId) {
        return jdbc.query(
            """
                SELECT id, provider_id, cost_class, attempt_number, started_at, finished_at, outcome,
                       reason_code, cost, quality_accepted, content_json
                FROM provider_attempts
                WHERE entity_id = :entityId
                ORDER BY id ASC
                """,
            new MapSqlParameterSource("entityId", entityId),
            (rs, rowNum) -> new ProviderAttempt(
                rs.getString("provider_id"),
                rs.getString("cost_class"),
                rs.getInt("attempt_number"),
                toInstant(rs.getTimestamp("started_at")),
                toInstant(rs.getTimestamp("finished_at")),
                AttemptOutcome.valueOf(rs.getString("outcome")),
                rs.getString("reason_code"),
                rs.getBigDecimal("cost"),
                payloadRef(rs.getLong("id")),
                fromJson(rs.getString("content_json")),
                rs.getBoolean("quality_accepted")
            )
        );
    }

    public Map<String, BigDecimal> sumCostByClassSince(Instant since) {
        Map<String, BigDecimal> totals = new LinkedHashMap<>();
        jdbc.query(
            """
                SELECT cost_class, SUM(cost) AS total
                FROM provider_attempts
                WHERE finished_at >= :since
                GROUP BY cost_class
                ORDER BY cost_class
                """,
            new MapSqlParameterSource("since", toTimestamp(since)),
            rs -> {
                BigDecimal total = rs.getBigDecimal("total");
                totals.put(rs.getString("cost_class"), total == null ? BigDecimal.ZERO : total);
            }
        );
        return totals;
    }

    @Override
    public Optional<DeliveryRecord> findDeliveryRecord(String idempotencyKey) {
        List<DeliveryRecord> rows = jdbc.query(
            """
                SELECT idempotency_key, entity_id, record_json, acknowledged, ack_id, acknowledged_at, delivery_attempts
                FROM delivery_records
                WHERE idempotency_key = :key
                """,
            new MapSqlParameterSource("key", idempotencyKey),
            (rs, rowNum) -> new DeliveryRecord(
                rs.getString("idempotency_key"),
                rs.getString("entity_id"),
                rs.getString("record_json"),
                rs.getBoolean("acknowledged"),
                rs.getString("ack_id"),
                toInstant(rs.getTimestamp("acknowledged_at")),
                rs.getInt("delivery_attempts")
            )
        );
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    @Override
    public void saveDeliveryRecord(String idempotencyKey, String entityId, String recordJson) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("key", idempotencyKey)
            .addValue("entityId", entityId)
            .addValue("recordJson", recordJson)
            .addValue("updatedAt", toTimestamp(Instant.now()));
        if (postgres) {
            jdbc.update(
                """
                    INSERT INTO delivery_records (idempotency_key, entity_id, record_json, acknowledged, delivery_attempts, updated_at)
                    VALUES (:key, :entityId, :recordJson, FALSE, 0, :updatedAt)
                    ON CONFLICT (idempotency_key)
                    DO UPDATE SET
                        record_json = EXCLUDED.record_json,
                        updated_at = EXCLUDED.updated_at
                    WHERE delivery_records.acknowledged = FALSE
                    """,
                params
            );
            return;
        }
        jdbc.update(
            """
                MERGE INTO delivery_records (idempotency_key, entity_id, record_json, updated_at)
                KEY(idempotency_key)
                VALUES (:key, :entityId, :recordJson, :updatedAt)
                """,
            params
        );
    }

    @Override
    public void incrementDeliveryAttempts(String idempotencyKey) {
        jdbc.update(
            """
                UPDATE delivery_records
                SET delivery_attempts = delivery_attempts + 1
                WHERE idempotency_key = :key
                """,
            new MapSqlParameterSource("key", idempotencyKey)
        );
    }

    @Override
    public boolean markAcknowledged(String idempotencyKey, String ackId, Instant acknowledgedAt) {
        int updated = jdbc.update(
            """
                UPDATE delivery_records
                SET acknowledged = TRUE,
                    ack_id = :ackId,
                    acknowledged_at = :acknowledgedAt,
                    updated_at = :acknowledgedAt
                WHERE idempotency_key = :key
                  AND acknowledged = FALSE
                """,
            new MapSqlParameterSource()
                .addValue("key", idempotencyKey)
                .addValue("ackId", ackId)
                .addValue("acknowledgedAt", toTimestamp(acknowledgedAt))
        );
        return updated == 1;
    }

    public static String payloadRef(long attemptRowId) {
        return "provider_attempts/" + attemptRowId;
    }

    private static final RowMapper<ResearchRunMeta> RUN_META_MAPPER = (rs, rowNum) -> new ResearchRunMeta(
        rs.getLong("id"),
        rs.getTimestamp("started_at").toInstant(),
        rs.getTimestamp("finished_at") == null ? null : rs.getTimestamp("finished_at").toInstant(),
        rs.getString("status")
    );

    private String toJson(Map<String, Object> content) {
        if (content == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(content);
        } catch (JsonProcessingException e) {
            log.warn("Unable to serialize attempt content: {}", e.getOriginalMessage());
            return null;
        }
    }

    private Map<String, Object> fromJson(String json) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readValue(json, CONTENT_MAP);
        } catch (JsonProcessingException e) {
            log.warn("Unable to parse stored attempt content: {}", e.getOriginalMessage());
            return null;
        }
    }

    private String truncate(String value) {
        if (value == null || value.length() <= MAX_REASON_LENGTH) {
            return value;
        }
        return value.substring(0, MAX_REASON_LENGTH);
    }

    private Timestamp toTimestamp(Instant value) {
        return value == null ? null : Timestamp.from(value);
    }

    private Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }

    private boolean detectPostgres(NamedParameterJdbcTemplate jdbcTemplate) {
        if (jdbcTemplate.getJdbcTemplate().getDataSource() == null) {
            return false;
        }
        try (Connection connection = jdbcTemplate.getJdbcTemplate().getDataSource().getConnection()) {
            DatabaseMetaData metaData = connection.getMetaData();
            String productName = metaData == null ? null : metaData.getDatabaseProductName();
            String url = metaData == null ? null : metaData.getURL();
            if (url != null && url.toLowerCase(Locale.ROOT).startsWith("jdbc:h2:")) {
                return false;
            }
            return productName != null && productName.toLowerCase(Locale.ROOT).contains("postgres");
        } catch (Exception e) {
            log.warn("Unable to detect database product; defaulting to MERGE upserts", e);
            return false;
        }
    }
}
