package com.nayem.sagaflow.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nayem.sagaflow.eventsourcing.EventJson;
import com.nayem.sagaflow.saga.SagaContext;
import com.nayem.sagaflow.saga.SagaDefinition;
import com.nayem.sagaflow.saga.SagaException;
import com.nayem.sagaflow.saga.SagaHistory;
import com.nayem.sagaflow.saga.SagaInstance;
import com.nayem.sagaflow.saga.SagaMetadata;
import com.nayem.sagaflow.saga.SagaPersistence;
import com.nayem.sagaflow.saga.SagaPersistenceException;
import com.nayem.sagaflow.saga.SagaRegistry;
import com.nayem.sagaflow.saga.SagaStatus;
import com.nayem.sagaflow.saga.StepStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.nio.charset.StandardCharsets;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Relational {@link SagaPersistence} over two tables, {@code saga_instances} and
 * {@code saga_history}. The DDL ships as {@code db/sagaflow/schema.sql}.
 * <p>
 * A save upserts the instance row and every history row in one transaction. History rows
 * are identified by a name-based UUID of saga id, step name and start time, so saving the
 * same entry twice updates it in place.
 * </p>
 */
public class JdbcSagaPersistence implements SagaPersistence {

    private static final Logger log = LoggerFactory.getLogger(JdbcSagaPersistence.class);
    public static final String SCHEMA_LOCATION = "db/sagaflow/schema.sql";

    private static final TypeReference<Map<String, Object>> CONTEXT_TYPE = new TypeReference<>() {
    };

    private final DataSource dataSource;
    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final SagaRegistry registry;
    private final ObjectMapper objectMapper;

    public JdbcSagaPersistence(DataSource dataSource, SagaRegistry registry, ObjectMapper objectMapper) {
        this.dataSource = dataSource;
        this.jdbcTemplate = new JdbcTemplate(dataSource);
        this.transactionTemplate = new TransactionTemplate(new DataSourceTransactionManager(dataSource));
        this.registry = registry;
        this.objectMapper = EventJson.configure(objectMapper);
    }

    /**
     * Creates the tables when missing.
     */
    public void initializeSchema() {
        ResourceDatabasePopulator populator = new ResourceDatabasePopulator(new ClassPathResource(SCHEMA_LOCATION));
        populator.setSqlScriptEncoding(StandardCharsets.UTF_8.name());
        populator.execute(dataSource);
        log.info("Initialized saga tables from {}", SCHEMA_LOCATION);
    }

    static String historyRowId(String sagaId, SagaHistory entry) {
        String name = sagaId + "|" + entry.stepName() + "|" + entry.startedAt();
        return UUID.nameUUIDFromBytes(name.getBytes(StandardCharsets.UTF_8)).toString();
    }

    @Override
    public void save(SagaInstance saga) {
        String sagaId = saga.getId();
        String context = writeContext(saga);
        List<SagaHistory> history = saga.getHistory();
        SagaMetadata metadata = saga.getContext().metadata();

        try {
            transactionTemplate.executeWithoutResult(status -> {
                int updated = jdbcTemplate.update(
                        "UPDATE saga_instances SET definition_name = ?, status = ?, current_step = ?, context = ?, "
                                + "started_at = ?, completed_at = ?, updated_at = ? WHERE id = ?",
                        saga.getDefinition().getName(), saga.getStatus().value(), saga.getCurrentStep(), context,
                        timestamp(saga.getStartedAt()), timestamp(saga.getCompletedAt()),
                        timestamp(metadata.updatedAt()), sagaId);
                if (updated == 0) {
                    jdbcTemplate.update(
                            "INSERT INTO saga_instances (id, definition_name, status, current_step, context, "
                                    + "started_at, completed_at, created_at, updated_at) "
                                    + "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)",
                            sagaId, saga.getDefinition().getName(), saga.getStatus().value(), saga.getCurrentStep(),
                            context, timestamp(saga.getStartedAt()), timestamp(saga.getCompletedAt()),
                            timestamp(metadata.createdAt()), timestamp(metadata.updatedAt()));
                }

                for (int i = 0; i < history.size(); i++) {
                    upsertHistory(sagaId, i, history.get(i));
                }
            });
        } catch (DataAccessException e) {
            throw new SagaPersistenceException(sagaId, "failed to save saga " + sagaId, e);
        }
    }

    private void upsertHistory(String sagaId, int seq, SagaHistory entry) {
        String rowId = historyRowId(sagaId, entry);
        int updated = jdbcTemplate.update(
                "UPDATE saga_history SET seq = ?, status = ?, completed_at = ?, error = ?, retry_attempt = ? "
                        + "WHERE id = ?",
                seq, entry.status().value(), timestamp(entry.completedAt()), entry.error(), entry.retryAttempt(),
                rowId);
        if (updated == 0) {
            jdbcTemplate.update(
                    "INSERT INTO saga_history (id, saga_id, seq, step_name, status, started_at, completed_at, "
                            + "error, retry_attempt) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)",
                    rowId, sagaId, seq, entry.stepName(), entry.status().value(), timestamp(entry.startedAt()),
                    timestamp(entry.completedAt()), entry.error(), entry.retryAttempt());
        }
    }

    @Override
    public SagaInstance load(String sagaId) {
        List<SagaRow> rows;
        try {
            rows = jdbcTemplate.query(
                    "SELECT id, definition_name, status, current_step, context, started_at, completed_at, "
                            + "created_at, updated_at FROM saga_instances WHERE id = ?",
                    (rs, rowNum) -> mapSaga(rs), sagaId);
        } catch (DataAccessException e) {
            throw new SagaPersistenceException(sagaId, "failed to load saga " + sagaId, e);
        }
        if (rows.isEmpty()) {
            throw new SagaPersistenceException(sagaId, "saga " + sagaId + " not found");
        }
        SagaRow row = rows.get(0);
        SagaDefinition definition = registry.get(row.definitionName());
        SagaContext context = SagaContext.restore(readContext(sagaId, row.context()), row.createdAt(),
                row.updatedAt());
        return SagaInstance.restore(sagaId, definition, context, SagaStatus.fromValue(row.status()),
                row.currentStep(), getHistory(sagaId), row.startedAt(), row.completedAt());
    }

    @Override
    public List<SagaInstance> loadAll(SagaStatus status) {
        List<String> ids;
        try {
            ids = jdbcTemplate.queryForList(
                    "SELECT id FROM saga_instances WHERE status = ? ORDER BY created_at", String.class,
                    status.value());
        } catch (DataAccessException e) {
            throw new SagaPersistenceException(null, "failed to list " + status.value() + " sagas", e);
        }
        List<SagaInstance> result = new ArrayList<>();
        for (String id : ids) {
            try {
                result.add(load(id));
            } catch (SagaException e) {
                log.warn("Skipping saga {} while listing {} sagas: {}", id, status.value(), e.getMessage());
            }
        }
        return result;
    }

    @Override
    public void delete(String sagaId) {
        try {
            transactionTemplate.executeWithoutResult(status -> {
                jdbcTemplate.update("DELETE FROM saga_history WHERE saga_id = ?", sagaId);
                jdbcTemplate.update("DELETE FROM saga_instances WHERE id = ?", sagaId);
            });
        } catch (DataAccessException e) {
            throw new SagaPersistenceException(sagaId, "failed to delete saga " + sagaId, e);
        }
    }

    @Override
    public List<SagaHistory> getHistory(String sagaId) {
        try {
            return jdbcTemplate.query(
                    "SELECT step_name, status, started_at, completed_at, error, retry_attempt "
                            + "FROM saga_history WHERE saga_id = ? ORDER BY seq",
                    (rs, rowNum) -> new SagaHistory(
                            rs.getString("step_name"),
                            StepStatus.fromValue(rs.getString("status")),
                            instant(rs.getTimestamp("started_at")),
                            instant(rs.getTimestamp("completed_at")),
                            rs.getString("error"),
                            rs.getInt("retry_attempt")),
                    sagaId);
        } catch (DataAccessException e) {
            throw new SagaPersistenceException(sagaId, "failed to load history of saga " + sagaId, e);
        }
    }

    private String writeContext(SagaInstance saga) {
        try {
            return objectMapper.writeValueAsString(saga.getContext().toMap());
        } catch (JsonProcessingException e) {
            throw new SagaPersistenceException(saga.getId(), "failed to serialize context of saga " + saga.getId(), e);
        }
    }

    private Map<String, Object> readContext(String sagaId, String json) {
        try {
            return objectMapper.readValue(json, CONTEXT_TYPE);
        } catch (JsonProcessingException e) {
            throw new SagaPersistenceException(sagaId, "failed to deserialize context of saga " + sagaId, e);
        }
    }

    private static SagaRow mapSaga(ResultSet rs) throws SQLException {
        return new SagaRow(
                rs.getString("definition_name"),
                rs.getString("status"),
                rs.getString("current_step"),
                rs.getString("context"),
                instant(rs.getTimestamp("started_at")),
                instant(rs.getTimestamp("completed_at")),
                instant(rs.getTimestamp("created_at")),
                instant(rs.getTimestamp("updated_at")));
    }

    private static Timestamp timestamp(Instant instant) {
        return instant == null ? null : Timestamp.from(instant);
    }

    private static Instant instant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }

    private record SagaRow(
            String definitionName,
            String status,
            String currentStep,
            String context,
            Instant startedAt,
            Instant completedAt,
            Instant createdAt,
            Instant updatedAt) {
    }
}
