package com.studyprep.data.vector;

import com.pgvector.PGvector;
import com.studyprep.common.constants.EmbeddingDefaults;
import com.studyprep.common.exception.InvalidInputException;
import com.studyprep.common.util.EmbeddingVectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.SQLException;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * pgvector-backed {@link QuestionVectorStore}.
 *
 * Distance metric: Euclidean (L2, the {@code <->} operator). Vectors are bound as typed
 * {@link PGvector} parameters, never spliced into the SQL text.
 *
 * The vector capability is probed through information_schema before each operation. If the
 * column disappears between probe and statement, the SQLSTATE of the failure is classified
 * and the operation degrades the same way.
 */
@Component
@Slf4j
public class PgVectorQuestionStore implements QuestionVectorStore {

    // undefined_column, undefined_object (type "vector"), undefined_function (operator <->)
    static final Set<String> CAPABILITY_SQL_STATES = Set.of("42703", "42704", "42883");

    static final String PROBE_SQL = """
        SELECT EXISTS (
            SELECT 1 FROM information_schema.columns
            WHERE table_schema = current_schema()
              AND table_name = 'questions'
              AND column_name = 'embedding'
              AND udt_name = 'vector'
        )
        """;

    static final String UPSERT_SQL = "UPDATE questions SET embedding = ? WHERE id = ?";

    static final String CLEAR_SQL = "UPDATE questions SET embedding = NULL WHERE id = ?";

    static final String NEAREST_SQL = """
        SELECT q.id, q.embedding <-> ? AS distance
        FROM questions q
        WHERE q.embedding IS NOT NULL
        ORDER BY q.embedding <-> ?, q.created_at DESC
        LIMIT ?
        """;

    static final String HAS_VECTOR_SQL = """
        SELECT EXISTS (
            SELECT 1 FROM questions WHERE id = ? AND embedding IS NOT NULL
        )
        """;

    static final String COUNT_SQL = "SELECT COUNT(*) FROM questions WHERE embedding IS NOT NULL";

    static final String WITHOUT_VECTOR_SQL = """
        SELECT id FROM questions
        WHERE embedding IS NULL
        ORDER BY created_at ASC, id ASC
        LIMIT ?
        """;

    static final String WITHOUT_VECTOR_AFTER_SQL = """
        SELECT id FROM questions
        WHERE embedding IS NULL
          AND (created_at, id) > (SELECT c.created_at, c.id FROM questions c WHERE c.id = ?)
        ORDER BY created_at ASC, id ASC
        LIMIT ?
        """;

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate writeTransaction;
    private final int dimensions;

    public PgVectorQuestionStore(
            JdbcTemplate jdbcTemplate,
            PlatformTransactionManager transactionManager,
            @Value("${vector.dimensions:" + EmbeddingDefaults.DIMENSIONS + "}") int dimensions) {
        this.jdbcTemplate = jdbcTemplate;
        // Vector writes get their own transaction so a failed statement never aborts the caller's
        this.writeTransaction = new TransactionTemplate(transactionManager);
        this.writeTransaction.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.dimensions = dimensions;

        log.info("PgVectorQuestionStore initialized | dimensions={} | metric=L2", dimensions);
    }

    @Override
    public VectorWriteResult upsertVector(UUID questionId, float[] vector) {
        if (questionId == null) {
            throw new IllegalArgumentException("questionId must not be null");
        }
        if (vector != null) {
            EmbeddingVectors.requireDimensions(vector, dimensions);
        }

        if (!isVectorCapabilityAvailable()) {
            log.warn("[VECTOR] Vector capability unavailable, skipping vector write | questionId={}", questionId);
            return VectorWriteResult.skipped(VectorWriteResult.SkipReason.CAPABILITY_UNAVAILABLE);
        }

        try {
            Integer updated = writeTransaction.execute(status -> vector != null
                ? jdbcTemplate.update(UPSERT_SQL, new PGvector(vector), questionId)
                : jdbcTemplate.update(CLEAR_SQL, questionId));

            if (updated == null || updated == 0) {
                log.warn("[VECTOR] No question row for vector write | questionId={}", questionId);
                return VectorWriteResult.skipped(VectorWriteResult.SkipReason.ROW_NOT_FOUND);
            }

            log.debug("[VECTOR] Vector {} | questionId={}", vector != null ? "stored" : "cleared", questionId);
            return vector != null ? VectorWriteResult.stored() : VectorWriteResult.cleared();
        } catch (DataAccessException e) {
            if (isCapabilityFailure(e)) {
                log.warn("[VECTOR] Vector column rejected the write, skipping | questionId={} | sqlState={}",
                    questionId, sqlStateOf(e));
                return VectorWriteResult.skipped(VectorWriteResult.SkipReason.CAPABILITY_UNAVAILABLE);
            }
            throw e;
        }
    }

    @Override
    public List<NeighborHit> nearestNeighbors(float[] queryVector, int limit) {
        if (limit < 1) {
            throw new InvalidInputException("limit must be at least 1, got " + limit);
        }
        EmbeddingVectors.requireDimensions(queryVector, dimensions);

        if (!isVectorCapabilityAvailable()) {
            log.warn("[VECTOR] Vector capability unavailable, nearest-neighbor query returns no results");
            return List.of();
        }

        PGvector query = new PGvector(queryVector);
        try {
            List<NeighborHit> hits = jdbcTemplate.query(
                NEAREST_SQL,
                (rs, rowNum) -> new NeighborHit(rs.getObject("id", UUID.class), rs.getDouble("distance")),
                query, query, limit);

            log.debug("[VECTOR] Nearest-neighbor query | limit={} | hits={}", limit, hits.size());
            return hits;
        } catch (DataAccessException e) {
            if (isCapabilityFailure(e)) {
                log.warn("[VECTOR] Vector column rejected the query, returning no results | sqlState={}",
                    sqlStateOf(e));
                return List.of();
            }
            throw e;
        }
    }

    @Override
    public boolean isVectorCapabilityAvailable() {
        Boolean available = jdbcTemplate.queryForObject(PROBE_SQL, Boolean.class);
        return Boolean.TRUE.equals(available);
    }

    @Override
    public boolean hasStoredVector(UUID questionId) {
        if (!isVectorCapabilityAvailable()) {
            return false;
        }
        Boolean present = jdbcTemplate.queryForObject(HAS_VECTOR_SQL, Boolean.class, questionId);
        return Boolean.TRUE.equals(present);
    }

    @Override
    public long countStoredVectors() {
        if (!isVectorCapabilityAvailable()) {
            return 0L;
        }
        Long count = jdbcTemplate.queryForObject(COUNT_SQL, Long.class);
        return count != null ? count : 0L;
    }

    @Override
    public List<UUID> findIdsWithoutVector(UUID afterId, int limit) {
        if (!isVectorCapabilityAvailable()) {
            return List.of();
        }
        if (afterId == null) {
            return jdbcTemplate.queryForList(WITHOUT_VECTOR_SQL, UUID.class, limit);
        }
        return jdbcTemplate.queryForList(WITHOUT_VECTOR_AFTER_SQL, UUID.class, afterId, limit);
    }

    @Override
    public int getDimensions() {
        return dimensions;
    }

    static boolean isCapabilityFailure(DataAccessException e) {
        String sqlState = sqlStateOf(e);
        return sqlState != null && CAPABILITY_SQL_STATES.contains(sqlState);
    }

    private static String sqlStateOf(Throwable e) {
        Throwable current = e;
        while (current != null) {
            if (current instanceof SQLException && ((SQLException) current).getSQLState() != null) {
                return ((SQLException) current).getSQLState();
            }
            current = current.getCause();
        }
        return null;
    }
}
