package com.studyprep.data.repository;

import com.studyprep.common.util.EmbeddingVectors;
import com.studyprep.data.entity.Question;
import com.studyprep.data.vector.NeighborHit;
import com.studyprep.data.vector.QuestionVectorStore;
import com.studyprep.data.vector.VectorWriteResult;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

@Repository
@Slf4j
public class QuestionRepositoryImpl implements QuestionRepositoryCustom {

    @PersistenceContext
    private EntityManager entityManager;

    private final QuestionVectorStore vectorStore;
    private final TransactionTemplate rowTransaction;

    public QuestionRepositoryImpl(QuestionVectorStore vectorStore, PlatformTransactionManager transactionManager) {
        this.vectorStore = vectorStore;
        this.rowTransaction = new TransactionTemplate(transactionManager);
    }

    @Override
    public Question createWithEmbedding(Question question, float[] embedding) {
        // Row first, in its own transaction; the vector write only enriches a committed row
        Question saved = rowTransaction.execute(status -> {
            entityManager.persist(question);
            entityManager.flush();
            return question;
        });

        if (embedding == null) {
            log.info("[QUESTION] Created without embedding | questionId={}", saved.getId());
            return saved;
        }

        if (!EmbeddingVectors.isWellFormed(embedding, vectorStore.getDimensions())) {
            log.warn("[QUESTION] Rejected malformed embedding | questionId={} | length={} | expected={}",
                saved.getId(), embedding.length, vectorStore.getDimensions());
            return saved;
        }

        VectorWriteResult result = vectorStore.upsertVector(saved.getId(), embedding);
        if (result.isStored()) {
            saved.setEmbedding(embedding);
            log.info("[QUESTION] Created with embedding | questionId={}", saved.getId());
        } else {
            log.warn("[QUESTION] Created without embedding, vector write {} | questionId={}", result, saved.getId());
        }
        return saved;
    }

    @Override
    public List<ScoredQuestion> searchByEmbedding(float[] embedding, int limit) {
        List<NeighborHit> hits = vectorStore.nearestNeighbors(embedding, limit);
        if (hits.isEmpty()) {
            return List.of();
        }

        List<UUID> ids = hits.stream()
            .map(NeighborHit::getQuestionId)
            .collect(Collectors.toList());

        Map<UUID, Question> questionsById = entityManager.createQuery("""
                SELECT q FROM Question q
                LEFT JOIN FETCH q.user
                WHERE q.id IN :ids
                """, Question.class)
            .setParameter("ids", ids)
            .getResultList()
            .stream()
            .collect(Collectors.toMap(Question::getId, Function.identity()));

        // Keep distance order; rows deleted between the two queries drop out
        return hits.stream()
            .filter(hit -> questionsById.containsKey(hit.getQuestionId()))
            .map(hit -> new ScoredQuestion(questionsById.get(hit.getQuestionId()), hit.getDistance()))
            .collect(Collectors.toList());
    }
}
