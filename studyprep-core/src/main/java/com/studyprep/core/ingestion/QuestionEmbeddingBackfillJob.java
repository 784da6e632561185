package com.studyprep.core.ingestion;

import com.studyprep.data.entity.Question;
import com.studyprep.data.repository.QuestionRepository;
import com.studyprep.data.vector.QuestionVectorStore;
import com.studyprep.data.vector.VectorWriteResult;
import com.studyprep.llm.service.EmbeddingService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Background job that embeds questions created while the provider or the vector
 * column was unavailable. Only fills missing vectors; existing ones are never replaced.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class QuestionEmbeddingBackfillJob {

    private final QuestionRepository questionRepository;
    private final QuestionVectorStore vectorStore;
    private final EmbeddingService embeddingService;

    @Value("${question.embedding.backfill.enabled:false}")
    private boolean enabled;

    @Value("${question.embedding.backfill.batch-size:50}")
    private int batchSize;

    // Last id of the previous full page; null starts again from the oldest question
    private UUID resumeAfter;

    @Scheduled(
        fixedDelayString = "${question.embedding.backfill.interval-ms:300000}",
        initialDelayString = "${question.embedding.backfill.initial-delay-ms:60000}")
    public void runScheduled() {
        if (!enabled) {
            log.debug("[BACKFILL] Embedding backfill is disabled");
            return;
        }
        try {
            backfillMissingEmbeddings();
        } catch (Exception e) {
            log.error("[BACKFILL] Backfill run failed | error={}", e.getMessage(), e);
        }
    }

    /**
     * Embed up to {@code batch-size} questions that have no vector. Each run continues
     * after the page the previous run ended on, so questions that keep failing cannot
     * hold back newer ones; the cursor wraps to the oldest question after a short page.
     *
     * @return number of vectors stored in this run
     */
    public synchronized int backfillMissingEmbeddings() {
        if (!vectorStore.isVectorCapabilityAvailable()) {
            log.info("[BACKFILL] Vector capability unavailable, skipping run");
            return 0;
        }

        List<UUID> pending = vectorStore.findIdsWithoutVector(resumeAfter, batchSize);
        if (pending.isEmpty() && resumeAfter != null) {
            resumeAfter = null;
            pending = vectorStore.findIdsWithoutVector(null, batchSize);
        }
        if (pending.isEmpty()) {
            log.debug("[BACKFILL] No questions without embeddings");
            return 0;
        }
        resumeAfter = pending.size() < batchSize ? null : pending.get(pending.size() - 1);

        long startTime = System.currentTimeMillis();
        log.info("[BACKFILL] Starting backfill | pending={} | resumeAfter={}", pending.size(), resumeAfter);

        int stored = 0;
        int failed = 0;
        for (UUID questionId : pending) {
            try {
                if (backfillOne(questionId)) {
                    stored++;
                }
            } catch (Exception e) {
                failed++;
                log.warn("[BACKFILL] Failed to embed question | questionId={} | error={}", questionId, e.getMessage());
            }
        }

        log.info("[BACKFILL] Backfill completed | stored={} | failed={} | durationMs={}",
            stored, failed, System.currentTimeMillis() - startTime);
        return stored;
    }

    private boolean backfillOne(UUID questionId) {
        Optional<Question> question = questionRepository.findById(questionId);
        if (question.isEmpty()) {
            return false;
        }
        // A concurrent create may have stored a vector since the id was listed
        if (vectorStore.hasStoredVector(questionId)) {
            return false;
        }

        float[] embedding = embeddingService.generateEmbedding(question.get().getEmbeddingText());
        VectorWriteResult result = vectorStore.upsertVector(questionId, embedding);
        if (!result.isStored()) {
            log.warn("[BACKFILL] Vector write {} | questionId={}", result, questionId);
        }
        return result.isStored();
    }

    void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    void setBatchSize(int batchSize) {
        this.batchSize = batchSize;
    }
}
