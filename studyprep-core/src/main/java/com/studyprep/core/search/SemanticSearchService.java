package com.studyprep.core.search;

import com.studyprep.common.constants.EmbeddingDefaults;
import com.studyprep.common.exception.InvalidInputException;
import com.studyprep.core.mapper.QuestionMapper;
import com.studyprep.core.model.QuestionDetails;
import com.studyprep.data.repository.QuestionRepository;
import com.studyprep.data.repository.QuestionRepositoryCustom;
import com.studyprep.llm.service.EmbeddingService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Finds previously asked questions that are semantically close to a free-text query.
 *
 * There is no keyword fallback: if the query cannot be embedded the error reaches the caller.
 * Runs outside a transaction so a failing vector statement cannot abort a surrounding one.
 */
@Service
@Slf4j
public class SemanticSearchService {

    private final EmbeddingService embeddingService;
    private final QuestionRepository questionRepository;
    private final QuestionMapper questionMapper;
    private final int defaultLimit;
    private final int maxLimit;

    public SemanticSearchService(
            EmbeddingService embeddingService,
            QuestionRepository questionRepository,
            QuestionMapper questionMapper,
            @Value("${question.search.default-limit:" + EmbeddingDefaults.DEFAULT_SEARCH_LIMIT + "}") int defaultLimit,
            @Value("${question.search.max-limit:" + EmbeddingDefaults.MAX_SEARCH_LIMIT + "}") int maxLimit) {
        this.embeddingService = embeddingService;
        this.questionRepository = questionRepository;
        this.questionMapper = questionMapper;
        this.defaultLimit = defaultLimit;
        this.maxLimit = maxLimit;
    }

    /**
     * @param queryText free text, must not be blank
     * @param limit     maximum results; null means the default, values above the maximum are clamped
     * @return closest questions first, each carrying its distance; may be empty
     */
    public List<QuestionDetails> search(String queryText, Integer limit) {
        if (queryText == null || queryText.isBlank()) {
            throw new InvalidInputException("Search query is required");
        }
        int effectiveLimit = resolveLimit(limit);
        String query = queryText.trim();

        long startTime = System.currentTimeMillis();
        log.info("[SEARCH] Starting semantic search | queryLength={} | limit={}", query.length(), effectiveLimit);

        float[] queryEmbedding = embeddingService.generateEmbedding(query);
        long embeddingDuration = System.currentTimeMillis() - startTime;

        List<QuestionRepositoryCustom.ScoredQuestion> hits =
            questionRepository.searchByEmbedding(queryEmbedding, effectiveLimit);

        List<QuestionDetails> results = hits.stream()
            .map(questionMapper::toDetails)
            .collect(Collectors.toList());

        log.info("[SEARCH] Semantic search completed | results={} | embeddingDurationMs={} | totalDurationMs={}",
            results.size(), embeddingDuration, System.currentTimeMillis() - startTime);
        return results;
    }

    int resolveLimit(Integer limit) {
        if (limit == null) {
            return defaultLimit;
        }
        if (limit < 1) {
            throw new InvalidInputException("limit must be at least 1");
        }
        if (limit > maxLimit) {
            log.debug("[SEARCH] Clamping limit | requested={} | max={}", limit, maxLimit);
            return maxLimit;
        }
        return limit;
    }
}
