package com.studyprep.llm.service;

import com.studyprep.common.exception.InvalidInputException;
import com.studyprep.common.util.EmbeddingVectors;
import com.studyprep.llm.provider.EmbeddingProvider;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Caller-side embedding entry point. Wraps the provider with input validation
 * and fits the provider output to the dimensions of the vector column.
 */
@Service
@Slf4j
public class EmbeddingService {

    private final EmbeddingProvider provider;
    private final int dimensions;

    public EmbeddingService(EmbeddingProvider provider,
                            @Value("${vector.dimensions:768}") int dimensions) {
        this.provider = provider;
        this.dimensions = dimensions;
        log.info("EmbeddingService initialized | model={} | dimensions={}", provider.getModelName(), dimensions);
    }

    /**
     * Generate an embedding of exactly {@code vector.dimensions} components.
     * Longer provider output is truncated; shorter output fails with
     * {@link com.studyprep.common.exception.DimensionMismatchException}.
     */
    public float[] generateEmbedding(String text) {
        if (text == null || text.isBlank()) {
            throw new InvalidInputException("Text to embed must not be blank");
        }

        float[] raw = provider.embed(text);
        if (raw.length > dimensions) {
            log.warn("[EMBED] Truncating provider output | model={} | from={} | to={}",
                provider.getModelName(), raw.length, dimensions);
        }
        return EmbeddingVectors.fitToDimensions(raw, dimensions);
    }
}
