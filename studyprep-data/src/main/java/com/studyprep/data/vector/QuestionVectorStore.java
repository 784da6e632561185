package com.studyprep.data.vector;

import java.util.List;
import java.util.UUID;

/**
 * Storage and nearest-neighbor lookup for question embeddings.
 * Callers never see the vector column type; a store without the vector capability
 * degrades to skipped writes and empty results instead of failing.
 */
public interface QuestionVectorStore {

    /**
     * Store the vector for a question, or clear it when {@code vector} is null.
     *
     * @throws com.studyprep.common.exception.DimensionMismatchException if the vector is not exactly
     *         {@link #getDimensions()} long
     */
    VectorWriteResult upsertVector(UUID questionId, float[] vector);

    /**
     * Up to {@code limit} question ids ordered by ascending distance to {@code queryVector}.
     * Rows without a stored vector are excluded.
     */
    List<NeighborHit> nearestNeighbors(float[] queryVector, int limit);

    boolean isVectorCapabilityAvailable();

    boolean hasStoredVector(UUID questionId);

    long countStoredVectors();

    /**
     * Questions that have no vector yet, oldest first. With {@code afterId} set, the page
     * starts after that question; a cursor whose row no longer exists yields an empty page.
     */
    List<UUID> findIdsWithoutVector(UUID afterId, int limit);

    int getDimensions();
}
