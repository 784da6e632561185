package com.studyprep.common.util;

import com.studyprep.common.exception.DimensionMismatchException;

import java.util.Arrays;

/**
 * Dimension policy for embedding vectors.
 * Longer vectors may be truncated at ingestion time; shorter vectors are never padded.
 */
public final class EmbeddingVectors {

    private EmbeddingVectors() {}

    /**
     * Fit a provider vector to the expected dimensions.
     * Extra components are dropped; a shorter vector fails with {@link DimensionMismatchException}.
     */
    public static float[] fitToDimensions(float[] vector, int dimensions) {
        if (vector == null) {
            throw new IllegalArgumentException("vector must not be null");
        }
        if (vector.length < dimensions) {
            throw new DimensionMismatchException(dimensions, vector.length);
        }
        if (vector.length == dimensions) {
            return vector;
        }
        return Arrays.copyOf(vector, dimensions);
    }

    /**
     * Reject anything that is not exactly {@code dimensions} long. Used on the storage path,
     * where truncation is no longer allowed.
     */
    public static void requireDimensions(float[] vector, int dimensions) {
        if (vector == null) {
            throw new IllegalArgumentException("vector must not be null");
        }
        if (vector.length != dimensions) {
            throw new DimensionMismatchException(dimensions, vector.length);
        }
    }

    public static boolean isWellFormed(float[] vector, int dimensions) {
        if (vector == null || vector.length != dimensions) {
            return false;
        }
        for (float component : vector) {
            if (Float.isNaN(component) || Float.isInfinite(component)) {
                return false;
            }
        }
        return true;
    }
}
