package com.studyprep.common.constants;

public final class EmbeddingDefaults {
    // Gemini text-embedding-004 produces 768-dimensional vectors
    public static final int DIMENSIONS = 768;

    public static final int DEFAULT_SEARCH_LIMIT = 3;
    public static final int MAX_SEARCH_LIMIT = 50;

    private EmbeddingDefaults() {}
}
