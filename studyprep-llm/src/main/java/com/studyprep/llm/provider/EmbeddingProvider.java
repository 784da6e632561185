package com.studyprep.llm.provider;

/**
 * Turns a piece of text into a dense vector.
 *
 * Implementations make exactly one upstream call per invocation and never retry.
 * Failures surface as subtypes of {@link com.studyprep.common.exception.EmbeddingException};
 * blank input is rejected with {@link com.studyprep.common.exception.InvalidInputException}.
 */
public interface EmbeddingProvider {

    float[] embed(String text);

    String getModelName();
}
