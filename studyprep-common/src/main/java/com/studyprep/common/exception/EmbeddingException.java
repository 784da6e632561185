package com.studyprep.common.exception;

/**
 * Failure while turning text into an embedding vector.
 * Question creation absorbs these; semantic search surfaces them.
 */
public abstract class EmbeddingException extends StudyPrepException {

    protected EmbeddingException(String errorCode, String message) {
        super(errorCode, message);
    }

    protected EmbeddingException(String errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }
}
