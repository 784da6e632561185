package com.studyprep.common.exception;

public class MalformedEmbeddingResponseException extends EmbeddingException {

    public MalformedEmbeddingResponseException(String message) {
        super("MALFORMED_EMBEDDING_RESPONSE", message);
    }

    public MalformedEmbeddingResponseException(String message, Throwable cause) {
        super("MALFORMED_EMBEDDING_RESPONSE", message, cause);
    }
}
