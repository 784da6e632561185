package com.studyprep.common.exception;

public class EmbeddingUpstreamException extends EmbeddingException {

    private final int statusCode;

    public EmbeddingUpstreamException(String message, int statusCode) {
        super("EMBEDDING_UPSTREAM_ERROR", message);
        this.statusCode = statusCode;
    }

    public EmbeddingUpstreamException(String message, int statusCode, Throwable cause) {
        super("EMBEDDING_UPSTREAM_ERROR", message, cause);
        this.statusCode = statusCode;
    }

    /**
     * HTTP status returned by the provider, or 0 when no response was received.
     */
    public int getStatusCode() {
        return statusCode;
    }
}
