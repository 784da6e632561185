package com.studyprep.common.exception;

public class EmbeddingNotConfiguredException extends EmbeddingException {

    public EmbeddingNotConfiguredException(String message) {
        super("AI_NOT_CONFIGURED", message);
    }
}
