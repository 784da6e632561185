package com.studyprep.common.exception;

/**
 * Base type for the service's error taxonomy. Each subtype carries a stable error code
 * that the API layer reports to clients.
 */
public abstract class StudyPrepException extends RuntimeException {

    private final String errorCode;

    protected StudyPrepException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected StudyPrepException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
