package com.studyprep.common.exception;

public class ResourceNotFoundException extends StudyPrepException {

    public ResourceNotFoundException(String resource, Object id) {
        super("NOT_FOUND", resource + " not found: " + id);
    }
}
