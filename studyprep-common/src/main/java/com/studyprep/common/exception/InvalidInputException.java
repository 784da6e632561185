package com.studyprep.common.exception;

public class InvalidInputException extends StudyPrepException {

    public InvalidInputException(String message) {
        super("INVALID_INPUT", message);
    }
}
