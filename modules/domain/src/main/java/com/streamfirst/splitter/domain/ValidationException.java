package com.streamfirst.splitter.domain;

/**
 * Thrown when an argument is malformed before any state is touched.
 */
public class ValidationException extends SplitterException {

    private static final long serialVersionUID = 1L;

    public ValidationException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }
}
