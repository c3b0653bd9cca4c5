package com.streamfirst.splitter.domain;

/**
 * Thrown when the caller does not hold the capability the operation requires.
 */
public class AuthorizationException extends SplitterException {

    private static final long serialVersionUID = 1L;

    public AuthorizationException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }
}
