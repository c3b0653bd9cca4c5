package com.streamfirst.splitter.domain;

/**
 * Thrown when the operation is not allowed in the current lifecycle state.
 */
public class StateException extends SplitterException {

    private static final long serialVersionUID = 1L;

    public StateException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }
}
