package com.streamfirst.splitter.domain;

import java.util.Objects;

/**
 * Base class for every rejected splitter operation. A thrown exception means the
 * operation made no state change, apart from reimbursements already completed
 * earlier in the same batch.
 */
public abstract class SplitterException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final ErrorCode errorCode;

    protected SplitterException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = Objects.requireNonNull(errorCode, "Error code cannot be null");
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + errorCode + "]: " + getMessage();
    }
}
