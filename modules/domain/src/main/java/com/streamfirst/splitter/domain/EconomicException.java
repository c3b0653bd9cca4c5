package com.streamfirst.splitter.domain;

/**
 * Thrown when the pool or ledger totals do not permit the operation.
 */
public class EconomicException extends SplitterException {

    private static final long serialVersionUID = 1L;

    public EconomicException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }
}
