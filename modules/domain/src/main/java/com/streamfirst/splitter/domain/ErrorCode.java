package com.streamfirst.splitter.domain;

/**
 * Stable machine-readable reasons a splitter operation can be rejected.
 */
public enum ErrorCode {
    INVALID_IDENTITY,
    INVALID_SHARES,
    DUPLICATE_PAYEE,
    LENGTH_MISMATCH,
    NO_PAYEES,
    INDEX_OUT_OF_RANGE,
    NO_SHARES,
    INVALID_AMOUNT,

    ALREADY_INITIALIZED,

    NOT_OWNER,
    NOT_SELF,

    NO_PAYMENT_DUE,
    NO_FEES_OWED,
    EMPTY_POOL,
    INSUFFICIENT_POOL,
    TRANSFER_FAILED
}
