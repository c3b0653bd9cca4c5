package com.streamfirst.splitter.ports;

import com.streamfirst.splitter.domain.AccountId;
import com.streamfirst.splitter.domain.Result;
import com.streamfirst.splitter.domain.TransferReceipt;

/**
 * Port for the atomic value-transfer primitive.
 * A transfer either moves the whole amount to the destination or moves nothing.
 * Callers treat a failure as fatal to their own operation; no retry happens at this layer.
 */
public interface TransferPort {

    /**
     * Moves value out of the pool to a destination.
     *
     * @param destination who receives the value
     * @param amount positive amount in the pool's base unit
     * @return a receipt on success, or a failure describing why nothing was moved
     */
    Result<TransferReceipt> transfer(AccountId destination, long amount);
}
