package com.streamfirst.splitter.domain;

import lombok.NonNull;

import java.time.Instant;

/**
 * Proof that a transfer of value to a destination completed.
 *
 * @param transferId identifier assigned by the transfer provider
 * @param destination who received the value
 * @param amount how much was moved, in the pool's base unit
 * @param completedAt when the provider reported completion
 */
public record TransferReceipt(
    @NonNull String transferId,
    @NonNull AccountId destination,
    long amount,
    @NonNull Instant completedAt
) {
}
