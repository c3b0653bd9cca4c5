package com.streamfirst.splitter.domain;

import lombok.NonNull;

import java.time.Instant;

/**
 * A payee pulled its accrued share out of the pool.
 */
public record PaymentReleased(
    @NonNull EventId eventId,
    @NonNull AccountId to,
    long amount,
    @NonNull Instant occurredAt
) implements SplitterEvent {

    public static PaymentReleased of(AccountId to, long amount) {
        return new PaymentReleased(EventId.generate("release"), to, amount, Instant.now());
    }
}
