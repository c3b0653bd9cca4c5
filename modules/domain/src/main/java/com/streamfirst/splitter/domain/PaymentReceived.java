package com.streamfirst.splitter.domain;

import lombok.NonNull;

import java.time.Instant;

/**
 * Value was deposited into the pool. Purely informational.
 */
public record PaymentReceived(
    @NonNull EventId eventId,
    @NonNull AccountId from,
    long amount,
    @NonNull Instant occurredAt
) implements SplitterEvent {

    public static PaymentReceived of(AccountId from, long amount) {
        return new PaymentReceived(EventId.generate("deposit"), from, amount, Instant.now());
    }
}
