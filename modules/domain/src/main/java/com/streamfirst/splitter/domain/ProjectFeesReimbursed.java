package com.streamfirst.splitter.domain;

import lombok.NonNull;

import java.time.Instant;

/**
 * An investor's outstanding fee was paid back from the pool.
 */
public record ProjectFeesReimbursed(
    @NonNull EventId eventId,
    @NonNull AccountId investor,
    long amount,
    @NonNull Instant occurredAt
) implements SplitterEvent {

    public static ProjectFeesReimbursed of(AccountId investor, long amount) {
        return new ProjectFeesReimbursed(EventId.generate("reimburse"), investor, amount, Instant.now());
    }
}
