package com.streamfirst.splitter.domain;

import lombok.NonNull;

import java.time.Instant;

/**
 * The owner recorded fees owed to an investor.
 * {@code totalOwed} is the investor's outstanding fee after the addition.
 */
public record ProjectFeesAdded(
    @NonNull EventId eventId,
    @NonNull AccountId investor,
    long amount,
    long totalOwed,
    @NonNull Instant occurredAt
) implements SplitterEvent {

    public static ProjectFeesAdded of(AccountId investor, long amount, long totalOwed) {
        return new ProjectFeesAdded(EventId.generate("fees"), investor, amount, totalOwed, Instant.now());
    }
}
