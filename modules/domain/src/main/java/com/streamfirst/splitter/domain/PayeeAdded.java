package com.streamfirst.splitter.domain;

import lombok.NonNull;

import java.time.Instant;

/**
 * A payee was registered with its share weight during initialization.
 */
public record PayeeAdded(
    @NonNull EventId eventId,
    @NonNull AccountId payee,
    long shares,
    @NonNull Instant occurredAt
) implements SplitterEvent {

    public static PayeeAdded of(AccountId payee, long shares) {
        return new PayeeAdded(EventId.generate("payee"), payee, shares, Instant.now());
    }
}
