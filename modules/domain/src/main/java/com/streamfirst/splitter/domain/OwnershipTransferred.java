package com.streamfirst.splitter.domain;

import lombok.NonNull;

import java.time.Instant;

/**
 * The owner capability moved to a new holder. {@code newOwner} is {@link AccountId#ZERO}
 * when ownership was renounced.
 */
public record OwnershipTransferred(
    @NonNull EventId eventId,
    AccountId previousOwner,
    @NonNull AccountId newOwner,
    @NonNull Instant occurredAt
) implements SplitterEvent {

    public static OwnershipTransferred of(AccountId previousOwner, AccountId newOwner) {
        return new OwnershipTransferred(EventId.generate("owner"), previousOwner, newOwner, Instant.now());
    }
}
