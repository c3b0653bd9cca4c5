package com.streamfirst.splitter.adapters;

import com.streamfirst.splitter.domain.AccountId;
import com.streamfirst.splitter.domain.AuthorizationException;
import com.streamfirst.splitter.domain.ErrorCode;
import com.streamfirst.splitter.domain.OwnershipTransferred;
import com.streamfirst.splitter.domain.ValidationException;
import com.streamfirst.splitter.ports.AuthorizationPort;
import com.streamfirst.splitter.ports.EventPort;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;
import java.util.Optional;

/**
 * In-memory single-owner capability. The owner can hand the capability to another
 * identity or give it up entirely; after renouncing, no caller is authorized.
 */
@Slf4j
public class InMemoryAuthorizationAdapter implements AuthorizationPort {

    private final EventPort eventPort;
    private final String topic;
    private volatile AccountId owner;

    public InMemoryAuthorizationAdapter(AccountId initialOwner, EventPort eventPort, String topic) {
        Objects.requireNonNull(initialOwner, "Initial owner cannot be null");
        if (initialOwner.isZero()) {
            throw new ValidationException(ErrorCode.INVALID_IDENTITY, "Initial owner cannot be the zero identity");
        }
        this.eventPort = Objects.requireNonNull(eventPort, "Event port cannot be null");
        this.topic = Objects.requireNonNull(topic, "Topic cannot be null");
        this.owner = initialOwner;
        eventPort.publish(topic, OwnershipTransferred.of(null, initialOwner));
        log.info("Owner capability granted to {}", initialOwner);
    }

    @Override
    public boolean isAuthorized(AccountId caller) {
        AccountId current = owner;
        return current != null && current.equals(caller);
    }

    @Override
    public Optional<AccountId> owner() {
        return Optional.ofNullable(owner);
    }

    /**
     * Hands the owner capability to another identity.
     *
     * @param caller must be the current owner
     * @param newOwner the next owner; must not be the zero identity
     */
    public synchronized void transferOwnership(AccountId caller, AccountId newOwner) {
        requireOwner(caller);
        if (newOwner == null || newOwner.isZero()) {
            throw new ValidationException(ErrorCode.INVALID_IDENTITY, "New owner cannot be the zero identity");
        }
        AccountId previous = owner;
        owner = newOwner;
        eventPort.publish(topic, OwnershipTransferred.of(previous, newOwner));
        log.info("Ownership transferred from {} to {}", previous, newOwner);
    }

    /**
     * Gives up the owner capability permanently. Administrative operations become unavailable.
     */
    public synchronized void renounceOwnership(AccountId caller) {
        requireOwner(caller);
        AccountId previous = owner;
        owner = null;
        eventPort.publish(topic, OwnershipTransferred.of(previous, AccountId.ZERO));
        log.warn("Ownership renounced by {}", previous);
    }

    private void requireOwner(AccountId caller) {
        if (!isAuthorized(caller)) {
            log.warn("Rejected ownership change requested by non-owner {}", caller);
            throw new AuthorizationException(ErrorCode.NOT_OWNER, "Caller " + caller + " is not the owner");
        }
    }
}
