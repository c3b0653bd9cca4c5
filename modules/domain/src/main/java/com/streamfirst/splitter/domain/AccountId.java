package com.streamfirst.splitter.domain;

import java.util.Objects;

/**
 * Identity of a party that can hold, send or receive value: a payee, an investor,
 * a depositor or the owner. Identities are opaque strings compared by value.
 *
 * <p>The {@link #ZERO} identity is a placeholder that never denotes a real party;
 * it is rejected wherever a payee or investor is registered.
 *
 * @param value the identity string (e.g. "0x5a1f...", "alice")
 */
public record AccountId(String value) {

    /** The null identity. Never a valid payee, investor or owner. */
    public static final AccountId ZERO = new AccountId("0x0000000000000000000000000000000000000000");

    public AccountId {
        Objects.requireNonNull(value, "Account ID cannot be null");
        if (value.trim().isEmpty()) {
            throw new IllegalArgumentException("Account ID cannot be empty");
        }
    }

    public static AccountId of(String value) {
        return new AccountId(value);
    }

    /**
     * Returns true if this is the null identity.
     */
    public boolean isZero() {
        return ZERO.equals(this);
    }

    @Override
    public String toString() {
        return value;
    }
}
