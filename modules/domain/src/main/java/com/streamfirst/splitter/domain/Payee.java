package com.streamfirst.splitter.domain;

import lombok.NonNull;
import lombok.Value;
import lombok.With;

/**
 * A registered stakeholder entitled to a proportional share of the pool.
 * Identity and share weight are fixed at registration; only the released total grows.
 */
@Value
public class Payee {

    /** Who receives the payments */
    @NonNull AccountId id;

    /** Positive weight used to compute the proportional entitlement */
    long shares;

    /** Cumulative amount already paid out to this payee */
    @With long released;

    /**
     * Creates a freshly registered payee with nothing released yet.
     */
    public static Payee register(AccountId id, long shares) {
        return new Payee(id, shares, 0L);
    }

    /**
     * Returns a copy of this payee with the given payment added to its released total.
     */
    public Payee withPayment(long amount) {
        return withReleased(Math.addExact(released, amount));
    }
}
