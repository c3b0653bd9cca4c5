package com.streamfirst.splitter.domain;

import lombok.NonNull;
import lombok.Value;
import lombok.With;

/**
 * Fees owed to a prior contributor, repaid from the pool ahead of nothing else.
 * A record is never removed once created; after reimbursement it is tagged
 * {@link Status#CLEARED} and skipped by later reimbursement runs.
 */
@Value
public class InvestorRecord {

    public enum Status {
        /** Fee is still owed */
        ACTIVE,
        /** Fee has been reimbursed; the slot is kept for ordering only */
        CLEARED
    }

    @NonNull AccountId investor;

    @With long feeOwed;

    @NonNull @With Status status;

    public static InvestorRecord owing(AccountId investor, long fee) {
        return new InvestorRecord(investor, fee, Status.ACTIVE);
    }

    public boolean isActive() {
        return status == Status.ACTIVE;
    }

    /**
     * Adds more fees to this record. A cleared record becomes active again and owes only the new amount.
     */
    public InvestorRecord plusFee(long fee) {
        if (isActive()) {
            return withFeeOwed(Math.addExact(feeOwed, fee));
        }
        return owing(investor, fee);
    }

    /**
     * Returns the cleared form of this record, owing nothing.
     */
    public InvestorRecord cleared() {
        return new InvestorRecord(investor, 0L, Status.CLEARED);
    }
}
