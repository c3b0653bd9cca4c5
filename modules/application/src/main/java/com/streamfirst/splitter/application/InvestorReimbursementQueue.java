package com.streamfirst.splitter.application;

import com.streamfirst.splitter.domain.*;
import com.streamfirst.splitter.ports.AuthorizationPort;
import com.streamfirst.splitter.ports.EventPort;
import com.streamfirst.splitter.ports.TransferPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Tracks project fees owed to prior contributors and repays them from the shared pool.
 *
 * <p>Fees are additive: registering the same investor again increases what it is owed.
 * Each investor has exactly one record, kept in registration order. Reimbursed records
 * are tagged cleared rather than removed, and later runs skip them.
 */
@Slf4j
@RequiredArgsConstructor
public class InvestorReimbursementQueue {

    private final AuthorizationPort authorizationPort;
    private final PooledBalance pooledBalance;
    private final TransferPort transferPort;
    private final EventPort eventPort;
    private final String topic;

    private final Map<AccountId, InvestorRecord> investors = new LinkedHashMap<>();
    private long feePoolTotal;

    /**
     * Records fees owed to an investor.
     *
     * @param caller the identity performing the call; must be the owner
     * @param investor who is owed the fee
     * @param feeAmount positive amount to add to the investor's outstanding fee
     * @return the investor's outstanding fee after the addition
     */
    public long addProjectFees(AccountId caller, AccountId investor, long feeAmount) {
        requireOwner(caller);
        if (investor == null || investor.isZero()) {
            throw new ValidationException(ErrorCode.INVALID_IDENTITY, "Investor is the zero identity");
        }
        if (feeAmount <= 0) {
            throw new ValidationException(ErrorCode.INVALID_AMOUNT, "Fee amount must be positive: " + feeAmount);
        }

        long newTotal = Math.addExact(feePoolTotal, feeAmount);
        InvestorRecord record = investors.containsKey(investor)
            ? investors.get(investor).plusFee(feeAmount)
            : InvestorRecord.owing(investor, feeAmount);
        investors.put(investor, record);
        feePoolTotal = newTotal;

        eventPort.publish(topic, ProjectFeesAdded.of(investor, feeAmount, record.getFeeOwed()));
        log.info("Added {} in fees for investor {} - investor owed {}, fee pool {}",
                 feeAmount, investor, record.getFeeOwed(), feePoolTotal);
        return record.getFeeOwed();
    }

    /**
     * Repays every outstanding investor fee, in registration order.
     * The pool must cover the whole fee pool before anything is paid. If a transfer fails,
     * the remaining investors are left owed and investors already paid by this call stay paid.
     *
     * @param caller the identity performing the call; must be the owner
     * @return the total amount reimbursed
     * @throws EconomicException if nothing is owed, the pool cannot cover the fees, or a transfer fails
     */
    public long reimburseProjectFees(AccountId caller) {
        requireOwner(caller);
        long pool = pooledBalance.current();
        if (feePoolTotal == 0) {
            throw new EconomicException(ErrorCode.NO_FEES_OWED, "No project fees are owed");
        }
        if (pool == 0) {
            throw new EconomicException(ErrorCode.EMPTY_POOL, "Pool balance is zero");
        }
        if (pool < feePoolTotal) {
            log.warn("Pool balance {} cannot cover fee pool {}", pool, feePoolTotal);
            throw new EconomicException(ErrorCode.INSUFFICIENT_POOL,
                "Pool balance " + pool + " is less than owed fees " + feePoolTotal);
        }

        long reimbursed = 0;
        for (Map.Entry<AccountId, InvestorRecord> entry : investors.entrySet()) {
            InvestorRecord record = entry.getValue();
            if (!record.isActive()) {
                continue;
            }
            long fee = record.getFeeOwed();
            Result<TransferReceipt> transfer = transferPort.transfer(record.getInvestor(), fee);
            if (transfer.isFailure()) {
                log.warn("Reimbursement of {} to {} failed after {} was reimbursed: {}",
                         fee, record.getInvestor(), reimbursed, transfer);
                throw new EconomicException(ErrorCode.TRANSFER_FAILED,
                    "Reimbursement to " + record.getInvestor() + " failed: "
                        + transfer.getErrorMessage().orElse("unknown error"));
            }

            pooledBalance.debit(fee);
            feePoolTotal -= fee;
            entry.setValue(record.cleared());
            reimbursed += fee;
            eventPort.publish(topic, ProjectFeesReimbursed.of(record.getInvestor(), fee));
            log.debug("Reimbursed {} to investor {}", fee, record.getInvestor());
        }

        log.info("Reimbursed {} in project fees - fee pool {}, pool balance {}",
                 reimbursed, feePoolTotal, pooledBalance.current());
        return reimbursed;
    }

    public long feePoolTotal() {
        return feePoolTotal;
    }

    /**
     * Gets the outstanding fee of an investor, or 0 if it has none.
     */
    public long feeOwed(AccountId investor) {
        return findInvestor(investor).map(InvestorRecord::getFeeOwed).orElse(0L);
    }

    public Optional<InvestorRecord> findInvestor(AccountId investor) {
        return Optional.ofNullable(investors.get(investor));
    }

    /**
     * Gets every investor record, cleared ones included, in registration order.
     */
    public List<InvestorRecord> listInvestors() {
        return List.copyOf(investors.values());
    }

    private void requireOwner(AccountId caller) {
        if (!authorizationPort.isAuthorized(caller)) {
            log.warn("Rejected fee operation by non-owner {}", caller);
            throw new AuthorizationException(ErrorCode.NOT_OWNER, "Caller " + caller + " is not the owner");
        }
    }
}
