package com.streamfirst.splitter.application;

import com.streamfirst.splitter.domain.*;
import com.streamfirst.splitter.ports.EventPort;
import com.streamfirst.splitter.ports.TransferPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;

/**
 * Pays registered payees their proportional share of everything the pool has ever received.
 * Payees pull their own funds; nothing is pushed.
 *
 * <p>Entitlement is {@code floor(totalReceived * shares / totalShares)} where
 * {@code totalReceived = poolBalance + totalReleased}. Rounding remainders stay in the pool
 * and become payable once the entitlement crosses the next whole unit.
 */
@Slf4j
@RequiredArgsConstructor
public class DistributionEngine {

    private final ShareRegistry shareRegistry;
    private final PooledBalance pooledBalance;
    private final TransferPort transferPort;
    private final EventPort eventPort;
    private final String topic;

    private long totalReleased;

    /**
     * Releases to a payee whatever it is owed right now.
     *
     * @param caller the identity performing the call; must be the payee itself
     * @param payee the payee whose funds are released
     * @return the amount transferred, always positive
     * @throws AuthorizationException if the caller is not the payee
     * @throws ValidationException if the payee holds no shares
     * @throws EconomicException if nothing is due or the transfer fails
     */
    public long release(AccountId caller, AccountId payee) {
        if (caller == null || !caller.equals(payee)) {
            log.warn("Rejected release for {} requested by {}", payee, caller);
            throw new AuthorizationException(ErrorCode.NOT_SELF,
                "Only " + payee + " can release its own payment");
        }
        long shares = shareRegistry.shares(payee);
        if (shares == 0) {
            throw new ValidationException(ErrorCode.NO_SHARES, "Account " + payee + " has no shares");
        }

        long payment = pendingPayment(payee, shares);
        if (payment <= 0) {
            log.debug("No payment due to {}", payee);
            throw new EconomicException(ErrorCode.NO_PAYMENT_DUE, "Account " + payee + " is not due payment");
        }
        if (payment > pooledBalance.current()) {
            throw new EconomicException(ErrorCode.INSUFFICIENT_POOL,
                "Pool balance " + pooledBalance.current() + " cannot cover payment " + payment);
        }

        Result<TransferReceipt> transfer = transferPort.transfer(payee, payment);
        if (transfer.isFailure()) {
            log.warn("Transfer of {} to {} failed: {}", payment, payee, transfer);
            throw new EconomicException(ErrorCode.TRANSFER_FAILED,
                "Transfer to " + payee + " failed: " + transfer.getErrorMessage().orElse("unknown error"));
        }

        shareRegistry.recordPayment(payee, payment);
        totalReleased = Math.addExact(totalReleased, payment);
        pooledBalance.debit(payment);
        eventPort.publish(topic, PaymentReleased.of(payee, payment));

        log.info("Released {} to {} - total released {}, pool balance {}",
                 payment, payee, totalReleased, pooledBalance.current());
        return payment;
    }

    /**
     * Gets the amount a release by the payee would pay right now, or 0 if none.
     */
    public long releasable(AccountId payee) {
        long shares = shareRegistry.shares(payee);
        if (shares == 0) {
            return 0L;
        }
        return Math.max(0L, pendingPayment(payee, shares));
    }

    public long totalReleased() {
        return totalReleased;
    }

    /**
     * Gets everything the pool has received over its lifetime, net of reimbursements.
     */
    public long totalReceived() {
        return Math.addExact(pooledBalance.current(), totalReleased);
    }

    // may be negative once reimbursements have shrunk the pool below a payee's earlier entitlement
    private long pendingPayment(AccountId payee, long shares) {
        long entitlement = BigInteger.valueOf(totalReceived())
            .multiply(BigInteger.valueOf(shares))
            .divide(BigInteger.valueOf(shareRegistry.totalShares()))
            .longValueExact();
        log.debug("Payee {} holds {}/{} shares of {} received - entitled to {}",
                  payee, shares, shareRegistry.totalShares(), totalReceived(), entitlement);
        return entitlement - shareRegistry.released(payee);
    }
}
