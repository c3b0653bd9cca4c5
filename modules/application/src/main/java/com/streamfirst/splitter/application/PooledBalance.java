package com.streamfirst.splitter.application;

import com.streamfirst.splitter.domain.AccountId;
import com.streamfirst.splitter.domain.EconomicException;
import com.streamfirst.splitter.domain.ErrorCode;
import com.streamfirst.splitter.domain.PaymentReceived;
import com.streamfirst.splitter.domain.ValidationException;
import com.streamfirst.splitter.ports.EventPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * The value currently held by the splitter. Anyone may deposit into it; it is only
 * ever decreased by a completed transfer issued from a release or a reimbursement,
 * which is why {@link #debit(long)} is package-private.
 */
@Slf4j
@RequiredArgsConstructor
public class PooledBalance {

    private final EventPort eventPort;
    private final String topic;

    private long balance;

    /**
     * Accepts an external deposit. Emits a {@code PaymentReceived} notification and nothing else.
     *
     * @param from the depositor
     * @param amount positive amount in the pool's base unit
     * @return the balance after the deposit
     */
    public long deposit(AccountId from, long amount) {
        if (from == null) {
            throw new ValidationException(ErrorCode.INVALID_IDENTITY, "Depositor cannot be null");
        }
        if (amount <= 0) {
            throw new ValidationException(ErrorCode.INVALID_AMOUNT, "Deposit amount must be positive: " + amount);
        }
        balance = Math.addExact(balance, amount);
        eventPort.publish(topic, PaymentReceived.of(from, amount));
        log.info("Received {} from {} - pool balance is now {}", amount, from, balance);
        return balance;
    }

    public long current() {
        return balance;
    }

    void debit(long amount) {
        if (amount > balance) {
            // unreachable while callers check entitlement and fee coverage first
            throw new EconomicException(ErrorCode.INSUFFICIENT_POOL,
                "Cannot debit " + amount + " from pool balance " + balance);
        }
        balance -= amount;
    }
}
