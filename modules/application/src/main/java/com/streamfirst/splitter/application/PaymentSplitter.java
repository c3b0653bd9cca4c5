package com.streamfirst.splitter.application;

import com.streamfirst.splitter.domain.AccountId;
import com.streamfirst.splitter.domain.InvestorRecord;
import com.streamfirst.splitter.ports.AuthorizationPort;
import com.streamfirst.splitter.ports.EventPort;
import com.streamfirst.splitter.ports.TransferPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Single entry point to the splitter: deposits, payee and investor commands, and queries.
 *
 * <p>Every method runs under this object's monitor, so no two operations interleave.
 * Each command either completes or throws a
 * {@link com.streamfirst.splitter.domain.SplitterException} having changed nothing,
 * with one exception: a reimbursement batch that fails part-way keeps the investors
 * it already paid.
 */
@Slf4j
@RequiredArgsConstructor
public class PaymentSplitter {

    private final PooledBalance pooledBalance;
    private final ShareRegistry shareRegistry;
    private final DistributionEngine distributionEngine;
    private final InvestorReimbursementQueue reimbursementQueue;

    /**
     * Wires a splitter with an empty pool over the given ports.
     *
     * @param authorizationPort decides who the owner is
     * @param transferPort moves value out of the pool
     * @param eventPort receives every notification
     * @param topic the topic notifications are published on
     */
    public static PaymentSplitter create(AuthorizationPort authorizationPort, TransferPort transferPort,
                                         EventPort eventPort, String topic) {
        PooledBalance pool = new PooledBalance(eventPort, topic);
        ShareRegistry registry = new ShareRegistry(authorizationPort, eventPort, topic);
        DistributionEngine engine = new DistributionEngine(registry, pool, transferPort, eventPort, topic);
        InvestorReimbursementQueue queue =
            new InvestorReimbursementQueue(authorizationPort, pool, transferPort, eventPort, topic);
        log.debug("Created payment splitter publishing on '{}'", topic);
        return new PaymentSplitter(pool, registry, engine, queue);
    }

    // --- commands ---

    public synchronized long deposit(AccountId from, long amount) {
        return pooledBalance.deposit(from, amount);
    }

    public synchronized void initialize(AccountId caller, List<AccountId> payees, List<Long> shares) {
        shareRegistry.initialize(caller, payees, shares);
    }

    public synchronized long release(AccountId caller, AccountId payee) {
        return distributionEngine.release(caller, payee);
    }

    public synchronized long addProjectFees(AccountId caller, AccountId investor, long feeAmount) {
        return reimbursementQueue.addProjectFees(caller, investor, feeAmount);
    }

    public synchronized long reimburseProjectFees(AccountId caller) {
        return reimbursementQueue.reimburseProjectFees(caller);
    }

    // --- queries ---

    public synchronized long poolBalance() {
        return pooledBalance.current();
    }

    public synchronized boolean isInitialized() {
        return shareRegistry.isInitialized();
    }

    public synchronized long totalShares() {
        return shareRegistry.totalShares();
    }

    public synchronized long totalReleased() {
        return distributionEngine.totalReleased();
    }

    public synchronized long totalReceived() {
        return distributionEngine.totalReceived();
    }

    public synchronized long shares(AccountId payee) {
        return shareRegistry.shares(payee);
    }

    public synchronized long released(AccountId payee) {
        return shareRegistry.released(payee);
    }

    public synchronized long releasable(AccountId payee) {
        return distributionEngine.releasable(payee);
    }

    public synchronized AccountId payeeAt(int index) {
        return shareRegistry.payeeAt(index);
    }

    public synchronized List<AccountId> listPayees() {
        return shareRegistry.listPayees();
    }

    public synchronized long feePoolTotal() {
        return reimbursementQueue.feePoolTotal();
    }

    public synchronized long feeOwed(AccountId investor) {
        return reimbursementQueue.feeOwed(investor);
    }

    public synchronized List<InvestorRecord> listInvestors() {
        return reimbursementQueue.listInvestors();
    }
}
