package com.streamfirst.splitter.application;

import com.streamfirst.splitter.adapters.InMemoryAuthorizationAdapter;
import com.streamfirst.splitter.adapters.InMemoryEventAdapter;
import com.streamfirst.splitter.adapters.InMemoryTransferAdapter;
import com.streamfirst.splitter.domain.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InvestorReimbursementQueueTest {

    private static final String TOPIC = SplitterEvent.DEFAULT_TOPIC;
    private static final AccountId OWNER = AccountId.of("owner");
    private static final AccountId DEPOSITOR = AccountId.of("treasury");
    private static final AccountId I1 = AccountId.of("investor-1");
    private static final AccountId I2 = AccountId.of("investor-2");
    private static final AccountId I3 = AccountId.of("investor-3");

    private InMemoryEventAdapter events;
    private InMemoryTransferAdapter transfers;
    private PooledBalance pool;
    private InvestorReimbursementQueue queue;

    @BeforeEach
    void setUp() {
        events = new InMemoryEventAdapter();
        transfers = new InMemoryTransferAdapter();
        pool = new PooledBalance(events, TOPIC);
        queue = new InvestorReimbursementQueue(
            new InMemoryAuthorizationAdapter(OWNER, events, TOPIC), pool, transfers, events, TOPIC);
    }

    @Test
    void reimbursesRegisteredFeeFromPool() {
        queue.addProjectFees(OWNER, I1, 40);
        pool.deposit(DEPOSITOR, 40);

        assertThat(queue.reimburseProjectFees(OWNER)).isEqualTo(40);

        assertThat(transfers.creditedTo(I1)).isEqualTo(40);
        assertThat(queue.feePoolTotal()).isZero();
        assertThat(queue.feeOwed(I1)).isZero();
        assertThat(pool.current()).isZero();
        assertThat(queue.findInvestor(I1).orElseThrow().getStatus()).isEqualTo(InvestorRecord.Status.CLEARED);
        assertThat(events.history(TOPIC, ProjectFeesReimbursed.class))
            .singleElement()
            .extracting(ProjectFeesReimbursed::amount).isEqualTo(40L);
    }

    @Test
    void repeatedRegistrationIsAdditiveAndKeepsOneRecord() {
        queue.addProjectFees(OWNER, I1, 40);
        assertThat(queue.addProjectFees(OWNER, I1, 10)).isEqualTo(50);
        queue.addProjectFees(OWNER, I2, 5);

        assertThat(queue.feeOwed(I1)).isEqualTo(50);
        assertThat(queue.feePoolTotal()).isEqualTo(55);
        assertThat(queue.listInvestors())
            .extracting(InvestorRecord::getInvestor)
            .containsExactly(I1, I2);

        long activeSum = queue.listInvestors().stream()
            .filter(InvestorRecord::isActive)
            .mapToLong(InvestorRecord::getFeeOwed)
            .sum();
        assertThat(queue.feePoolTotal()).isEqualTo(activeSum);
    }

    @Test
    void repeatedReimbursementFindsNothingOwedAndTransfersNothing() {
        queue.addProjectFees(OWNER, I1, 40);
        pool.deposit(DEPOSITOR, 100);
        queue.reimburseProjectFees(OWNER);

        assertThatThrownBy(() -> queue.reimburseProjectFees(OWNER))
            .isInstanceOf(EconomicException.class)
            .extracting("errorCode").isEqualTo(ErrorCode.NO_FEES_OWED);
        assertThat(transfers.getReceipts()).hasSize(1);
        assertThat(pool.current()).isEqualTo(60);
    }

    @Test
    void clearedInvestorsAreSkippedWhenNewFeesArrive() {
        queue.addProjectFees(OWNER, I1, 40);
        pool.deposit(DEPOSITOR, 40);
        queue.reimburseProjectFees(OWNER);

        queue.addProjectFees(OWNER, I2, 30);
        pool.deposit(DEPOSITOR, 30);
        assertThat(queue.reimburseProjectFees(OWNER)).isEqualTo(30);

        assertThat(transfers.creditedTo(I1)).isEqualTo(40);
        assertThat(transfers.creditedTo(I2)).isEqualTo(30);
        assertThat(queue.listInvestors()).hasSize(2).noneMatch(InvestorRecord::isActive);
    }

    @Test
    void clearedInvestorCanBeOwedAgain() {
        queue.addProjectFees(OWNER, I1, 40);
        pool.deposit(DEPOSITOR, 40);
        queue.reimburseProjectFees(OWNER);

        assertThat(queue.addProjectFees(OWNER, I1, 15)).isEqualTo(15);
        assertThat(queue.feePoolTotal()).isEqualTo(15);
        assertThat(queue.listInvestors()).hasSize(1);
    }

    @Test
    void poolMustCoverEveryFeeBeforeAnythingIsPaid() {
        queue.addProjectFees(OWNER, I1, 40);
        queue.addProjectFees(OWNER, I2, 20);

        assertThatThrownBy(() -> queue.reimburseProjectFees(OWNER))
            .isInstanceOf(EconomicException.class)
            .extracting("errorCode").isEqualTo(ErrorCode.EMPTY_POOL);

        pool.deposit(DEPOSITOR, 59);
        assertThatThrownBy(() -> queue.reimburseProjectFees(OWNER))
            .isInstanceOf(EconomicException.class)
            .extracting("errorCode").isEqualTo(ErrorCode.INSUFFICIENT_POOL);
        assertThat(transfers.getReceipts()).isEmpty();
        assertThat(pool.current()).isEqualTo(59);
    }

    @Test
    void failedTransferStopsBatchButKeepsEarlierReimbursements() {
        queue.addProjectFees(OWNER, I1, 10);
        queue.addProjectFees(OWNER, I2, 20);
        queue.addProjectFees(OWNER, I3, 30);
        pool.deposit(DEPOSITOR, 100);
        transfers.rejectTransfersTo(I2);

        assertThatThrownBy(() -> queue.reimburseProjectFees(OWNER))
            .isInstanceOf(EconomicException.class)
            .extracting("errorCode").isEqualTo(ErrorCode.TRANSFER_FAILED);

        assertThat(transfers.creditedTo(I1)).isEqualTo(10);
        assertThat(transfers.creditedTo(I3)).isZero();
        assertThat(queue.feeOwed(I1)).isZero();
        assertThat(queue.feeOwed(I2)).isEqualTo(20);
        assertThat(queue.feeOwed(I3)).isEqualTo(30);
        assertThat(queue.feePoolTotal()).isEqualTo(50);
        assertThat(pool.current()).isEqualTo(90);

        transfers.acceptTransfersTo(I2);
        assertThat(queue.reimburseProjectFees(OWNER)).isEqualTo(50);
        assertThat(transfers.creditedTo(I1)).isEqualTo(10);
        assertThat(pool.current()).isEqualTo(40);
    }

    @Test
    void neverTransfersMoreThanThePoolHeld() {
        queue.addProjectFees(OWNER, I1, 25);
        queue.addProjectFees(OWNER, I2, 35);
        pool.deposit(DEPOSITOR, 70);
        long poolBefore = pool.current();

        long reimbursed = queue.reimburseProjectFees(OWNER);

        assertThat(reimbursed).isEqualTo(60).isLessThanOrEqualTo(poolBefore);
        assertThat(pool.current()).isEqualTo(poolBefore - reimbursed);
    }

    @Test
    void onlyOwnerManagesFees() {
        assertThatThrownBy(() -> queue.addProjectFees(I1, I1, 40))
            .isInstanceOf(AuthorizationException.class)
            .extracting("errorCode").isEqualTo(ErrorCode.NOT_OWNER);
        assertThatThrownBy(() -> queue.reimburseProjectFees(I1))
            .isInstanceOf(AuthorizationException.class);
        assertThat(queue.feePoolTotal()).isZero();
    }

    @Test
    void invalidFeeRegistrationIsRejected() {
        assertThatThrownBy(() -> queue.addProjectFees(OWNER, AccountId.ZERO, 10))
            .extracting("errorCode").isEqualTo(ErrorCode.INVALID_IDENTITY);
        assertThatThrownBy(() -> queue.addProjectFees(OWNER, I1, 0))
            .extracting("errorCode").isEqualTo(ErrorCode.INVALID_AMOUNT);
        assertThat(queue.listInvestors()).isEmpty();
        assertThat(events.history(TOPIC, ProjectFeesAdded.class)).isEmpty();
    }
}
