package com.streamfirst.splitter.domain;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PayeeTest {

    @Test
    void paymentsOnlyGrowTheReleasedTotal() {
        Payee payee = Payee.register(AccountId.of("alice"), 3);

        Payee paid = payee.withPayment(25).withPayment(5);

        assertThat(payee.getReleased()).isZero();
        assertThat(paid.getReleased()).isEqualTo(30);
        assertThat(paid.getShares()).isEqualTo(3);
        assertThat(paid.getId()).isEqualTo(payee.getId());
    }

    @Test
    void releasedTotalOverflowIsDetected() {
        Payee payee = Payee.register(AccountId.of("alice"), 1).withReleased(Long.MAX_VALUE);

        assertThatThrownBy(() -> payee.withPayment(1)).isInstanceOf(ArithmeticException.class);
    }
}
