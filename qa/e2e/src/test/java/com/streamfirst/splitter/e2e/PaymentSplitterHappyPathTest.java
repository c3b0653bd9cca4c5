package com.streamfirst.splitter.e2e;

import com.streamfirst.splitter.adapters.InMemoryEventAdapter;
import com.streamfirst.splitter.adapters.InMemoryTransferAdapter;
import com.streamfirst.splitter.application.PaymentSplitter;
import com.streamfirst.splitter.boot.PaymentSplitterApplication;
import com.streamfirst.splitter.boot.SplitterProperties;
import com.streamfirst.splitter.domain.AccountId;
import com.streamfirst.splitter.domain.PaymentReleased;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(classes = PaymentSplitterApplication.class,
    properties = "splitter.demo.enabled=false")
public class PaymentSplitterHappyPathTest {

  @Autowired
  private PaymentSplitter splitter;

  @Autowired
  private InMemoryTransferAdapter transfers;

  @Autowired
  private InMemoryEventAdapter events;

  @Autowired
  private SplitterProperties properties;

  @Test
  void configured_payees_deposit_release_and_reimburse() {
    AccountId owner = AccountId.of(properties.getOwner());
    AccountId alice = AccountId.of("alice");
    AccountId bob = AccountId.of("bob");
    AccountId investor = AccountId.of("seed-investor");

    // Payees come from application.yml
    assertThat(splitter.isInitialized()).isTrue();
    assertThat(splitter.listPayees()).containsExactly(alice, bob);
    assertThat(splitter.totalShares()).isEqualTo(4);

    List<PaymentReleased> seen = new ArrayList<>();
    events.subscribe(properties.getTopic(), PaymentReleased.class, seen::add);

    // Investor is made whole first, then payees split what is left
    splitter.addProjectFees(owner, investor, 20);
    splitter.deposit(AccountId.of("treasury"), 120);
    assertThat(splitter.reimburseProjectFees(owner)).isEqualTo(20);

    assertThat(splitter.release(alice, alice)).isEqualTo(25);
    assertThat(splitter.release(bob, bob)).isEqualTo(75);

    assertThat(splitter.poolBalance()).isZero();
    assertThat(transfers.creditedTo(investor)).isEqualTo(20);
    assertThat(seen).extracting(PaymentReleased::to).containsExactly(alice, bob);
  }
}
