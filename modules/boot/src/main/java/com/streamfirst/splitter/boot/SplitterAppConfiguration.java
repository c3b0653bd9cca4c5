package com.streamfirst.splitter.boot;

import com.streamfirst.splitter.adapters.InMemoryAuthorizationAdapter;
import com.streamfirst.splitter.adapters.InMemoryEventAdapter;
import com.streamfirst.splitter.adapters.InMemoryTransferAdapter;
import com.streamfirst.splitter.application.PaymentSplitter;
import com.streamfirst.splitter.domain.AccountId;
import com.streamfirst.splitter.domain.PaymentReleased;
import com.streamfirst.splitter.domain.SplitterException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Wires the in-memory adapters into the splitter and optionally registers the configured payees.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(SplitterProperties.class)
public class SplitterAppConfiguration {

    // --- Adapter Beans ---

    @Bean
    public InMemoryEventAdapter eventPort() {
        return new InMemoryEventAdapter();
    }

    @Bean
    public InMemoryAuthorizationAdapter authorizationPort(SplitterProperties properties, InMemoryEventAdapter eventPort) {
        if (properties.getOwner() == null || properties.getOwner().isBlank()) {
            throw new IllegalStateException("splitter.owner must be configured");
        }
        return new InMemoryAuthorizationAdapter(AccountId.of(properties.getOwner()), eventPort, properties.getTopic());
    }

    @Bean
    public InMemoryTransferAdapter transferPort() {
        return new InMemoryTransferAdapter();
    }

    // --- Application Service Beans ---

    @Bean
    public PaymentSplitter paymentSplitter(SplitterProperties properties,
                                           InMemoryAuthorizationAdapter authorizationPort,
                                           InMemoryTransferAdapter transferPort,
                                           InMemoryEventAdapter eventPort) {
        PaymentSplitter splitter = PaymentSplitter.create(authorizationPort, transferPort, eventPort, properties.getTopic());
        if (!properties.getPayees().isEmpty()) {
            List<AccountId> ids = properties.getPayees().stream()
                .map(p -> AccountId.of(p.getId()))
                .toList();
            List<Long> shares = properties.getPayees().stream()
                .map(SplitterProperties.PayeeEntry::getShares)
                .toList();
            splitter.initialize(AccountId.of(properties.getOwner()), ids, shares);
            log.info("Registered {} configured payees", ids.size());
        }
        return splitter;
    }

    // --- Demo Runner ---

    @Bean
    @ConditionalOnProperty(prefix = "splitter.demo", name = "enabled", havingValue = "true")
    public CommandLineRunner demo(SplitterProperties properties, PaymentSplitter splitter,
                                  InMemoryEventAdapter eventPort) {
        return args -> {
            log.info("--- Starting payment splitter demo ---");
            eventPort.subscribe(properties.getTopic(), PaymentReleased.class,
                event -> log.info("  -> {} received {}", event.to(), event.amount()));

            splitter.deposit(AccountId.of(properties.getDemo().getDepositor()), properties.getDemo().getDepositAmount());
            log.info("Deposited {} - pool balance {}", properties.getDemo().getDepositAmount(), splitter.poolBalance());

            for (AccountId payee : splitter.listPayees()) {
                try {
                    splitter.release(payee, payee);
                } catch (SplitterException e) {
                    log.warn("Release for {} rejected: {}", payee, e.toString());
                }
            }
            log.info("--- Demo finished: total released {}, pool balance {} ---",
                     splitter.totalReleased(), splitter.poolBalance());
        };
    }
}
