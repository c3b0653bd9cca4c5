package com.streamfirst.splitter.adapters;

import com.streamfirst.splitter.domain.AccountId;
import com.streamfirst.splitter.domain.Result;
import com.streamfirst.splitter.domain.TransferReceipt;
import com.streamfirst.splitter.ports.TransferPort;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory implementation of TransferPort for testing and development.
 * Credits destinations in a local ledger and keeps every receipt. Destinations can be
 * marked as rejecting so that callers can exercise their failure paths.
 */
@Slf4j
public class InMemoryTransferAdapter implements TransferPort {

    private final Map<AccountId, Long> credited = new ConcurrentHashMap<>();
    private final Set<AccountId> rejectedDestinations = ConcurrentHashMap.newKeySet();
    private final List<TransferReceipt> receipts = new CopyOnWriteArrayList<>();
    private final AtomicLong transferCounter = new AtomicLong(1);

    @Override
    public Result<TransferReceipt> transfer(AccountId destination, long amount) {
        if (destination == null || destination.isZero()) {
            return Result.failure("Cannot transfer to an empty destination", "INVALID_DESTINATION");
        }
        if (amount <= 0) {
            return Result.failure("Transfer amount must be positive: " + amount, "INVALID_AMOUNT");
        }
        if (rejectedDestinations.contains(destination)) {
            log.warn("Destination {} rejected transfer of {}", destination, amount);
            return Result.failure("Destination " + destination + " rejected the transfer", "DESTINATION_REJECTED");
        }

        credited.merge(destination, amount, Math::addExact);
        TransferReceipt receipt = new TransferReceipt(
            "tx-" + transferCounter.getAndIncrement(), destination, amount, Instant.now());
        receipts.add(receipt);

        log.debug("Transferred {} to {} ({})", amount, destination, receipt.transferId());
        return Result.success(receipt);
    }

    /**
     * Makes every later transfer to the destination fail.
     */
    public void rejectTransfersTo(AccountId destination) {
        log.info("Transfers to {} will be rejected", destination);
        rejectedDestinations.add(destination);
    }

    /**
     * Lets transfers to a previously rejecting destination succeed again.
     */
    public void acceptTransfersTo(AccountId destination) {
        log.info("Transfers to {} will be accepted", destination);
        rejectedDestinations.remove(destination);
    }

    /**
     * Gets the total amount ever credited to a destination.
     */
    public long creditedTo(AccountId destination) {
        return credited.getOrDefault(destination, 0L);
    }

    /**
     * Gets all completed transfers in completion order.
     */
    public List<TransferReceipt> getReceipts() {
        return List.copyOf(receipts);
    }
}
